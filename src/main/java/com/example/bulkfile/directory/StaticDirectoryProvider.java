package com.example.bulkfile.directory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Directory snapshot exported to a JSON file:
 * <pre>{ "domain": "CORP", "groups": { "finance": ["alice", "bob"] } }</pre>
 * Group keys are matched case-insensitively.
 */
public final class StaticDirectoryProvider implements DirectoryProvider {
    private final String domain;
    private final Map<String, List<String>> groups;

    public StaticDirectoryProvider(String domain, Map<String, List<String>> groups) {
        this.domain = domain;
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        groups.forEach((key, members) -> normalized.put(key.toLowerCase(Locale.ROOT),
                members == null ? List.of() : List.copyOf(members)));
        this.groups = Map.copyOf(normalized);
    }

    public static StaticDirectoryProvider load(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        RawDirectory raw = mapper.readValue(path.toFile(), RawDirectory.class);
        return new StaticDirectoryProvider(raw.domain, raw.groups == null ? Map.of() : raw.groups);
    }

    @Override
    public List<String> fetchGroup(String key) {
        return groups.getOrDefault(key.toLowerCase(Locale.ROOT), List.of());
    }

    @Override
    public String currentDomain() throws DirectoryUnavailableException {
        if (domain == null || domain.isBlank()) {
            throw new DirectoryUnavailableException("Directory file does not declare a domain");
        }
        return domain;
    }

    private static class RawDirectory {
        public String domain;
        public Map<String, List<String>> groups = new LinkedHashMap<>();
    }
}
