package com.example.bulkfile;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads {@link EngineConfig} from JSON. Absent fields get defaults; values that are present
 * are kept as written so {@link EngineConfig#validate()} can reject them.
 */
public class ConfigLoader {
    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public EngineConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        int batchSize = raw.batchSize != null ? raw.batchSize : EngineConfig.DEFAULT_BATCH_SIZE;
        int maxWorkers = raw.maxWorkers != null ? raw.maxWorkers : 0;
        int cacheTtlSeconds = raw.cacheTtlSeconds != null
                ? raw.cacheTtlSeconds
                : EngineConfig.DEFAULT_CACHE_TTL_SECONDS;
        int progressInterval = raw.progressIntervalSeconds != null
                ? raw.progressIntervalSeconds
                : EngineConfig.DEFAULT_PROGRESS_INTERVAL_SECONDS;
        int maxReportedFailures = raw.maxReportedFailures != null
                ? raw.maxReportedFailures
                : EngineConfig.DEFAULT_MAX_REPORTED_FAILURES;

        RawIdentity rawIdentity = raw.identity == null ? new RawIdentity() : raw.identity;
        IdentityPolicy identity = new IdentityPolicy(
                Optional.ofNullable(rawIdentity.domain),
                rawIdentity.fallbackGroup,
                rawIdentity.defaultIdentity,
                rawIdentity.tagAliases
        );

        Path baseDirectory = path.toAbsolutePath().getParent();
        return new EngineConfig(
                batchSize,
                maxWorkers,
                cacheTtlSeconds,
                Optional.ofNullable(raw.cap),
                progressInterval,
                maxReportedFailures,
                identity,
                optionalPath(baseDirectory, raw.directoryFile),
                optionalPath(baseDirectory, raw.reportFile)
        );
    }

    private Optional<Path> optionalPath(Path baseDirectory, String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        Path candidate = Path.of(value);
        if (candidate.isAbsolute() || baseDirectory == null) {
            return Optional.of(candidate);
        }
        return Optional.of(baseDirectory.resolve(candidate));
    }

    private static class RawConfig {
        public Integer batchSize;
        public Integer maxWorkers;
        public Integer cacheTtlSeconds;
        public Long cap;
        public Integer progressIntervalSeconds;
        public Integer maxReportedFailures;
        public String directoryFile;
        public String reportFile;
        public RawIdentity identity;
    }

    private static class RawIdentity {
        public String domain;
        public String fallbackGroup;
        public String defaultIdentity;
        public Map<String, String> tagAliases = new LinkedHashMap<>();
    }
}
