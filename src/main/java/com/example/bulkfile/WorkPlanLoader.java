package com.example.bulkfile;

import com.example.bulkfile.model.WorkItem;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a materialised work plan: a JSON array of items produced by an upstream generator.
 */
public final class WorkPlanLoader {
    private static final TypeReference<List<WorkItem>> PLAN = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public WorkPlanLoader() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<WorkItem> load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            List<WorkItem> items = mapper.readValue(reader, PLAN);
            return items == null ? List.of() : List.copyOf(items);
        }
    }
}
