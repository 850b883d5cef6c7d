package com.example.bulkfile;

import com.example.bulkfile.model.Summary;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists the run summary to a single JSON file.
 */
public final class RunReportWriter {
    private final ObjectMapper mapper;

    public RunReportWriter() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    /**
     * Writes the summary, creating the parent directories if needed.
     */
    public void write(Path reportPath, Summary summary) throws IOException {
        Path parent = reportPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), summary);
    }
}
