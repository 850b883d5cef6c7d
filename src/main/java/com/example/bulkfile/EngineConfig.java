package com.example.bulkfile;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Immutable runtime settings for the engine. Every field has a safe default.
 */
public record EngineConfig(
        int batchSize,
        int maxWorkers,
        int cacheTtlSeconds,
        Optional<Long> cap,
        int progressIntervalSeconds,
        int maxReportedFailures,
        IdentityPolicy identity,
        Optional<Path> directoryFile,
        Optional<Path> reportFile
) {
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final int DEFAULT_CACHE_TTL_SECONDS = 300;
    public static final int DEFAULT_PROGRESS_INTERVAL_SECONDS = 5;
    public static final int DEFAULT_MAX_REPORTED_FAILURES = 1000;

    public EngineConfig {
        cap = cap == null ? Optional.empty() : cap;
        identity = identity == null ? IdentityPolicy.defaults() : identity;
        directoryFile = directoryFile == null ? Optional.empty() : directoryFile;
        reportFile = reportFile == null ? Optional.empty() : reportFile;
    }

    public static EngineConfig defaults() {
        return new EngineConfig(
                DEFAULT_BATCH_SIZE,
                0,
                DEFAULT_CACHE_TTL_SECONDS,
                Optional.empty(),
                DEFAULT_PROGRESS_INTERVAL_SECONDS,
                DEFAULT_MAX_REPORTED_FAILURES,
                IdentityPolicy.defaults(),
                Optional.empty(),
                Optional.empty()
        );
    }

    public EngineConfig withBatchSize(int value) {
        return new EngineConfig(value, maxWorkers, cacheTtlSeconds, cap, progressIntervalSeconds,
                maxReportedFailures, identity, directoryFile, reportFile);
    }

    public EngineConfig withMaxWorkers(int value) {
        return new EngineConfig(batchSize, value, cacheTtlSeconds, cap, progressIntervalSeconds,
                maxReportedFailures, identity, directoryFile, reportFile);
    }

    public EngineConfig withCap(Long value) {
        return new EngineConfig(batchSize, maxWorkers, cacheTtlSeconds, Optional.ofNullable(value),
                progressIntervalSeconds, maxReportedFailures, identity, directoryFile, reportFile);
    }

    public EngineConfig withProgressIntervalSeconds(int value) {
        return new EngineConfig(batchSize, maxWorkers, cacheTtlSeconds, cap, value,
                maxReportedFailures, identity, directoryFile, reportFile);
    }

    /**
     * Rejects values no run can proceed with.
     *
     * @throws ConfigException describing the first invalid field
     */
    public void validate() {
        if (batchSize <= 0) {
            throw new ConfigException("batchSize must be positive, was " + batchSize);
        }
        if (maxWorkers < 0) {
            throw new ConfigException("maxWorkers must not be negative, was " + maxWorkers);
        }
        if (cacheTtlSeconds <= 0) {
            throw new ConfigException("cacheTtlSeconds must be positive, was " + cacheTtlSeconds);
        }
        if (cap.isPresent() && cap.get() < 0) {
            throw new ConfigException("cap must not be negative, was " + cap.get());
        }
        if (progressIntervalSeconds < 0) {
            throw new ConfigException("progressIntervalSeconds must not be negative, was " + progressIntervalSeconds);
        }
        if (maxReportedFailures < 0) {
            throw new ConfigException("maxReportedFailures must not be negative, was " + maxReportedFailures);
        }
    }
}
