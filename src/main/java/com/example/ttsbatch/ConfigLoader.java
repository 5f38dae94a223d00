package com.example.ttsbatch;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

public class ConfigLoader {
    private static final int DEFAULT_MAX_WORKERS = 15;
    private static final int DEFAULT_CHECKPOINT_THRESHOLD = 55;
    private static final int DEFAULT_HARD_QUOTA = 60;
    private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 60;
    private static final int DEFAULT_INTER_REQUEST_DELAY_MILLIS = 2500;
    private static final int DEFAULT_MAX_ATTEMPTS = 3;
    private static final int DEFAULT_RETRY_BACKOFF_MILLIS = 2000;
    private static final int DEFAULT_STAGGER_INTERVAL_SECONDS = 10;
    private static final int DEFAULT_BATCH_SIZE = 3;
    private static final int DEFAULT_PROBE_WORKERS = 2;
    private static final int DEFAULT_PROBE_UNITS = 100;
    private static final int DEFAULT_PROBE_MIN_UNITS = 10;
    private static final int DEFAULT_PROBE_EARLY_LIMIT_MARGIN = 5;
    private static final int DEFAULT_DASHBOARD_INTERVAL_MILLIS = 2000;
    private static final String DEFAULT_VOICE = "default";

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public RunnerConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.unitsFile == null || raw.unitsFile.isBlank()) {
            throw new IllegalArgumentException("Config must include unitsFile.");
        }
        if (raw.endpoint == null || raw.endpoint.isBlank()) {
            throw new IllegalArgumentException("Config must include endpoint.");
        }
        URI endpoint;
        try {
            endpoint = new URI(raw.endpoint);
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("endpoint is not a valid URI: " + raw.endpoint, ex);
        }

        Path outputDirectory = Path.of(optionalString(raw.outputDirectory, "output"));
        Path manifestFile = Optional.ofNullable(raw.manifestFile)
                .filter(value -> !value.isBlank())
                .map(Path::of)
                .orElse(outputDirectory.resolve("manifest.json"));

        int checkpointThreshold = positiveOr(raw.checkpointThreshold, DEFAULT_CHECKPOINT_THRESHOLD);
        int hardQuota = positiveOr(raw.hardQuota, DEFAULT_HARD_QUOTA);
        if (checkpointThreshold >= hardQuota) {
            throw new IllegalArgumentException("checkpointThreshold (" + checkpointThreshold
                    + ") must be below hardQuota (" + hardQuota + ").");
        }

        boolean s3SyncEnabled = raw.s3SyncEnabled != null && raw.s3SyncEnabled;
        Optional<String> s3Bucket = Optional.ofNullable(raw.s3Bucket).filter(value -> !value.isBlank());
        Optional<String> s3Prefix = Optional.ofNullable(raw.s3Prefix).filter(value -> !value.isBlank());
        Optional<String> s3Region = Optional.ofNullable(raw.s3Region).filter(value -> !value.isBlank());
        if (s3SyncEnabled && s3Bucket.isEmpty()) {
            throw new IllegalArgumentException("s3Bucket is required when s3SyncEnabled is true.");
        }

        return new RunnerConfig(
                Path.of(raw.unitsFile),
                outputDirectory,
                manifestFile,
                endpoint,
                optionalString(raw.voice, DEFAULT_VOICE),
                Duration.ofSeconds(positiveOr(raw.requestTimeoutSeconds, DEFAULT_REQUEST_TIMEOUT_SECONDS)),
                parseWorkerCount(raw.workerCount),
                positiveOr(raw.maxWorkers, DEFAULT_MAX_WORKERS),
                checkpointThreshold,
                hardQuota,
                Duration.ofMillis(nonNegativeOr(raw.interRequestDelayMillis, DEFAULT_INTER_REQUEST_DELAY_MILLIS)),
                positiveOr(raw.maxAttempts, DEFAULT_MAX_ATTEMPTS),
                Duration.ofMillis(nonNegativeOr(raw.retryBackoffMillis, DEFAULT_RETRY_BACKOFF_MILLIS)),
                CheckpointCoordinationMode.parse(raw.checkpointCoordinationMode),
                Duration.ofSeconds(nonNegativeOr(raw.staggerIntervalSeconds, DEFAULT_STAGGER_INTERVAL_SECONDS)),
                positiveOr(raw.batchSize, DEFAULT_BATCH_SIZE),
                raw.safetyProbeEnabled == null || raw.safetyProbeEnabled,
                positiveOr(raw.probeWorkers, DEFAULT_PROBE_WORKERS),
                positiveOr(raw.probeUnits, DEFAULT_PROBE_UNITS),
                positiveOr(raw.probeMinUnits, DEFAULT_PROBE_MIN_UNITS),
                nonNegativeOr(raw.probeEarlyLimitMargin, DEFAULT_PROBE_EARLY_LIMIT_MARGIN),
                Duration.ofMillis(positiveOr(raw.dashboardIntervalMillis, DEFAULT_DASHBOARD_INTERVAL_MILLIS)),
                raw.validateArtifacts == null || raw.validateArtifacts,
                ResumeMode.parse(raw.resumeMode),
                s3SyncEnabled,
                s3Bucket,
                s3Prefix,
                s3Region
        );
    }

    private Optional<Integer> parseWorkerCount(String value) {
        if (value == null || value.isBlank() || "auto".equalsIgnoreCase(value.trim())) {
            return Optional.empty();
        }
        try {
            int count = Integer.parseInt(value.trim());
            if (count < 1) {
                throw new IllegalArgumentException("workerCount must be at least 1 or \"auto\": " + value);
            }
            return Optional.of(count);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("workerCount must be a number or \"auto\": " + value, ex);
        }
    }

    private int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private int nonNegativeOr(Integer value, int fallback) {
        return value != null && value >= 0 ? value : fallback;
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String unitsFile;
        public String outputDirectory;
        public String manifestFile;
        public String endpoint;
        public String voice;
        public Integer requestTimeoutSeconds;
        public String workerCount;
        public Integer maxWorkers;
        public Integer checkpointThreshold;
        public Integer hardQuota;
        public Integer interRequestDelayMillis;
        public Integer maxAttempts;
        public Integer retryBackoffMillis;
        public String checkpointCoordinationMode;
        public Integer staggerIntervalSeconds;
        public Integer batchSize;
        public Boolean safetyProbeEnabled;
        public Integer probeWorkers;
        public Integer probeUnits;
        public Integer probeMinUnits;
        public Integer probeEarlyLimitMargin;
        public Integer dashboardIntervalMillis;
        public Boolean validateArtifacts;
        public String resumeMode;
        public Boolean s3SyncEnabled;
        public String s3Bucket;
        public String s3Prefix;
        public String s3Region;
    }
}
