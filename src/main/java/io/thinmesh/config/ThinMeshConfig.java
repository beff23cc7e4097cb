package io.thinmesh.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.thinmesh.util.CostUnits;
import io.thinmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolved configuration of one process. Layers, lowest first: built-in
 * defaults, {@code thinmesh-settings.json} in the data root, {@code THINMESH_*}
 * environment variables, then CLI options applied through {@link #toBuilder()}.
 */
public final class ThinMeshConfig {
    public static final String SETTINGS_FILE = "thinmesh-settings.json";
    public static final String DEFAULT_QUEUE_URL = "sqlite:";
    public static final String DEFAULT_ARTIFACT_URL = "file:";
    public static final long DEFAULT_LEASE_TIMEOUT_MS = 60_000L;
    public static final int DEFAULT_LEASE_MULTIPLIER = 5;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 500L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 30_000L;
    public static final long DEFAULT_POLL_TIMEOUT_MS = 1_000L;
    public static final String DEFAULT_CONSUMER_GROUP = "workers";
    public static final String DEFAULT_KEY_PREFIX = "thinmesh";
    public static final long UNLIMITED = -1L;

    public static final String ENV_QUEUE_URL = "THINMESH_QUEUE_URL";
    public static final String ENV_ARTIFACT_URL = "THINMESH_ARTIFACT_URL";
    public static final String ENV_LEASE_TIMEOUT_MS = "THINMESH_LEASE_TIMEOUT_MS";
    public static final String ENV_MAX_ATTEMPTS = "THINMESH_MAX_ATTEMPTS";
    public static final String ENV_COST_CEILING = "THINMESH_COST_CEILING";
    public static final String ENV_GATEWAY_URL = "THINMESH_GATEWAY_URL";

    private final Path rootDir;
    private final String queueUrl;
    private final String artifactUrl;
    private final long leaseTimeoutMs;
    private final int leaseMultiplier;
    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private final long pollTimeoutMs;
    private final long costCeilingMicros;
    private final long globalCeilingMicros;
    private final long defaultEstimateMicros;
    private final String consumerGroup;
    private final String keyPrefix;
    private final boolean shareAcrossRuns;
    private final String gatewayUrl;
    private final Map<String, TaskTypeSettings> taskTypes;

    private ThinMeshConfig(Builder b) {
        this.rootDir = b.rootDir;
        this.queueUrl = b.queueUrl;
        this.artifactUrl = b.artifactUrl;
        this.leaseTimeoutMs = b.leaseTimeoutMs;
        this.leaseMultiplier = b.leaseMultiplier;
        this.maxAttempts = b.maxAttempts;
        this.baseBackoffMs = b.baseBackoffMs;
        this.maxBackoffMs = b.maxBackoffMs;
        this.pollTimeoutMs = b.pollTimeoutMs;
        this.costCeilingMicros = b.costCeilingMicros;
        this.globalCeilingMicros = b.globalCeilingMicros;
        this.defaultEstimateMicros = b.defaultEstimateMicros;
        this.consumerGroup = b.consumerGroup;
        this.keyPrefix = b.keyPrefix;
        this.shareAcrossRuns = b.shareAcrossRuns;
        this.gatewayUrl = b.gatewayUrl;
        this.taskTypes = Map.copyOf(b.taskTypes);
    }

    public static ThinMeshConfig fromRoot(String root) {
        return builder(resolveRoot(root)).build();
    }

    /**
     * Defaults, then the settings file under {@code root} if present, then the
     * given environment.
     */
    public static ThinMeshConfig load(String root, Map<String, String> env) {
        Path rootDir = resolveRoot(root);
        Builder b = builder(rootDir);
        Path settings = rootDir.resolve(SETTINGS_FILE);
        if (Files.isRegularFile(settings)) {
            b.applySettings(readSettings(settings));
        }
        b.applyEnvironment(env == null ? Map.of() : env);
        return b.build();
    }

    public static Builder builder(Path rootDir) {
        return new Builder(rootDir);
    }

    public Builder toBuilder() {
        Builder b = new Builder(rootDir);
        b.queueUrl = queueUrl;
        b.artifactUrl = artifactUrl;
        b.leaseTimeoutMs = leaseTimeoutMs;
        b.leaseMultiplier = leaseMultiplier;
        b.maxAttempts = maxAttempts;
        b.baseBackoffMs = baseBackoffMs;
        b.maxBackoffMs = maxBackoffMs;
        b.pollTimeoutMs = pollTimeoutMs;
        b.costCeilingMicros = costCeilingMicros;
        b.globalCeilingMicros = globalCeilingMicros;
        b.defaultEstimateMicros = defaultEstimateMicros;
        b.consumerGroup = consumerGroup;
        b.keyPrefix = keyPrefix;
        b.shareAcrossRuns = shareAcrossRuns;
        b.gatewayUrl = gatewayUrl;
        b.taskTypes.putAll(taskTypes);
        return b;
    }

    private static Path resolveRoot(String root) {
        Path resolved = root == null || root.isBlank() ? Paths.get("data") : Paths.get(root);
        return resolved.toAbsolutePath().normalize();
    }

    private static SettingsFile readSettings(Path file) {
        try {
            return Jsons.compactMapper().readValue(Files.readString(file), SettingsFile.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read settings file: " + file, e);
        }
    }

    /**
     * Lease for one delivery of {@code taskType}: the declared max duration times
     * the lease multiplier, or the default lease timeout.
     */
    public long leaseMsFor(String taskType) {
        TaskTypeSettings settings = taskTypes.get(taskType);
        if (settings == null || settings.maxDurationMs() == null) {
            return leaseTimeoutMs;
        }
        return settings.maxDurationMs() * leaseMultiplier;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        String location = queueUrl.substring("sqlite:".length());
        return location.isBlank() ? rootDir.resolve("thinmesh.db") : rootDir.resolve(location);
    }

    public Path artifactsDir() {
        String location = artifactUrl.substring("file:".length());
        return location.isBlank() ? rootDir.resolve("artifacts") : rootDir.resolve(location);
    }

    public Path auditFile() {
        return rootDir.resolve("audit").resolve("audit.log");
    }

    public boolean isRedisQueue() {
        return queueUrl.startsWith("redis://") || queueUrl.startsWith("rediss://");
    }

    public boolean isHttpArtifacts() {
        return artifactUrl.startsWith("http://") || artifactUrl.startsWith("https://");
    }

    public String queueUrl() {
        return queueUrl;
    }

    public String artifactUrl() {
        return artifactUrl;
    }

    public long leaseTimeoutMs() {
        return leaseTimeoutMs;
    }

    public int leaseMultiplier() {
        return leaseMultiplier;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public long baseBackoffMs() {
        return baseBackoffMs;
    }

    public long maxBackoffMs() {
        return maxBackoffMs;
    }

    public long pollTimeoutMs() {
        return pollTimeoutMs;
    }

    public long costCeilingMicros() {
        return costCeilingMicros;
    }

    public long globalCeilingMicros() {
        return globalCeilingMicros;
    }

    public long defaultEstimateMicros() {
        return defaultEstimateMicros;
    }

    public String consumerGroup() {
        return consumerGroup;
    }

    public String keyPrefix() {
        return keyPrefix;
    }

    public boolean shareAcrossRuns() {
        return shareAcrossRuns;
    }

    public String gatewayUrl() {
        return gatewayUrl;
    }

    public Map<String, TaskTypeSettings> taskTypes() {
        return taskTypes;
    }

    public static final class Builder {
        private final Path rootDir;
        private String queueUrl = DEFAULT_QUEUE_URL;
        private String artifactUrl = DEFAULT_ARTIFACT_URL;
        private long leaseTimeoutMs = DEFAULT_LEASE_TIMEOUT_MS;
        private int leaseMultiplier = DEFAULT_LEASE_MULTIPLIER;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long baseBackoffMs = DEFAULT_BASE_BACKOFF_MS;
        private long maxBackoffMs = DEFAULT_MAX_BACKOFF_MS;
        private long pollTimeoutMs = DEFAULT_POLL_TIMEOUT_MS;
        private long costCeilingMicros = UNLIMITED;
        private long globalCeilingMicros = UNLIMITED;
        private long defaultEstimateMicros = 0L;
        private String consumerGroup = DEFAULT_CONSUMER_GROUP;
        private String keyPrefix = DEFAULT_KEY_PREFIX;
        private boolean shareAcrossRuns;
        private String gatewayUrl;
        private final Map<String, TaskTypeSettings> taskTypes = new LinkedHashMap<>();

        private Builder(Path rootDir) {
            this.rootDir = rootDir.toAbsolutePath().normalize();
        }

        public Builder queueUrl(String value) {
            this.queueUrl = value;
            return this;
        }

        public Builder artifactUrl(String value) {
            this.artifactUrl = value;
            return this;
        }

        public Builder leaseTimeoutMs(long value) {
            this.leaseTimeoutMs = value;
            return this;
        }

        public Builder leaseMultiplier(int value) {
            this.leaseMultiplier = value;
            return this;
        }

        public Builder maxAttempts(int value) {
            this.maxAttempts = value;
            return this;
        }

        public Builder backoff(long baseMs, long maxMs) {
            this.baseBackoffMs = baseMs;
            this.maxBackoffMs = maxMs;
            return this;
        }

        public Builder pollTimeoutMs(long value) {
            this.pollTimeoutMs = value;
            return this;
        }

        public Builder costCeilingMicros(long value) {
            this.costCeilingMicros = value;
            return this;
        }

        public Builder globalCeilingMicros(long value) {
            this.globalCeilingMicros = value;
            return this;
        }

        public Builder defaultEstimateMicros(long value) {
            this.defaultEstimateMicros = value;
            return this;
        }

        public Builder consumerGroup(String value) {
            this.consumerGroup = value;
            return this;
        }

        public Builder keyPrefix(String value) {
            this.keyPrefix = value;
            return this;
        }

        public Builder shareAcrossRuns(boolean value) {
            this.shareAcrossRuns = value;
            return this;
        }

        public Builder gatewayUrl(String value) {
            this.gatewayUrl = value;
            return this;
        }

        public Builder taskType(String taskType, TaskTypeSettings settings) {
            this.taskTypes.put(taskType, settings);
            return this;
        }

        private void applySettings(SettingsFile s) {
            if (s.queueUrl() != null) {
                queueUrl = s.queueUrl();
            }
            if (s.artifactUrl() != null) {
                artifactUrl = s.artifactUrl();
            }
            if (s.leaseTimeoutMs() != null) {
                leaseTimeoutMs = s.leaseTimeoutMs();
            }
            if (s.leaseMultiplier() != null) {
                leaseMultiplier = s.leaseMultiplier();
            }
            if (s.maxAttempts() != null) {
                maxAttempts = s.maxAttempts();
            }
            if (s.baseBackoffMs() != null) {
                baseBackoffMs = s.baseBackoffMs();
            }
            if (s.maxBackoffMs() != null) {
                maxBackoffMs = s.maxBackoffMs();
            }
            if (s.pollTimeoutMs() != null) {
                pollTimeoutMs = s.pollTimeoutMs();
            }
            if (s.costCeiling() != null) {
                costCeilingMicros = CostUnits.parseMicros(s.costCeiling());
            }
            if (s.globalCostCeiling() != null) {
                globalCeilingMicros = CostUnits.parseMicros(s.globalCostCeiling());
            }
            if (s.defaultEstimatedCost() != null) {
                defaultEstimateMicros = CostUnits.parseMicros(s.defaultEstimatedCost());
            }
            if (s.consumerGroup() != null) {
                consumerGroup = s.consumerGroup();
            }
            if (s.keyPrefix() != null) {
                keyPrefix = s.keyPrefix();
            }
            if (s.shareAcrossRuns() != null) {
                shareAcrossRuns = s.shareAcrossRuns();
            }
            if (s.gatewayUrl() != null) {
                gatewayUrl = s.gatewayUrl();
            }
            if (s.taskTypes() != null) {
                taskTypes.putAll(s.taskTypes());
            }
        }

        private void applyEnvironment(Map<String, String> env) {
            String v = env.get(ENV_QUEUE_URL);
            if (v != null && !v.isBlank()) {
                queueUrl = v.trim();
            }
            v = env.get(ENV_ARTIFACT_URL);
            if (v != null && !v.isBlank()) {
                artifactUrl = v.trim();
            }
            v = env.get(ENV_LEASE_TIMEOUT_MS);
            if (v != null && !v.isBlank()) {
                leaseTimeoutMs = parseLong(ENV_LEASE_TIMEOUT_MS, v);
            }
            v = env.get(ENV_MAX_ATTEMPTS);
            if (v != null && !v.isBlank()) {
                maxAttempts = (int) parseLong(ENV_MAX_ATTEMPTS, v);
            }
            v = env.get(ENV_COST_CEILING);
            if (v != null && !v.isBlank()) {
                costCeilingMicros = CostUnits.parseMicros(v);
            }
            v = env.get(ENV_GATEWAY_URL);
            if (v != null && !v.isBlank()) {
                gatewayUrl = v.trim();
            }
        }

        private static long parseLong(String name, String raw) {
            try {
                return Long.parseLong(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " is not a number: " + raw, e);
            }
        }

        public ThinMeshConfig build() {
            if (queueUrl == null || !(queueUrl.startsWith("sqlite:") || queueUrl.startsWith("redis://")
                    || queueUrl.startsWith("rediss://"))) {
                throw new IllegalArgumentException("queue url must start with sqlite: or redis://, got " + queueUrl);
            }
            if (artifactUrl == null || !(artifactUrl.startsWith("file:") || artifactUrl.startsWith("http://")
                    || artifactUrl.startsWith("https://"))) {
                throw new IllegalArgumentException("artifact url must start with file: or http://, got " + artifactUrl);
            }
            if (leaseTimeoutMs < 1L) {
                throw new IllegalArgumentException("lease timeout must be positive");
            }
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("max attempts must be >= 1");
            }
            if (pollTimeoutMs < 1L) {
                throw new IllegalArgumentException("poll timeout must be positive");
            }
            if (consumerGroup == null || consumerGroup.isBlank()) {
                throw new IllegalArgumentException("consumer group must not be blank");
            }
            if (keyPrefix == null || keyPrefix.isBlank()) {
                throw new IllegalArgumentException("key prefix must not be blank");
            }
            for (Map.Entry<String, TaskTypeSettings> e : taskTypes.entrySet()) {
                Long maxDuration = e.getValue().maxDurationMs();
                if (maxDuration == null) {
                    continue;
                }
                if (maxDuration < 1L) {
                    throw new IllegalArgumentException("max_duration_ms must be positive for task type " + e.getKey());
                }
                if (maxDuration * leaseMultiplier <= maxDuration) {
                    throw new IllegalArgumentException("lease for task type " + e.getKey()
                            + " does not exceed its max duration; lease multiplier is " + leaseMultiplier);
                }
            }
            return new ThinMeshConfig(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            @JsonProperty("queue_url") String queueUrl,
            @JsonProperty("artifact_url") String artifactUrl,
            @JsonProperty("lease_timeout_ms") Long leaseTimeoutMs,
            @JsonProperty("lease_multiplier") Integer leaseMultiplier,
            @JsonProperty("max_attempts") Integer maxAttempts,
            @JsonProperty("base_backoff_ms") Long baseBackoffMs,
            @JsonProperty("max_backoff_ms") Long maxBackoffMs,
            @JsonProperty("poll_timeout_ms") Long pollTimeoutMs,
            @JsonProperty("cost_ceiling") String costCeiling,
            @JsonProperty("global_cost_ceiling") String globalCostCeiling,
            @JsonProperty("default_estimated_cost") String defaultEstimatedCost,
            @JsonProperty("consumer_group") String consumerGroup,
            @JsonProperty("key_prefix") String keyPrefix,
            @JsonProperty("share_across_runs") Boolean shareAcrossRuns,
            @JsonProperty("gateway_url") String gatewayUrl,
            @JsonProperty("task_types") Map<String, TaskTypeSettings> taskTypes
    ) {
    }
}
