package io.thinmesh.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of a run's append-only manifest log.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ManifestEntry(
        @JsonProperty("task_key") String taskKey,
        @JsonProperty("task_type") String taskType,
        @JsonProperty("resolution") Resolution resolution,
        @JsonProperty("artifact_hash") String artifactHash,
        @JsonProperty("cost_charged") long costChargedMicros,
        @JsonProperty("detail") String detail,
        @JsonProperty("recorded_at_ms") long recordedAtMs
) {
    public enum Resolution {
        @JsonProperty("done") DONE,
        @JsonProperty("failed") FAILED,
        @JsonProperty("invalidated") INVALIDATED
    }

    public static ManifestEntry done(String taskKey, String taskType, String artifactHash, long costMicros, long nowMs) {
        return new ManifestEntry(taskKey, taskType, Resolution.DONE, artifactHash, costMicros, null, nowMs);
    }

    public static ManifestEntry failed(String taskKey, String taskType, String detail, long costMicros, long nowMs) {
        return new ManifestEntry(taskKey, taskType, Resolution.FAILED, null, costMicros, detail, nowMs);
    }

    public static ManifestEntry invalidated(String taskKey, String taskType, String artifactHash, String detail, long nowMs) {
        return new ManifestEntry(taskKey, taskType, Resolution.INVALIDATED, artifactHash, 0L, detail, nowMs);
    }
}
