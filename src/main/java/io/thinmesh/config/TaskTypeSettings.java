package io.thinmesh.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per task type settings from {@code thinmesh-settings.json}. A non-empty
 * {@code command} registers a script executor for the type.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskTypeSettings(
        @JsonProperty("max_duration_ms") Long maxDurationMs,
        @JsonProperty("command") List<String> command,
        @JsonProperty("paid") Boolean paid,
        @JsonProperty("estimated_cost") String estimatedCost
) {
    public TaskTypeSettings {
        command = command == null ? List.of() : List.copyOf(command);
    }

    public static TaskTypeSettings withMaxDuration(long maxDurationMs) {
        return new TaskTypeSettings(maxDurationMs, List.of(), null, null);
    }

    public boolean isScript() {
        return !command.isEmpty();
    }

    public boolean isPaid() {
        return paid != null && paid;
    }
}
