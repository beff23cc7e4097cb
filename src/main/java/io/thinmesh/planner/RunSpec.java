package io.thinmesh.planner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A run's task graph as submitted. Once stored, every input is an
 * {@code artifact} reference, so the stored spec alone reproduces every task key.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunSpec(@JsonProperty("tasks") List<TaskSpec> tasks) {
    public RunSpec {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TaskSpec(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("inputs") List<InputSpec> inputs,
            @JsonProperty("params") JsonNode params,
            @JsonProperty("depends_on") List<String> dependsOn,
            @JsonProperty("best_effort") Boolean bestEffort,
            @JsonProperty("paid") Boolean paid
    ) {
        public TaskSpec {
            inputs = inputs == null ? List.of() : List.copyOf(inputs);
            dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        }

        public boolean isBestEffort() {
            return Boolean.TRUE.equals(bestEffort);
        }

        TaskSpec withInputs(List<InputSpec> resolved) {
            return new TaskSpec(id, type, resolved, params, dependsOn, bestEffort, paid);
        }
    }

    /**
     * Exactly one of the three fields is set.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record InputSpec(
            @JsonProperty("text") String text,
            @JsonProperty("file") String file,
            @JsonProperty("artifact") String artifact
    ) {
        public static InputSpec ofText(String text) {
            return new InputSpec(text, null, null);
        }

        public static InputSpec ofFile(String file) {
            return new InputSpec(null, file, null);
        }

        public static InputSpec ofArtifact(String hash) {
            return new InputSpec(null, null, hash);
        }

        int kinds() {
            return (text != null ? 1 : 0) + (file != null ? 1 : 0) + (artifact != null ? 1 : 0);
        }
    }
}
