package io.thinmesh.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One unit of work on the wire. {@code messageId} and {@code leaseToken} are
 * assigned by the router on delivery and never take part in the task key.
 * {@code params} travels as base64 in JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskEnvelope(
        @JsonProperty("run_id") String runId,
        @JsonProperty("task_key") String taskKey,
        @JsonProperty("task_type") String taskType,
        @JsonProperty("input_hashes") List<String> inputHashes,
        @JsonProperty("params") byte[] params,
        @JsonProperty("attempt") int attempt,
        @JsonProperty("message_id") String messageId,
        @JsonProperty("lease_token") String leaseToken
) {
    public TaskEnvelope {
        inputHashes = inputHashes == null ? List.of() : List.copyOf(inputHashes);
        params = params == null ? new byte[0] : params;
    }

    public static TaskEnvelope of(String runId, String taskKey, String taskType, List<String> inputHashes, byte[] params) {
        return new TaskEnvelope(runId, taskKey, taskType, inputHashes, params, 0, null, null);
    }

    public TaskEnvelope delivered(String messageId, int attempt, String leaseToken) {
        return new TaskEnvelope(runId, taskKey, taskType, inputHashes, params, attempt, messageId, leaseToken);
    }

    /**
     * The envelope as stored in the queue, without delivery fields.
     */
    public TaskEnvelope undelivered() {
        return new TaskEnvelope(runId, taskKey, taskType, inputHashes, params, 0, null, null);
    }
}
