package io.thinmesh.model;

/**
 * Published once per acknowledged delivery, and once per dead letter the
 * router produces on its own. {@code cursor} is the position to resume polling
 * after this event.
 */
public record CompletionEvent(
        String cursor,
        String runId,
        String taskKey,
        String taskType,
        TaskOutcome.Kind outcome,
        String artifactHash,
        long costMicros,
        String detail,
        long createdAtMs
) {
}
