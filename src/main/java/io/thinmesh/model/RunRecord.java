package io.thinmesh.model;

public record RunRecord(
        String runId,
        String specHash,
        RunStatus status,
        boolean cancelled,
        long createdAtMs,
        long updatedAtMs
) {
}
