package io.thinmesh.model;

public record DeadLetter(
        String messageId,
        String runId,
        String taskKey,
        String taskType,
        String status,
        int attempt,
        String lastError,
        long deadAtMs
) {
}
