package io.thinmesh.worker;

public record TaskResult(byte[] output, String contentType, long costMicros) {
    public TaskResult {
        if (output == null) {
            throw new IllegalArgumentException("task output must not be null");
        }
        costMicros = Math.max(0L, costMicros);
    }

    public static TaskResult of(byte[] output) {
        return new TaskResult(output, null, 0L);
    }

    public static TaskResult of(byte[] output, String contentType) {
        return new TaskResult(output, contentType, 0L);
    }

    public static TaskResult paid(byte[] output, String contentType, long costMicros) {
        return new TaskResult(output, contentType, costMicros);
    }
}
