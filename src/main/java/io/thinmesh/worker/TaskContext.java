package io.thinmesh.worker;

import io.thinmesh.error.TaskCancelledException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * What an executor sees of one delivery: the input bytes in declared order,
 * the opaque params and a cancellation check.
 */
public final class TaskContext {
    private final String runId;
    private final String taskKey;
    private final String taskType;
    private final int attempt;
    private final List<String> inputHashes;
    private final List<byte[]> inputs;
    private final byte[] params;
    private final BooleanSupplier cancelled;

    public TaskContext(String runId, String taskKey, String taskType, int attempt, List<String> inputHashes,
                       List<byte[]> inputs, byte[] params, BooleanSupplier cancelled) {
        this.runId = runId;
        this.taskKey = taskKey;
        this.taskType = taskType;
        this.attempt = attempt;
        this.inputHashes = List.copyOf(inputHashes);
        this.inputs = List.copyOf(inputs);
        this.params = params == null ? new byte[0] : params;
        this.cancelled = cancelled == null ? () -> false : cancelled;
    }

    public String runId() {
        return runId;
    }

    public String taskKey() {
        return taskKey;
    }

    public String taskType() {
        return taskType;
    }

    public int attempt() {
        return attempt;
    }

    public List<String> inputHashes() {
        return inputHashes;
    }

    public List<byte[]> inputs() {
        return inputs;
    }

    public byte[] input(int index) {
        return inputs.get(index);
    }

    public byte[] params() {
        return params;
    }

    public String paramsText() {
        return new String(params, StandardCharsets.UTF_8);
    }

    /**
     * Call between sub-steps of long work.
     *
     * @throws TaskCancelledException if the run was cancelled
     */
    public void checkCancelled() {
        if (cancelled.getAsBoolean()) {
            throw new TaskCancelledException(runId);
        }
    }
}
