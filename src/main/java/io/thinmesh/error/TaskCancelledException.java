package io.thinmesh.error;

/**
 * Raised from {@code TaskContext.checkCancelled()} when the run was cancelled
 * while the task was executing.
 */
public class TaskCancelledException extends ThinMeshException {
    public TaskCancelledException(String runId) {
        super("run cancelled: " + runId);
    }
}
