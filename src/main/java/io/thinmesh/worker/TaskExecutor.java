package io.thinmesh.worker;

/**
 * A worker capability: executes every task of one task type.
 */
public interface TaskExecutor {
    String taskType();

    /**
     * Paid executors reserve {@link #estimateCostMicros} against the run's
     * ceiling before each execution.
     */
    default boolean paid() {
        return false;
    }

    default long estimateCostMicros(TaskContext context) throws Exception {
        return 0L;
    }

    /**
     * @throws io.thinmesh.error.TaskExecutionException for a failed attempt;
     *         any other exception is treated the same way with no cost charged
     */
    TaskResult execute(TaskContext context) throws Exception;
}
