package io.thinmesh.worker;

import io.thinmesh.error.TaskExecutionException;

public final class FailExecutor implements TaskExecutor {
    public static final String TYPE = "fail";

    @Override
    public String taskType() {
        return TYPE;
    }

    @Override
    public TaskResult execute(TaskContext context) {
        throw new TaskExecutionException("fail executor always fails (attempt " + context.attempt() + ")");
    }
}
