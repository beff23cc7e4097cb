package io.thinmesh.worker;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class ExecutorRegistry {
    private final Map<String, TaskExecutor> executors = new ConcurrentHashMap<>();

    public ExecutorRegistry register(TaskExecutor executor) {
        executors.put(executor.taskType(), executor);
        return this;
    }

    public Optional<TaskExecutor> find(String taskType) {
        return Optional.ofNullable(executors.get(taskType));
    }

    public Collection<String> taskTypes() {
        return List.copyOf(executors.keySet());
    }

    /**
     * A registry limited to {@code taskTypes}; unknown names are rejected.
     */
    public ExecutorRegistry restrictTo(Collection<String> taskTypes) {
        ExecutorRegistry out = new ExecutorRegistry();
        for (String type : taskTypes) {
            TaskExecutor executor = executors.get(type);
            if (executor == null) {
                throw new IllegalArgumentException("no executor registered for task type: " + type);
            }
            out.register(executor);
        }
        return out;
    }
}
