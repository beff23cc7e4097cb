package io.thinmesh.worker;

import io.thinmesh.error.TaskExecutionException;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command per task. The task is written to stdin as JSON
 * ({@code run_id}, {@code task_key}, {@code task_type}, {@code attempt},
 * {@code params_base64}, {@code inputs[].hash}, {@code inputs[].content_base64});
 * stdout becomes the output artifact and a non-zero exit fails the attempt.
 */
public final class ScriptExecutor implements TaskExecutor {
    private static final int MAX_ERROR_CHARS = 512;

    private final String taskType;
    private final List<String> command;
    private final long timeoutMs;
    private final boolean paid;
    private final long costMicros;

    public ScriptExecutor(String taskType, List<String> command, long timeoutMs, boolean paid, long costMicros) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("script task type cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script command cannot be empty: " + taskType);
        }
        this.taskType = taskType;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
        this.paid = paid;
        this.costMicros = Math.max(0L, costMicros);
    }

    @Override
    public String taskType() {
        return taskType;
    }

    @Override
    public boolean paid() {
        return paid;
    }

    @Override
    public long estimateCostMicros(TaskContext context) {
        return paid ? costMicros : 0L;
    }

    @Override
    public TaskResult execute(TaskContext context) throws IOException, InterruptedException {
        Path stdout = Files.createTempFile("thinmesh-script-", ".out");
        Path stderr = Files.createTempFile("thinmesh-script-", ".err");
        try {
            ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
            pb.redirectOutput(stdout.toFile());
            pb.redirectError(stderr.toFile());
            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                throw new TaskExecutionException("script spawn failed: " + e.getMessage(), 0L, e);
            }
            try {
                try (OutputStream in = process.getOutputStream()) {
                    in.write(TaskRequests.toJson(context));
                }
                boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    process.waitFor(1, TimeUnit.SECONDS);
                    throw new TaskExecutionException("script timeout after " + Duration.ofMillis(timeoutMs), chargedOnFailure());
                }
                if (process.exitValue() != 0) {
                    String err = Files.readString(stderr, StandardCharsets.UTF_8);
                    throw new TaskExecutionException("script exit=" + process.exitValue() + " stderr=" + truncate(err),
                            chargedOnFailure());
                }
                return TaskResult.paid(Files.readAllBytes(stdout), null, paid ? costMicros : 0L);
            } catch (IOException | InterruptedException | RuntimeException e) {
                process.destroyForcibly();
                throw e;
            }
        } finally {
            Files.deleteIfExists(stdout);
            Files.deleteIfExists(stderr);
        }
    }

    private long chargedOnFailure() {
        return paid ? costMicros : 0L;
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
