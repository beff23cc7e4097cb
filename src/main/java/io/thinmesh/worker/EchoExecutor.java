package io.thinmesh.worker;

import java.io.ByteArrayOutputStream;

/**
 * Free executor whose output is its inputs joined by newlines.
 */
public final class EchoExecutor implements TaskExecutor {
    public static final String TYPE = "echo";

    @Override
    public String taskType() {
        return TYPE;
    }

    @Override
    public TaskResult execute(TaskContext context) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < context.inputs().size(); i++) {
            if (i > 0) {
                out.write('\n');
            }
            out.writeBytes(context.input(i));
        }
        return TaskResult.of(out.toByteArray(), "text/plain");
    }
}
