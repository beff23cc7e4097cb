package io.thinmesh.worker;

/**
 * Paid executor delegating to a {@link ModelGateway}; estimate and actual cost
 * both come from the gateway.
 */
public final class ModelGatewayExecutor implements TaskExecutor {
    public static final String TYPE = "llm";

    private final String taskType;
    private final ModelGateway gateway;

    public ModelGatewayExecutor(ModelGateway gateway) {
        this(TYPE, gateway);
    }

    public ModelGatewayExecutor(String taskType, ModelGateway gateway) {
        this.taskType = taskType;
        this.gateway = gateway;
    }

    @Override
    public String taskType() {
        return taskType;
    }

    @Override
    public boolean paid() {
        return true;
    }

    @Override
    public long estimateCostMicros(TaskContext context) throws Exception {
        return gateway.estimateMicros(context);
    }

    @Override
    public TaskResult execute(TaskContext context) throws Exception {
        context.checkCancelled();
        ModelGateway.Invocation invocation = gateway.invoke(context);
        return TaskResult.paid(invocation.output(), invocation.contentType(), invocation.costMicros());
    }
}
