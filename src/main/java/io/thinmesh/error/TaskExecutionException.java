package io.thinmesh.error;

/**
 * An executor failed. {@link #costChargedMicros()} is what the failed attempt
 * already spent and is settled against the run ledger before redelivery.
 */
public class TaskExecutionException extends ThinMeshException {
    private final long costChargedMicros;

    public TaskExecutionException(String message) {
        this(message, 0L, null);
    }

    public TaskExecutionException(String message, long costChargedMicros) {
        this(message, costChargedMicros, null);
    }

    public TaskExecutionException(String message, long costChargedMicros, Throwable cause) {
        super(message, cause);
        this.costChargedMicros = Math.max(0L, costChargedMicros);
    }

    public long costChargedMicros() {
        return costChargedMicros;
    }
}
