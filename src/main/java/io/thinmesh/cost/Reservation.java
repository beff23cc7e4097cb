package io.thinmesh.cost;

/**
 * Outcome of {@link CostGuard#reserve}. The id is derived from the run and task
 * key, so a redelivered task reserves under the same id.
 */
public record Reservation(String runId, String reservationId, long amountMicros, boolean granted) {
    public static String idFor(String runId, String taskKey) {
        return runId + ":" + taskKey;
    }

    public static Reservation granted(String runId, String taskKey, long amountMicros) {
        return new Reservation(runId, idFor(runId, taskKey), amountMicros, true);
    }

    public static Reservation denied(String runId, String taskKey, long amountMicros) {
        return new Reservation(runId, idFor(runId, taskKey), amountMicros, false);
    }
}
