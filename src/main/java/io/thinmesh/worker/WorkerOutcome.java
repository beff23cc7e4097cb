package io.thinmesh.worker;

/**
 * What one claim cycle of a {@link WorkerAgent} did.
 */
public record WorkerOutcome(Disposition disposition, String runId, String taskKey, String messageId, String message) {
    public enum Disposition {
        /** Nothing to claim within the poll timeout. */
        IDLE,
        /** Executed, stored and acknowledged. */
        DONE,
        /** Acknowledged from an earlier manifest resolution without executing. */
        ALREADY_DONE,
        /** Attempt failed; the router will redeliver. */
        RETRY,
        /** Attempt failed for good or the input was unusable. */
        DEAD_LETTERED,
        HALTED,
        CANCELLED,
        /** Integrity violation, dead-lettered; the planner aborts the run. */
        ABORTED,
        /** Returned to the queue without counting the attempt. */
        RELEASED,
        /** The lease was reclaimed by someone else before we finished. */
        STALE_LEASE
    }

    static WorkerOutcome idle() {
        return new WorkerOutcome(Disposition.IDLE, null, null, null, "No queued messages");
    }

    public boolean processed() {
        return disposition != Disposition.IDLE;
    }
}
