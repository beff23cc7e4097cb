package io.thinmesh.model;

/**
 * Terminal disposition a worker reports when it acknowledges a delivery.
 */
public record TaskOutcome(Kind kind, String artifactHash, long costMicros, String detail) {
    public enum Kind {
        /** Output stored and recorded. */
        DONE,
        /** Terminal failure, dead-lettered as failed. */
        FAILED,
        /** Run was cancelled, dead-lettered as cancelled. */
        CANCELLED,
        /** Cost guard denied the reservation; removed without side effects. */
        HALTED,
        /** Integrity violation; dead-lettered and aborts the run. */
        ABORTED
    }

    public static TaskOutcome done(String artifactHash, long costMicros) {
        return new TaskOutcome(Kind.DONE, artifactHash, costMicros, null);
    }

    public static TaskOutcome failed(String detail, long costMicros) {
        return new TaskOutcome(Kind.FAILED, null, costMicros, detail);
    }

    public static TaskOutcome cancelled(String detail) {
        return new TaskOutcome(Kind.CANCELLED, null, 0L, detail);
    }

    public static TaskOutcome halted(String detail) {
        return new TaskOutcome(Kind.HALTED, null, 0L, detail);
    }

    public static TaskOutcome aborted(String detail) {
        return new TaskOutcome(Kind.ABORTED, null, 0L, detail);
    }

    public boolean deadLetters() {
        return kind == Kind.FAILED || kind == Kind.CANCELLED || kind == Kind.ABORTED;
    }

    public String deadStatus() {
        return switch (kind) {
            case CANCELLED -> "cancelled";
            case FAILED, ABORTED -> "failed";
            default -> null;
        };
    }
}
