package io.thinmesh.cost;

import io.thinmesh.model.LedgerSnapshot;

import java.util.Optional;

/**
 * Backend half of the cost guard. Each method is one atomic operation against
 * the shared store. Amounts are micros; a negative ceiling means unlimited.
 */
public interface SpendLedger extends AutoCloseable {
    String GLOBAL_SCOPE = "_global";

    /**
     * Grants iff the run ledger is not halted and
     * {@code spent + in_flight - previous + amount <= ceiling} holds for the run
     * and, when {@code globalCeilingMicros >= 0}, for the global ledger, where
     * {@code previous} is the amount already held under {@code reservationId}.
     * A denial sets the run's halted flag.
     */
    boolean reserve(String runId, String reservationId, long amountMicros, long globalCeilingMicros);

    /**
     * Moves the reservation out of in-flight and adds {@code actualMicros} to
     * spent. A reservation that no longer exists charges nothing.
     *
     * @return whether a reservation was settled
     */
    boolean settle(String runId, String reservationId, long actualMicros);

    boolean release(String runId, String reservationId);

    /**
     * Sets the run ceiling and clears its halted flag.
     */
    void setCeiling(String runId, long ceilingMicros);

    Optional<LedgerSnapshot> snapshot(String scope);

    @Override
    default void close() {
    }
}
