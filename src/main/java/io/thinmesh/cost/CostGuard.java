package io.thinmesh.cost;

import io.thinmesh.model.LedgerSnapshot;
import io.thinmesh.util.CostUnits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Fleet-wide spending ceiling. Workers reserve an estimate before each paid
 * call and settle the actual cost afterwards; all arithmetic happens inside
 * the {@link SpendLedger} so that concurrent workers cannot overshoot.
 */
public final class CostGuard {
    private static final Logger log = LoggerFactory.getLogger(CostGuard.class);

    private final SpendLedger ledger;
    private final long globalCeilingMicros;

    public CostGuard(SpendLedger ledger, long globalCeilingMicros) {
        this.ledger = ledger;
        this.globalCeilingMicros = globalCeilingMicros;
    }

    public Reservation reserve(String runId, String taskKey, long estimateMicros) {
        if (estimateMicros < 0L) {
            throw new IllegalArgumentException("estimate must not be negative");
        }
        String id = Reservation.idFor(runId, taskKey);
        if (ledger.reserve(runId, id, estimateMicros, globalCeilingMicros)) {
            log.debug("Reserved {} for {}", CostUnits.format(estimateMicros), id);
            return Reservation.granted(runId, taskKey, estimateMicros);
        }
        log.warn("Cost ceiling reached for run {}: denied {} for task {}", runId,
                CostUnits.format(estimateMicros), taskKey);
        return Reservation.denied(runId, taskKey, estimateMicros);
    }

    public boolean settle(Reservation reservation, long actualMicros) {
        return settle(reservation.runId(), reservation.reservationId(), actualMicros);
    }

    /**
     * Settles by id. Safe to call more than once and for reservations that were
     * never made.
     */
    public boolean settle(String runId, String reservationId, long actualMicros) {
        boolean settled = ledger.settle(runId, reservationId, Math.max(0L, actualMicros));
        if (settled) {
            log.debug("Settled {} for {}", CostUnits.format(actualMicros), reservationId);
        }
        return settled;
    }

    public boolean release(String runId, String reservationId) {
        return ledger.release(runId, reservationId);
    }

    public void setCeiling(String runId, long ceilingMicros) {
        ledger.setCeiling(runId, ceilingMicros);
        log.info("Cost ceiling for run {} set to {}", runId,
                ceilingMicros < 0L ? "unlimited" : CostUnits.format(ceilingMicros));
    }

    public boolean isHalted(String runId) {
        return ledger.snapshot(runId).map(LedgerSnapshot::halted).orElse(false);
    }

    public Optional<LedgerSnapshot> snapshot(String runId) {
        return ledger.snapshot(runId);
    }

    public Optional<LedgerSnapshot> globalSnapshot() {
        return ledger.snapshot(SpendLedger.GLOBAL_SCOPE);
    }
}
