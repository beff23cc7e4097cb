package io.thinmesh.model;

public record LedgerSnapshot(
        String scope,
        long spentMicros,
        long inFlightMicros,
        long ceilingMicros,
        boolean halted,
        long updatedAtMs
) {
    public boolean unlimited() {
        return ceilingMicros < 0L;
    }
}
