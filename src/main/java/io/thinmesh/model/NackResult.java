package io.thinmesh.model;

public enum NackResult {
    REQUEUED,
    DEAD_LETTERED,
    STALE_LEASE
}
