package io.thinmesh.model;

public enum NodeState {
    BLOCKED,
    READY,
    DISPATCHED,
    DONE,
    FAILED,
    SKIPPED
}
