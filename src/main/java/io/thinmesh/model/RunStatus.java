package io.thinmesh.model;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    HALTED,
    CANCELLED
}
