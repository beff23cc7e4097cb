package io.thinmesh.model;

public enum MessageState {
    QUEUED,
    CLAIMED,
    ACKED,
    DEAD_LETTER
}
