package io.thinmesh.error;

/**
 * Content does not match its declared identity: a hash mismatch, a corrupted
 * manifest entry, or a task key that does not derive from its declared inputs.
 * Never retried.
 */
public class IntegrityException extends ThinMeshException {
    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
