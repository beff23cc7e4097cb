package io.thinmesh.error;

/**
 * Base of the orchestration error taxonomy. All subclasses are unchecked.
 */
public class ThinMeshException extends RuntimeException {
    public ThinMeshException(String message) {
        super(message);
    }

    public ThinMeshException(String message, Throwable cause) {
        super(message, cause);
    }
}
