package io.thinmesh.error;

/**
 * The artifact store or queue backend is temporarily unavailable. Callers retry
 * with backoff; the bytes or state behind the failed call are never partial.
 */
public class TransientStorageException extends ThinMeshException {
    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
