package io.thinmesh.error;

public class RunSpecException extends ThinMeshException {
    public RunSpecException(String message) {
        super(message);
    }

    public RunSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
