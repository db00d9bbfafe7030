package fr.lapetina.mesh.domain.exception;

import fr.lapetina.mesh.domain.model.ErrorType;

/**
 * Base class for every error the mesh surfaces to callers.
 * The message is safe to return to clients; causes are only logged.
 */
public class MeshException extends RuntimeException {

    private final ErrorType errorType;

    public MeshException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public MeshException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public int getHttpStatus() {
        return errorType.getHttpStatus();
    }
}
