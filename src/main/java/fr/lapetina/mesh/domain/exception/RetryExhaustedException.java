package fr.lapetina.mesh.domain.exception;

import fr.lapetina.mesh.domain.model.ErrorType;

/**
 * All attempts of a retried operation failed. The last failure is the cause.
 * Maps to 504 when that failure was a timeout, 502 otherwise.
 */
public final class RetryExhaustedException extends MeshException {

    private final String operation;
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super(ErrorType.RETRY_EXHAUSTED,
                "Operation '" + operation + "' failed after " + attempts + " attempt(s)",
                lastFailure);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isTimeout() {
        return getCause() instanceof GatewayTimeoutException;
    }

    @Override
    public int getHttpStatus() {
        return isTimeout() ? ErrorType.GATEWAY_TIMEOUT.getHttpStatus() : super.getHttpStatus();
    }
}
