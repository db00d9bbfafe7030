package fr.lapetina.mesh.domain.exception;

import fr.lapetina.mesh.domain.model.ErrorType;

/**
 * Fail-fast rejection from an open (or saturated half-open) circuit breaker.
 * The wrapped call was never invoked.
 */
public final class CircuitOpenException extends MeshException {

    private final String circuitName;
    private final long retryAfterMs;

    public CircuitOpenException(String circuitName, long retryAfterMs) {
        super(ErrorType.CIRCUIT_OPEN, "Circuit '" + circuitName + "' is open, retry after " + retryAfterMs + "ms");
        this.circuitName = circuitName;
        this.retryAfterMs = retryAfterMs;
    }

    public String getCircuitName() {
        return circuitName;
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }

    /**
     * Retry-After hint in whole seconds, rounded up, never below one.
     */
    public long getRetryAfterSeconds() {
        return Math.max(1, (retryAfterMs + 999) / 1000);
    }
}
