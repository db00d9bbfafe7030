package fr.lapetina.mesh.domain.model;

/**
 * Error taxonomy surfaced by the gateway and the admin API.
 * Each type carries the HTTP status it maps to.
 */
public enum ErrorType {
    /** Malformed registration, route, canary or ACL payload */
    VALIDATION_ERROR(400),

    /** Unknown service, instance, route or canary */
    NOT_FOUND(404),

    /** Missing, invalid or superseded service certificate */
    UNAUTHORIZED(401),

    /** Certificate past its expiry */
    CERTIFICATE_EXPIRED(401),

    /** Certificate that failed signature or structure checks */
    CERTIFICATE_INVALID(401),

    /** ACL denied the call */
    FORBIDDEN(403),

    /** Circuit breaker rejected the call without invoking the backend */
    CIRCUIT_OPEN(503),

    /** No healthy instance for the requested service/version */
    SERVICE_UNAVAILABLE(503),

    /** Pipeline ring buffer is full */
    BACKPRESSURE(503),

    /** All retry attempts failed */
    RETRY_EXHAUSTED(502),

    /** Backend replied with a server-side error status */
    UPSTREAM_ERROR(502),

    /** Per-attempt deadline exceeded */
    GATEWAY_TIMEOUT(504),

    /** Unclassified failure while talking to a backend */
    BAD_GATEWAY(502),

    /** Internal system error */
    INTERNAL_ERROR(500);

    private final int httpStatus;

    ErrorType(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
