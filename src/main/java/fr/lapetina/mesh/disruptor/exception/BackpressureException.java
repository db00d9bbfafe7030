package fr.lapetina.mesh.disruptor.exception;

import fr.lapetina.mesh.domain.exception.MeshException;
import fr.lapetina.mesh.domain.model.ErrorType;

/**
 * Thrown when the gateway cannot accept another request.
 */
public final class BackpressureException extends MeshException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason) {
        super(ErrorType.BACKPRESSURE, "Backpressure: " + reason.getMessage());
        this.reason = reason;
    }

    public BackpressureException(BackpressureReason reason, String details) {
        super(ErrorType.BACKPRESSURE, "Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        RING_BUFFER_FULL("Ring buffer is full"),
        PIPELINE_STOPPED("Gateway pipeline is not running");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
