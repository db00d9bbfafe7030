package fr.lapetina.mesh.domain.exception;

import fr.lapetina.mesh.domain.model.ErrorType;

public final class GatewayTimeoutException extends MeshException {

    public GatewayTimeoutException(String operation, long timeoutMs) {
        super(ErrorType.GATEWAY_TIMEOUT, "Attempt for '" + operation + "' exceeded " + timeoutMs + "ms");
    }

    public GatewayTimeoutException(String message) {
        super(ErrorType.GATEWAY_TIMEOUT, message);
    }
}
