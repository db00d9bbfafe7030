package fr.lapetina.mesh.domain.exception;

import fr.lapetina.mesh.domain.model.ErrorType;

/**
 * The backend answered, but with a status the mesh treats as a failure (5xx, 429).
 */
public final class UpstreamStatusException extends MeshException {

    private final int statusCode;

    public UpstreamStatusException(String serviceName, int statusCode) {
        super(ErrorType.UPSTREAM_ERROR, "Service '" + serviceName + "' responded with status " + statusCode);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
