package fr.lapetina.mesh.domain.exception;

import fr.lapetina.mesh.domain.model.ErrorType;

/**
 * No healthy instance can serve the call.
 */
public final class ServiceUnavailableException extends MeshException {

    public ServiceUnavailableException(String serviceName, String version) {
        super(ErrorType.SERVICE_UNAVAILABLE, version == null
                ? "No healthy instance available for service: " + serviceName
                : "No healthy instance available for service: " + serviceName + " version " + version);
    }
}
