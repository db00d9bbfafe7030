package fr.lapetina.mesh.domain.exception;

import fr.lapetina.mesh.domain.model.ErrorType;

/**
 * A service-to-service call was refused, either because the caller's
 * certificate could not be trusted (401) or because no ACL allows it (403).
 */
public class UnauthorizedServiceException extends MeshException {

    public UnauthorizedServiceException(ErrorType errorType, String message) {
        super(errorType, message);
    }

    public UnauthorizedServiceException(ErrorType errorType, String message, Throwable cause) {
        super(errorType, message, cause);
    }

    public static UnauthorizedServiceException missingCertificate() {
        return new UnauthorizedServiceException(ErrorType.UNAUTHORIZED, "Service certificate required");
    }

    public static UnauthorizedServiceException denied(String source, String target, String permission) {
        return new UnauthorizedServiceException(ErrorType.FORBIDDEN,
                "Service '" + source + "' is not allowed to " + permission + " '" + target + "'");
    }
}
