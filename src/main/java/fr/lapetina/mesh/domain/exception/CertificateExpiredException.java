package fr.lapetina.mesh.domain.exception;

import fr.lapetina.mesh.domain.model.ErrorType;

public final class CertificateExpiredException extends UnauthorizedServiceException {

    public CertificateExpiredException(String message, Throwable cause) {
        super(ErrorType.CERTIFICATE_EXPIRED, message, cause);
    }
}
