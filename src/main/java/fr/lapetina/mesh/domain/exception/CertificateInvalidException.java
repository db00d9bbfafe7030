package fr.lapetina.mesh.domain.exception;

import fr.lapetina.mesh.domain.model.ErrorType;

public final class CertificateInvalidException extends UnauthorizedServiceException {

    public CertificateInvalidException(String message) {
        super(ErrorType.CERTIFICATE_INVALID, message);
    }

    public CertificateInvalidException(String message, Throwable cause) {
        super(ErrorType.CERTIFICATE_INVALID, message, cause);
    }
}
