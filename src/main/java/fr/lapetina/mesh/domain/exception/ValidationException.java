package fr.lapetina.mesh.domain.exception;

import fr.lapetina.mesh.domain.model.ErrorType;

/**
 * Thrown when a registration, route, canary or ACL payload is malformed.
 */
public final class ValidationException extends MeshException {

    public ValidationException(String message) {
        super(ErrorType.VALIDATION_ERROR, message);
    }

    /**
     * Fails with a "field is required" message when the value is null or blank.
     */
    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }

    public static <T> T requireNonNull(T value, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }
}
