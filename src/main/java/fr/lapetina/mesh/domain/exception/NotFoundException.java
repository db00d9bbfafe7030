package fr.lapetina.mesh.domain.exception;

import fr.lapetina.mesh.domain.model.ErrorType;

public final class NotFoundException extends MeshException {

    public NotFoundException(String kind, String id) {
        super(ErrorType.NOT_FOUND, kind + " not found: " + id);
    }
}
