package fr.lapetina.mesh.infrastructure.auth;

import fr.lapetina.mesh.domain.exception.ValidationException;

import java.time.Instant;
import java.util.List;

/**
 * Allow/deny row between a calling service and a target service.
 * A permission of {@code *} grants every permission.
 */
public record AclEntry(
        String sourceService,
        String targetService,
        boolean allowed,
        List<String> permissions,
        Instant updatedAt
) {

    public static final String ANY_PERMISSION = "*";

    public AclEntry {
        ValidationException.requireText(sourceService, "sourceService");
        ValidationException.requireText(targetService, "targetService");
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
        updatedAt = updatedAt == null ? Instant.now() : updatedAt;
    }

    public static AclEntry of(String sourceService, String targetService, boolean allowed, List<String> permissions) {
        return new AclEntry(sourceService, targetService, allowed, permissions, null);
    }

    public Key key() {
        return new Key(sourceService, targetService);
    }

    public static Key key(String sourceService, String targetService) {
        return new Key(sourceService, targetService);
    }

    public boolean grants(String permission) {
        return allowed && (permissions.contains(ANY_PERMISSION) || permissions.contains(permission));
    }

    /**
     * Identity of a row: the (source, target) pair, compared field by field.
     */
    public record Key(String sourceService, String targetService) {
    }
}
