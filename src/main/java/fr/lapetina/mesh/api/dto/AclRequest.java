package fr.lapetina.mesh.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.mesh.infrastructure.auth.AclEntry;

import java.util.List;

/**
 * Body of {@code POST /mesh/acls}. {@code allowed} defaults to true.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AclRequest {

    private String sourceService;
    private String targetService;
    private Boolean allowed;
    private List<String> permissions;

    public String getSourceService() { return sourceService; }
    public void setSourceService(String sourceService) { this.sourceService = sourceService; }

    public String getTargetService() { return targetService; }
    public void setTargetService(String targetService) { this.targetService = targetService; }

    public Boolean getAllowed() { return allowed; }
    public void setAllowed(Boolean allowed) { this.allowed = allowed; }

    public List<String> getPermissions() { return permissions; }
    public void setPermissions(List<String> permissions) { this.permissions = permissions; }

    public AclEntry toAclEntry() {
        return AclEntry.of(sourceService, targetService, allowed == null || allowed, permissions);
    }
}
