package fr.lapetina.mesh.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of {@code POST /mesh/canaries}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CanaryRequest {

    private String serviceName;
    private String canaryVersion;
    private String stableVersion;
    private Integer trafficPercent;

    public String getServiceName() { return serviceName; }
    public void setServiceName(String serviceName) { this.serviceName = serviceName; }

    public String getCanaryVersion() { return canaryVersion; }
    public void setCanaryVersion(String canaryVersion) { this.canaryVersion = canaryVersion; }

    public String getStableVersion() { return stableVersion; }
    public void setStableVersion(String stableVersion) { this.stableVersion = stableVersion; }

    public Integer getTrafficPercent() { return trafficPercent; }
    public void setTrafficPercent(Integer trafficPercent) { this.trafficPercent = trafficPercent; }
}
