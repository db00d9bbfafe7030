package fr.lapetina.mesh.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.mesh.domain.model.ServiceInstance;

import java.util.Map;
import java.util.Set;

/**
 * Body of {@code POST /mesh/services}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceRegistrationRequest {

    private String id;
    private String serviceName;
    private String version;
    private String host;
    private Integer port;
    private String protocol;
    private Integer weight;
    private Set<String> tags;
    private Map<String, String> metadata;
    private String healthCheckUrl;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getServiceName() { return serviceName; }
    public void setServiceName(String serviceName) { this.serviceName = serviceName; }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public Integer getPort() { return port; }
    public void setPort(Integer port) { this.port = port; }

    public String getProtocol() { return protocol; }
    public void setProtocol(String protocol) { this.protocol = protocol; }

    public Integer getWeight() { return weight; }
    public void setWeight(Integer weight) { this.weight = weight; }

    public Set<String> getTags() { return tags; }
    public void setTags(Set<String> tags) { this.tags = tags; }

    public Map<String, String> getMetadata() { return metadata; }
    public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }

    public String getHealthCheckUrl() { return healthCheckUrl; }
    public void setHealthCheckUrl(String healthCheckUrl) { this.healthCheckUrl = healthCheckUrl; }

    /**
     * @throws fr.lapetina.mesh.domain.exception.ValidationException when a required field is missing
     */
    public ServiceInstance toInstance() {
        return ServiceInstance.builder()
                .id(id)
                .serviceName(serviceName)
                .version(version)
                .host(host)
                .port(port == null ? 0 : port)
                .protocol(protocol)
                .weight(weight == null ? 1 : weight)
                .tags(tags)
                .metadata(metadata)
                .healthCheckUrl(healthCheckUrl)
                .build();
    }
}
