package fr.lapetina.mesh.domain.model;

import fr.lapetina.mesh.domain.exception.ValidationException;

import java.net.URI;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A single running instance of a named service.
 *
 * Identity and addressing are immutable. Health, probe failures and
 * in-flight connections are mutable and thread-safe; only the
 * {@code ServiceRegistry} flips health, while the dispatcher
 * acquires and releases connections.
 */
public final class ServiceInstance {
    private final String id;
    private final String serviceName;
    private final String version;
    private final String host;
    private final int port;
    private final String protocol;
    private final int weight;
    private final Set<String> tags;
    private final Map<String, String> metadata;
    private final String healthCheckUrl;
    private final Instant registeredAt;

    // Mutable state - thread-safe
    private final AtomicBoolean healthy;
    private final AtomicInteger inFlightRequests;
    private final AtomicInteger consecutiveProbeFailures;
    private volatile Instant lastHealthCheck;

    private ServiceInstance(Builder builder) {
        this.id = builder.id;
        this.serviceName = ValidationException.requireText(builder.serviceName, "serviceName");
        this.version = ValidationException.requireText(builder.version, "version");
        this.host = ValidationException.requireText(builder.host, "host");
        if (builder.port < 1 || builder.port > 65535) {
            throw new ValidationException("port must be between 1 and 65535");
        }
        if (builder.weight < 1) {
            throw new ValidationException("weight must be at least 1");
        }
        this.port = builder.port;
        this.protocol = builder.protocol == null || builder.protocol.isBlank() ? "http" : builder.protocol;
        this.weight = builder.weight;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.healthCheckUrl = builder.healthCheckUrl;
        this.registeredAt = Instant.now();
        this.healthy = new AtomicBoolean(true);
        this.inFlightRequests = new AtomicInteger(0);
        this.consecutiveProbeFailures = new AtomicInteger(0);
        this.lastHealthCheck = null;
    }

    public String getId() {
        return id;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getVersion() {
        return version;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getProtocol() {
        return protocol;
    }

    public int getWeight() {
        return weight;
    }

    public Set<String> getTags() {
        return tags;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public String getHealthCheckUrl() {
        return healthCheckUrl;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public URI getBaseUri() {
        return URI.create(protocol + "://" + host + ":" + port);
    }

    /**
     * Probe target: the explicit health URL, or {@code /health} on the instance.
     */
    public URI getHealthUri() {
        if (healthCheckUrl != null && !healthCheckUrl.isBlank()) {
            return URI.create(healthCheckUrl);
        }
        return getBaseUri().resolve("/health");
    }

    public boolean isHealthy() {
        return healthy.get();
    }

    /**
     * Sets the health flag and returns the previous value.
     */
    public boolean setHealthy(boolean value) {
        this.lastHealthCheck = Instant.now();
        return healthy.getAndSet(value);
    }

    public Instant getLastHealthCheck() {
        return lastHealthCheck;
    }

    public int getInFlightRequests() {
        return inFlightRequests.get();
    }

    public int acquireConnection() {
        return inFlightRequests.incrementAndGet();
    }

    /**
     * Releases a connection. Never drops below zero, so a duplicate release is harmless.
     */
    public int releaseConnection() {
        return inFlightRequests.updateAndGet(current -> current > 0 ? current - 1 : 0);
    }

    public int getConsecutiveProbeFailures() {
        return consecutiveProbeFailures.get();
    }

    public int recordProbeFailure() {
        return consecutiveProbeFailures.incrementAndGet();
    }

    public void resetProbeFailures() {
        consecutiveProbeFailures.set(0);
    }

    public boolean hasTags(Set<String> required) {
        return required == null || tags.containsAll(required);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .serviceName(serviceName)
                .version(version)
                .host(host)
                .port(port)
                .protocol(protocol)
                .weight(weight)
                .tags(tags)
                .metadata(metadata)
                .healthCheckUrl(healthCheckUrl);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServiceInstance that = (ServiceInstance) o;
        return Objects.equals(id, that.id) && serviceName.equals(that.serviceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, serviceName);
    }

    @Override
    public String toString() {
        return "ServiceInstance{" +
                "id='" + id + '\'' +
                ", service=" + serviceName +
                ", version=" + version +
                ", address=" + host + ":" + port +
                ", healthy=" + healthy.get() +
                ", inFlight=" + inFlightRequests.get() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String serviceName;
        private String version;
        private String host;
        private int port;
        private String protocol = "http";
        private int weight = 1;
        private final Set<String> tags = new LinkedHashSet<>();
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private String healthCheckUrl;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder protocol(String protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder addTag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder tags(Set<String> tags) {
            if (tags != null) {
                this.tags.addAll(tags);
            }
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder healthCheckUrl(String healthCheckUrl) {
            this.healthCheckUrl = healthCheckUrl;
            return this;
        }

        /**
         * @throws ValidationException when serviceName, version, host or port is missing or invalid
         */
        public ServiceInstance build() {
            return new ServiceInstance(this);
        }
    }
}
