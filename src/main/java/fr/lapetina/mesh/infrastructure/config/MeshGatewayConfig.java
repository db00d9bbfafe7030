package fr.lapetina.mesh.infrastructure.config;

import fr.lapetina.mesh.controlplane.MeshSettings;
import fr.lapetina.mesh.domain.model.ServiceInstance;
import fr.lapetina.mesh.domain.strategy.SelectionStrategy;
import fr.lapetina.mesh.gateway.AggregationConfig;
import fr.lapetina.mesh.gateway.GatewayRoute;
import fr.lapetina.mesh.gateway.TransformationConfig;
import fr.lapetina.mesh.infrastructure.auth.AclEntry;
import fr.lapetina.mesh.infrastructure.resilience.CircuitBreakerConfig;
import fr.lapetina.mesh.infrastructure.resilience.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration object for the mesh and gateway.
 * Designed to be populated from YAML.
 */
public class MeshGatewayConfig {

    private ServerConfig server = new ServerConfig();
    private MeshConfig mesh = new MeshConfig();
    private RegistryConfig registry = new RegistryConfig();
    private CircuitBreakerSection circuitBreaker = new CircuitBreakerSection();
    private RetryConfig retry = new RetryConfig();
    private AuthConfig auth = new AuthConfig();
    private GatewayConfig gateway = new GatewayConfig();
    private List<ServiceConfig> services = new ArrayList<>();
    private List<AclConfig> acls = new ArrayList<>();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public MeshConfig getMesh() { return mesh; }
    public void setMesh(MeshConfig mesh) { this.mesh = mesh; }

    public RegistryConfig getRegistry() { return registry; }
    public void setRegistry(RegistryConfig registry) { this.registry = registry; }

    public CircuitBreakerSection getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerSection circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public AuthConfig getAuth() { return auth; }
    public void setAuth(AuthConfig auth) { this.auth = auth; }

    public GatewayConfig getGateway() { return gateway; }
    public void setGateway(GatewayConfig gateway) { this.gateway = gateway; }

    public List<ServiceConfig> getServices() { return services; }
    public void setServices(List<ServiceConfig> services) { this.services = services; }

    public List<AclConfig> getAcls() { return acls; }
    public void setAcls(List<AclConfig> acls) { this.acls = acls; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 16;
        private String adminToken;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

        public String getAdminToken() { return adminToken; }
        public void setAdminToken(String adminToken) { this.adminToken = adminToken; }
    }

    /**
     * Feature switches of the control plane.
     */
    public static class MeshConfig {
        private boolean enabled = true;
        private boolean serviceDiscovery = true;
        private boolean retryPolicy = true;
        private boolean trafficRouting = true;
        private boolean serviceAuth = true;
        private boolean healthChecking = true;
        private boolean observability = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isServiceDiscovery() { return serviceDiscovery; }
        public void setServiceDiscovery(boolean serviceDiscovery) { this.serviceDiscovery = serviceDiscovery; }

        public boolean isRetryPolicy() { return retryPolicy; }
        public void setRetryPolicy(boolean retryPolicy) { this.retryPolicy = retryPolicy; }

        public boolean isTrafficRouting() { return trafficRouting; }
        public void setTrafficRouting(boolean trafficRouting) { this.trafficRouting = trafficRouting; }

        public boolean isServiceAuth() { return serviceAuth; }
        public void setServiceAuth(boolean serviceAuth) { this.serviceAuth = serviceAuth; }

        public boolean isHealthChecking() { return healthChecking; }
        public void setHealthChecking(boolean healthChecking) { this.healthChecking = healthChecking; }

        public boolean isObservability() { return observability; }
        public void setObservability(boolean observability) { this.observability = observability; }

        public MeshSettings toSettings() {
            return new MeshSettings(enabled, serviceDiscovery, retryPolicy, trafficRouting,
                    serviceAuth, healthChecking, observability);
        }
    }

    /**
     * Service registry and health probing.
     */
    public static class RegistryConfig {
        private String defaultStrategy = "round-robin";
        private long healthCheckIntervalMs = 30000;
        private long healthCheckTimeoutMs = 5000;
        private long connectTimeoutMs = 5000;
        private int unhealthyThreshold = 3;

        public String getDefaultStrategy() { return defaultStrategy; }
        public void setDefaultStrategy(String defaultStrategy) { this.defaultStrategy = defaultStrategy; }

        public long getHealthCheckIntervalMs() { return healthCheckIntervalMs; }
        public void setHealthCheckIntervalMs(long healthCheckIntervalMs) { this.healthCheckIntervalMs = healthCheckIntervalMs; }

        public long getHealthCheckTimeoutMs() { return healthCheckTimeoutMs; }
        public void setHealthCheckTimeoutMs(long healthCheckTimeoutMs) { this.healthCheckTimeoutMs = healthCheckTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public int getUnhealthyThreshold() { return unhealthyThreshold; }
        public void setUnhealthyThreshold(int unhealthyThreshold) { this.unhealthyThreshold = unhealthyThreshold; }

        public SelectionStrategy resolveDefaultStrategy() {
            return SelectionStrategy.fromName(defaultStrategy)
                    .orElseThrow(() -> new ConfigLoader.ConfigurationException(
                            "Unknown registry.defaultStrategy: " + defaultStrategy));
        }
    }

    /**
     * Default thresholds of every circuit breaker.
     */
    public static class CircuitBreakerSection {
        private int failureThreshold = 5;
        private int successThreshold = 2;
        private long timeoutMs = 60000;
        private long monitoringPeriodMs = 10000;
        private int halfOpenMaxCalls = 1;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public int getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(int successThreshold) { this.successThreshold = successThreshold; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public long getMonitoringPeriodMs() { return monitoringPeriodMs; }
        public void setMonitoringPeriodMs(long monitoringPeriodMs) { this.monitoringPeriodMs = monitoringPeriodMs; }

        public int getHalfOpenMaxCalls() { return halfOpenMaxCalls; }
        public void setHalfOpenMaxCalls(int halfOpenMaxCalls) { this.halfOpenMaxCalls = halfOpenMaxCalls; }

        public CircuitBreakerConfig toBreakerConfig() {
            return new CircuitBreakerConfig(failureThreshold, successThreshold,
                    Duration.ofMillis(timeoutMs), Duration.ofMillis(monitoringPeriodMs), halfOpenMaxCalls);
        }
    }

    /**
     * Retry settings of one operation. Used both for the defaults and for named overrides.
     */
    public static class RetryPolicyConfig {
        private int maxAttempts = 3;
        private long baseDelayMs = 100;
        private double multiplier = 2.0;
        private long maxDelayMs = 5000;
        private boolean jitter = true;
        private double jitterFactor = 0.1;
        private long attemptTimeoutMs = 0;
        private int budgetPercent = 20;
        private Set<String> retryableErrors = new HashSet<>();

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }

        public double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }

        public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }

        public int getBudgetPercent() { return budgetPercent; }
        public void setBudgetPercent(int budgetPercent) { this.budgetPercent = budgetPercent; }

        public Set<String> getRetryableErrors() { return retryableErrors; }
        public void setRetryableErrors(Set<String> retryableErrors) { this.retryableErrors = retryableErrors; }

        public RetryPolicy toPolicy(String operation) {
            return new RetryPolicy(operation, maxAttempts, baseDelayMs, multiplier, maxDelayMs,
                    retryableErrors, jitter, jitterFactor, attemptTimeoutMs, budgetPercent);
        }
    }

    /**
     * Retry defaults, budget window and per-operation overrides.
     */
    public static class RetryConfig extends RetryPolicyConfig {
        private long budgetWindowMs = 10000;
        private Map<String, RetryPolicyConfig> policies = new LinkedHashMap<>();

        public long getBudgetWindowMs() { return budgetWindowMs; }
        public void setBudgetWindowMs(long budgetWindowMs) { this.budgetWindowMs = budgetWindowMs; }

        public Map<String, RetryPolicyConfig> getPolicies() { return policies; }
        public void setPolicies(Map<String, RetryPolicyConfig> policies) { this.policies = policies; }
    }

    /**
     * Certificate issuance and rotation.
     */
    public static class AuthConfig {
        private String signingSecret;
        private long certificateTtlMs = 86400000;
        private long rotationThresholdMs = 3600000;
        private long rotationCheckIntervalMs = 300000;
        private boolean autoRotate = false;

        public String getSigningSecret() { return signingSecret; }
        public void setSigningSecret(String signingSecret) { this.signingSecret = signingSecret; }

        public long getCertificateTtlMs() { return certificateTtlMs; }
        public void setCertificateTtlMs(long certificateTtlMs) { this.certificateTtlMs = certificateTtlMs; }

        public long getRotationThresholdMs() { return rotationThresholdMs; }
        public void setRotationThresholdMs(long rotationThresholdMs) { this.rotationThresholdMs = rotationThresholdMs; }

        public long getRotationCheckIntervalMs() { return rotationCheckIntervalMs; }
        public void setRotationCheckIntervalMs(long rotationCheckIntervalMs) { this.rotationCheckIntervalMs = rotationCheckIntervalMs; }

        public boolean isAutoRotate() { return autoRotate; }
        public void setAutoRotate(boolean autoRotate) { this.autoRotate = autoRotate; }
    }

    /**
     * Gateway pipeline, cache and route table.
     */
    public static class GatewayConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long cacheMaxEntries = 10000;
        private long defaultTimeoutMs = 30000;
        private List<RouteConfig> routes = new ArrayList<>();

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public long getCacheMaxEntries() { return cacheMaxEntries; }
        public void setCacheMaxEntries(long cacheMaxEntries) { this.cacheMaxEntries = cacheMaxEntries; }

        public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
        public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }

        public List<RouteConfig> getRoutes() { return routes; }
        public void setRoutes(List<RouteConfig> routes) { this.routes = routes; }
    }

    /**
     * One gateway route as written in YAML.
     */
    public static class RouteConfig {
        private String path;
        private String method = "GET";
        private String serviceName;
        private String targetPath;
        private int cacheTtlSeconds = 0;
        private long timeoutMs = 0;
        private boolean requiresAuth = false;
        private String strategy;
        private AggregationSection aggregation;
        private TransformationSection transformation;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public String getMethod() { return method; }
        public void setMethod(String method) { this.method = method; }

        public String getServiceName() { return serviceName; }
        public void setServiceName(String serviceName) { this.serviceName = serviceName; }

        public String getTargetPath() { return targetPath; }
        public void setTargetPath(String targetPath) { this.targetPath = targetPath; }

        public int getCacheTtlSeconds() { return cacheTtlSeconds; }
        public void setCacheTtlSeconds(int cacheTtlSeconds) { this.cacheTtlSeconds = cacheTtlSeconds; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public boolean isRequiresAuth() { return requiresAuth; }
        public void setRequiresAuth(boolean requiresAuth) { this.requiresAuth = requiresAuth; }

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public AggregationSection getAggregation() { return aggregation; }
        public void setAggregation(AggregationSection aggregation) { this.aggregation = aggregation; }

        public TransformationSection getTransformation() { return transformation; }
        public void setTransformation(TransformationSection transformation) { this.transformation = transformation; }

        public GatewayRoute toRoute() {
            SelectionStrategy selection = null;
            if (strategy != null && !strategy.isBlank()) {
                selection = SelectionStrategy.fromName(strategy)
                        .orElseThrow(() -> new ConfigLoader.ConfigurationException(
                                "Unknown strategy '" + strategy + "' on route " + path));
            }
            return GatewayRoute.builder()
                    .path(path)
                    .method(method)
                    .serviceName(serviceName)
                    .targetPath(targetPath)
                    .cacheTtlSeconds(cacheTtlSeconds)
                    .timeoutMs(timeoutMs)
                    .requiresAuth(requiresAuth)
                    .strategy(selection)
                    .aggregation(aggregation == null ? null : aggregation.toAggregation())
                    .transformation(transformation == null ? null : transformation.toTransformation())
                    .build();
        }
    }

    public static class AggregationSection {
        private String mode = "parallel";
        private List<AggregationTarget> targets = new ArrayList<>();

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public List<AggregationTarget> getTargets() { return targets; }
        public void setTargets(List<AggregationTarget> targets) { this.targets = targets; }

        AggregationConfig toAggregation() {
            List<AggregationConfig.Target> converted = new ArrayList<>();
            for (AggregationTarget target : targets) {
                converted.add(new AggregationConfig.Target(target.getServiceName(), target.getPath(), target.getMapTo()));
            }
            AggregationConfig.Mode parsed = mode == null
                    ? null
                    : AggregationConfig.Mode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
            return new AggregationConfig(parsed, converted);
        }
    }

    public static class AggregationTarget {
        private String serviceName;
        private String path;
        private String mapTo;

        public String getServiceName() { return serviceName; }
        public void setServiceName(String serviceName) { this.serviceName = serviceName; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public String getMapTo() { return mapTo; }
        public void setMapTo(String mapTo) { this.mapTo = mapTo; }
    }

    public static class TransformationSection {
        private String extract;
        private Map<String, String> rename = new LinkedHashMap<>();
        private List<String> remove = new ArrayList<>();
        private String wrap;

        public String getExtract() { return extract; }
        public void setExtract(String extract) { this.extract = extract; }

        public Map<String, String> getRename() { return rename; }
        public void setRename(Map<String, String> rename) { this.rename = rename; }

        public List<String> getRemove() { return remove; }
        public void setRemove(List<String> remove) { this.remove = remove; }

        public String getWrap() { return wrap; }
        public void setWrap(String wrap) { this.wrap = wrap; }

        TransformationConfig toTransformation() {
            return new TransformationConfig(extract, rename, remove, wrap);
        }
    }

    /**
     * Instance registered at startup.
     */
    public static class ServiceConfig {
        private String id;
        private String serviceName;
        private String version = "1.0.0";
        private String host = "localhost";
        private int port;
        private String protocol = "http";
        private int weight = 1;
        private Set<String> tags = new HashSet<>();
        private Map<String, String> metadata = new LinkedHashMap<>();
        private String healthCheckUrl;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getServiceName() { return serviceName; }
        public void setServiceName(String serviceName) { this.serviceName = serviceName; }

        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getProtocol() { return protocol; }
        public void setProtocol(String protocol) { this.protocol = protocol; }

        public int getWeight() { return weight; }
        public void setWeight(int weight) { this.weight = weight; }

        public Set<String> getTags() { return tags; }
        public void setTags(Set<String> tags) { this.tags = tags; }

        public Map<String, String> getMetadata() { return metadata; }
        public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }

        public String getHealthCheckUrl() { return healthCheckUrl; }
        public void setHealthCheckUrl(String healthCheckUrl) { this.healthCheckUrl = healthCheckUrl; }

        public ServiceInstance toInstance() {
            return ServiceInstance.builder()
                    .id(id)
                    .serviceName(serviceName)
                    .version(version)
                    .host(host)
                    .port(port)
                    .protocol(protocol)
                    .weight(weight)
                    .tags(tags)
                    .metadata(metadata)
                    .healthCheckUrl(healthCheckUrl)
                    .build();
        }
    }

    /**
     * ACL row seeded at startup.
     */
    public static class AclConfig {
        private String sourceService;
        private String targetService;
        private boolean allowed = true;
        private List<String> permissions = new ArrayList<>();

        public String getSourceService() { return sourceService; }
        public void setSourceService(String sourceService) { this.sourceService = sourceService; }

        public String getTargetService() { return targetService; }
        public void setTargetService(String targetService) { this.targetService = targetService; }

        public boolean isAllowed() { return allowed; }
        public void setAllowed(boolean allowed) { this.allowed = allowed; }

        public List<String> getPermissions() { return permissions; }
        public void setPermissions(List<String> permissions) { this.permissions = permissions; }

        public AclEntry toAclEntry() {
            return AclEntry.of(sourceService, targetService, allowed, permissions);
        }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "mesh";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
