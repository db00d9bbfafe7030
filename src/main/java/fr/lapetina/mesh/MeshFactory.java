package fr.lapetina.mesh;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.mesh.controlplane.MeshControlPlane;
import fr.lapetina.mesh.controlplane.MeshSettings;
import fr.lapetina.mesh.disruptor.GatewayPipeline;
import fr.lapetina.mesh.domain.routing.TrafficRouter;
import fr.lapetina.mesh.gateway.ApiGateway;
import fr.lapetina.mesh.gateway.GatewayRoute;
import fr.lapetina.mesh.gateway.ResponseCache;
import fr.lapetina.mesh.gateway.ServiceDispatcher;
import fr.lapetina.mesh.infrastructure.auth.ServiceAuthority;
import fr.lapetina.mesh.infrastructure.config.ConfigLoader;
import fr.lapetina.mesh.infrastructure.config.MeshGatewayConfig;
import fr.lapetina.mesh.infrastructure.health.InstanceHealthChecker;
import fr.lapetina.mesh.infrastructure.http.ServiceHttpClient;
import fr.lapetina.mesh.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mesh.infrastructure.registry.ServiceRegistry;
import fr.lapetina.mesh.infrastructure.resilience.CircuitBreakerRegistry;
import fr.lapetina.mesh.infrastructure.resilience.RetryPolicy;
import fr.lapetina.mesh.infrastructure.resilience.RetryPolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a fully wired mesh and gateway from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (MeshFactory factory = MeshFactory.create("config.yaml").start()) {
 *     ApiGateway gateway = factory.getGateway();
 *     // use gateway...
 * }
 * }</pre>
 */
public class MeshFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MeshFactory.class);

    private final ConfigLoader configLoader;
    private final MeshGatewayConfig config;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metricsRegistry;
    private final ServiceRegistry serviceRegistry;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RetryPolicyEngine retryEngine;
    private final TrafficRouter trafficRouter;
    private final ServiceAuthority serviceAuthority;
    private final ServiceHttpClient httpClient;
    private final InstanceHealthChecker healthChecker;
    private final MeshControlPlane controlPlane;
    private final ResponseCache responseCache;
    private final ApiGateway gateway;
    private final GatewayPipeline pipeline;

    protected MeshFactory(String configPath, ServiceHttpClient httpClientOverride) {
        log.info("Initializing MeshFactory from config: path={}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        MeshGatewayConfig.RegistryConfig registryConfig = config.getRegistry();
        this.serviceRegistry = new ServiceRegistry(
                registryConfig.resolveDefaultStrategy(),
                registryConfig.getUnhealthyThreshold()
        );
        this.circuitBreakers = new CircuitBreakerRegistry(config.getCircuitBreaker().toBreakerConfig());
        this.retryEngine = new RetryPolicyEngine(
                circuitBreakers,
                config.getRetry().toPolicy("default"),
                config.getRetry().getBudgetWindowMs()
        );
        registerRetryPolicies(config.getRetry());

        this.trafficRouter = new TrafficRouter(serviceRegistry);

        MeshGatewayConfig.AuthConfig authConfig = config.getAuth();
        this.serviceAuthority = new ServiceAuthority(
                authConfig.getSigningSecret(),
                Duration.ofMillis(authConfig.getCertificateTtlMs()),
                Duration.ofMillis(authConfig.getRotationThresholdMs())
        );

        // Tests substitute a stub backend
        this.httpClient = httpClientOverride != null ? httpClientOverride : createHttpClient();

        this.healthChecker = new InstanceHealthChecker(
                serviceRegistry,
                httpClient,
                Duration.ofMillis(registryConfig.getHealthCheckIntervalMs()),
                Duration.ofMillis(registryConfig.getHealthCheckTimeoutMs())
        );

        this.controlPlane = new MeshControlPlane(
                config.getMesh().toSettings(),
                serviceRegistry,
                circuitBreakers,
                retryEngine,
                trafficRouter,
                serviceAuthority,
                healthChecker
        );

        MeshGatewayConfig.GatewayConfig gatewayConfig = config.getGateway();
        this.responseCache = new ResponseCache(gatewayConfig.getCacheMaxEntries());
        ServiceDispatcher dispatcher = new ServiceDispatcher(controlPlane, httpClient, gatewayConfig.getDefaultTimeoutMs());
        this.gateway = new ApiGateway(controlPlane, dispatcher, responseCache, objectMapper, metricsRegistry);

        this.pipeline = GatewayPipeline.builder()
                .ringBufferSize(gatewayConfig.getRingBufferSize())
                .waitStrategy(gatewayConfig.getWaitStrategy())
                .gateway(gateway)
                .metricsRegistry(metricsRegistry)
                .build();

        registerMeshMetrics();
        seedServices();
        seedAcls();
        registerGatewayRoutes(gatewayConfig.getRoutes());

        configLoader.addListener(this::onConfigChanged);

        log.info("MeshFactory initialized: services={}, instances={}, gatewayRoutes={}",
                serviceRegistry.getServiceNames().size(), serviceRegistry.size(), gateway.getRoutes().size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static MeshFactory create(String configPath) {
        return new MeshFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static MeshFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the control plane tasks, the gateway pipeline and configuration watching.
     */
    public MeshFactory start() {
        controlPlane.start();
        pipeline.start();
        MeshGatewayConfig.AuthConfig authConfig = config.getAuth();
        if (authConfig.getRotationCheckIntervalMs() > 0) {
            serviceAuthority.startRotationChecks(
                    Duration.ofMillis(authConfig.getRotationCheckIntervalMs()),
                    authConfig.isAutoRotate()
            );
        }
        configLoader.startWatching();
        log.info("Mesh started");
        return this;
    }

    private ServiceHttpClient createHttpClient() {
        return new ServiceHttpClient(
                Duration.ofMillis(config.getRegistry().getConnectTimeoutMs()),
                Duration.ofMillis(config.getRegistry().getHealthCheckTimeoutMs())
        );
    }

    /**
     * Built-in policies first, so that configured ones with the same name win.
     */
    private void registerRetryPolicies(MeshGatewayConfig.RetryConfig retryConfig) {
        RetryPolicy base = retryConfig.toPolicy("default");
        retryEngine.registerPolicy(new RetryPolicy("payment-service", 2, 500, 1.5, 2000,
                base.retryableErrors(), base.jitter(), base.jitterFactor(), base.attemptTimeoutMs(), base.budgetPercent()));
        retryEngine.registerPolicy(new RetryPolicy("notification-service", 5, 100, 2.0, 10000,
                base.retryableErrors(), base.jitter(), base.jitterFactor(), base.attemptTimeoutMs(), base.budgetPercent()));
        retryEngine.registerPolicy(new RetryPolicy("booking-service", 3, 200, 2.0, 5000,
                base.retryableErrors(), base.jitter(), base.jitterFactor(), base.attemptTimeoutMs(), base.budgetPercent()));
        applyConfiguredPolicies(retryConfig);
    }

    private void applyConfiguredPolicies(MeshGatewayConfig.RetryConfig retryConfig) {
        for (Map.Entry<String, MeshGatewayConfig.RetryPolicyConfig> entry : retryConfig.getPolicies().entrySet()) {
            retryEngine.registerPolicy(entry.getValue().toPolicy(entry.getKey()));
        }
    }

    private void registerMeshMetrics() {
        circuitBreakers.addListener(transition -> {
            if (controlPlane.getConfig().observability()) {
                metricsRegistry.incrementBreakerTransition(transition.name(), transition.to().name());
            }
        });
        serviceRegistry.addListener(event -> {
            if (event.type() == ServiceRegistry.RegistryEvent.Type.ADDED) {
                String serviceName = event.instance().getServiceName();
                metricsRegistry.registerHealthyInstances(serviceName, () -> serviceRegistry.countHealthy(serviceName));
            }
        });
        metricsRegistry.registerFunctionCounter("retry_attempts_total",
                "Attempts made by the retry engine", retryEngine, engine -> engine.getStats().totalAttempts());
        metricsRegistry.registerFunctionCounter("retry_exhausted_total",
                "Calls that failed after their last allowed attempt", retryEngine,
                engine -> engine.getStats().retriesExhausted());
        metricsRegistry.registerFunctionCounter("retry_budget_exceeded_total",
                "Calls denied retries by the retry budget", retryEngine, engine -> engine.getStats().budgetExceeded());
    }

    private void seedServices() {
        for (MeshGatewayConfig.ServiceConfig serviceConfig : config.getServices()) {
            serviceRegistry.register(serviceConfig.toInstance());
        }
    }

    private void seedAcls() {
        for (MeshGatewayConfig.AclConfig aclConfig : config.getAcls()) {
            serviceAuthority.addAcl(aclConfig.toAclEntry());
        }
    }

    private void registerGatewayRoutes(List<MeshGatewayConfig.RouteConfig> routes) {
        for (MeshGatewayConfig.RouteConfig routeConfig : routes) {
            gateway.registerRoute(routeConfig.toRoute());
        }
    }

    private void onConfigChanged(MeshGatewayConfig oldConfig, MeshGatewayConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying updates...");

        controlPlane.updateConfig(MeshSettings.Update.of(newConfig.getMesh().toSettings()));
        serviceRegistry.setDefaultStrategy(newConfig.getRegistry().resolveDefaultStrategy());
        circuitBreakers.setDefaultConfig(newConfig.getCircuitBreaker().toBreakerConfig());

        retryEngine.setDefaultPolicy(newConfig.getRetry().toPolicy("default"));
        for (String removed : oldConfig.getRetry().getPolicies().keySet()) {
            if (!newConfig.getRetry().getPolicies().containsKey(removed)) {
                retryEngine.removePolicy(removed);
            }
        }
        applyConfiguredPolicies(newConfig.getRetry());

        // Routes added at runtime through the admin API are kept
        Set<String> newKeys = new HashSet<>();
        for (MeshGatewayConfig.RouteConfig routeConfig : newConfig.getGateway().getRoutes()) {
            GatewayRoute route = routeConfig.toRoute();
            newKeys.add(route.getRouteKey());
            gateway.registerRoute(route);
        }
        for (MeshGatewayConfig.RouteConfig routeConfig : oldConfig.getGateway().getRoutes()) {
            GatewayRoute route = routeConfig.toRoute();
            if (!newKeys.contains(route.getRouteKey())) {
                gateway.removeRoute(route.method(), route.path());
            }
        }

        log.info("Configuration updates applied");
    }

    /**
     * Configuration currently in effect, including hot reloads.
     */
    public MeshGatewayConfig getConfig() {
        return configLoader.getCurrentConfig();
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ServiceRegistry getServiceRegistry() {
        return serviceRegistry;
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }

    public RetryPolicyEngine getRetryEngine() {
        return retryEngine;
    }

    public TrafficRouter getTrafficRouter() {
        return trafficRouter;
    }

    public ServiceAuthority getServiceAuthority() {
        return serviceAuthority;
    }

    public ServiceHttpClient getHttpClient() {
        return httpClient;
    }

    public MeshControlPlane getControlPlane() {
        return controlPlane;
    }

    public ResponseCache getResponseCache() {
        return responseCache;
    }

    public ApiGateway getGateway() {
        return gateway;
    }

    public GatewayPipeline getPipeline() {
        return pipeline;
    }

    @Override
    public void close() {
        log.info("Shutting down MeshFactory...");

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing pipeline", e);
        }

        try {
            controlPlane.close();
        } catch (Exception e) {
            log.warn("Error closing control plane", e);
        }

        try {
            httpClient.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("MeshFactory shut down");
    }
}
