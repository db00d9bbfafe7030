package fr.lapetina.mesh.controlplane;

import com.fasterxml.jackson.annotation.JsonValue;
import fr.lapetina.mesh.domain.routing.TrafficRouter;
import fr.lapetina.mesh.infrastructure.auth.ServiceAuthority;
import fr.lapetina.mesh.infrastructure.health.InstanceHealthChecker;
import fr.lapetina.mesh.infrastructure.registry.ServiceRegistry;
import fr.lapetina.mesh.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.mesh.infrastructure.resilience.CircuitBreakerRegistry;
import fr.lapetina.mesh.infrastructure.resilience.RetryPolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Aggregates configuration, statistics and health of the mesh components.
 *
 * <p>The control plane owns the feature switches and the lifecycle of the
 * components it is given, not their state: every component keeps exclusive
 * ownership of its own maps and is only reached through its public calls.
 */
public final class MeshControlPlane implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MeshControlPlane.class);

    private final ServiceRegistry registry;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RetryPolicyEngine retryEngine;
    private final TrafficRouter trafficRouter;
    private final ServiceAuthority serviceAuthority;
    private final InstanceHealthChecker healthChecker;

    private final AtomicReference<MeshSettings> settings;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private final AtomicLong totalServiceCalls = new AtomicLong();
    private final AtomicLong successfulCalls = new AtomicLong();
    private final AtomicLong failedCalls = new AtomicLong();
    private final AtomicLong routedCalls = new AtomicLong();
    private final AtomicLong authenticatedCalls = new AtomicLong();
    private final AtomicLong totalCallTimeMs = new AtomicLong();

    public MeshControlPlane(
            MeshSettings settings,
            ServiceRegistry registry,
            CircuitBreakerRegistry circuitBreakers,
            RetryPolicyEngine retryEngine,
            TrafficRouter trafficRouter,
            ServiceAuthority serviceAuthority,
            InstanceHealthChecker healthChecker
    ) {
        this.settings = new AtomicReference<>(settings);
        this.registry = registry;
        this.circuitBreakers = circuitBreakers;
        this.retryEngine = retryEngine;
        this.trafficRouter = trafficRouter;
        this.serviceAuthority = serviceAuthority;
        this.healthChecker = healthChecker;
    }

    /**
     * Starts the background tasks the current settings ask for.
     */
    public void start() {
        if (started.compareAndSet(false, true)) {
            applyLifecycle(settings.get());
            log.info("Mesh control plane started: settings={}", settings.get());
        }
    }

    public MeshSettings getConfig() {
        return settings.get();
    }

    /**
     * Applies a partial settings update. Takes effect for subsequent calls.
     */
    public MeshSettings updateConfig(MeshSettings.Update update) {
        MeshSettings updated = settings.updateAndGet(current -> current.apply(update));
        if (started.get()) {
            applyLifecycle(updated);
        }
        log.info("Mesh configuration updated: settings={}", updated);
        return updated;
    }

    private void applyLifecycle(MeshSettings current) {
        if (healthChecker == null) {
            return;
        }
        if (current.enabled() && current.healthChecking()) {
            healthChecker.start();
        } else {
            healthChecker.stop();
        }
    }

    /**
     * Records the outcome of one call made through the mesh.
     */
    public void recordCall(boolean success, boolean routed, boolean authenticated, long durationMs) {
        totalServiceCalls.incrementAndGet();
        (success ? successfulCalls : failedCalls).incrementAndGet();
        if (routed) {
            routedCalls.incrementAndGet();
        }
        if (authenticated) {
            authenticatedCalls.incrementAndGet();
        }
        totalCallTimeMs.addAndGet(Math.max(0, durationMs));
    }

    public CallStats getCallStats() {
        long total = totalServiceCalls.get();
        return new CallStats(
                total,
                successfulCalls.get(),
                failedCalls.get(),
                routedCalls.get(),
                authenticatedCalls.get(),
                total == 0 ? 0.0 : (double) totalCallTimeMs.get() / total,
                total == 0 ? 0.0 : successfulCalls.get() * 100.0 / total
        );
    }

    public MeshStats getStats() {
        return new MeshStats(
                getCallStats(),
                registry.getStats(),
                circuitBreakers.getAllStats(),
                retryEngine.getStats(),
                trafficRouter.getStats(),
                serviceAuthority.getStats(),
                Instant.now()
        );
    }

    /**
     * Zeroes every counter. Instances, routes, canaries, certificates and ACLs are kept,
     * and breakers keep their state.
     */
    public void resetAllStats() {
        totalServiceCalls.set(0);
        successfulCalls.set(0);
        failedCalls.set(0);
        routedCalls.set(0);
        authenticatedCalls.set(0);
        totalCallTimeMs.set(0);

        registry.resetStats();
        circuitBreakers.resetAllStats();
        retryEngine.resetStats();
        trafficRouter.resetStats();
        serviceAuthority.resetStats();
        log.info("All mesh statistics reset");
    }

    /**
     * Unhealthy when the registry or the authority is not operative, degraded when
     * a circuit is open or an instance is down, healthy otherwise.
     */
    public MeshHealth getHealth() {
        ServiceRegistry.RegistryStats registryStats = registry.getStats();
        boolean registryOperative = registryStats.totalInstances() == 0 || registryStats.healthyInstances() > 0;
        boolean authOperative = serviceAuthority.isOperative();
        long openCircuits = circuitBreakers.countInState(CircuitBreaker.State.OPEN);

        HealthStatus status;
        if (!registryOperative || !authOperative) {
            status = HealthStatus.UNHEALTHY;
        } else if (openCircuits > 0 || registryStats.unhealthyInstances() > 0) {
            status = HealthStatus.DEGRADED;
        } else {
            status = HealthStatus.HEALTHY;
        }

        return new MeshHealth(
                status,
                settings.get().enabled(),
                registryOperative,
                authOperative,
                registryStats.totalServices(),
                registryStats.totalInstances(),
                registryStats.healthyInstances(),
                openCircuits,
                settings.get(),
                Instant.now()
        );
    }

    public ServiceRegistry getRegistry() {
        return registry;
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

    public InstanceHealthChecker getHealthChecker() {
        return healthChecker;
    }

    @Override
    public void close() {
        log.info("Shutting down mesh control plane");
        if (healthChecker != null) {
            healthChecker.close();
        }
        retryEngine.close();
        serviceAuthority.close();
    }

    public enum HealthStatus {
        HEALTHY,
        DEGRADED,
        UNHEALTHY;

        @JsonValue
        public String toValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public record CallStats(
            long totalServiceCalls,
            long successfulCalls,
            long failedCalls,
            long routedCalls,
            long authenticatedCalls,
            double averageCallTimeMs,
            double successRate
    ) {
    }

    public record MeshStats(
            CallStats controlPlane,
            ServiceRegistry.RegistryStats serviceRegistry,
            List<CircuitBreaker.CircuitBreakerStats> circuitBreakers,
            RetryPolicyEngine.RetryStats retryPolicy,
            TrafficRouter.RouterStats trafficRouter,
            ServiceAuthority.AuthStats serviceAuth,
            Instant timestamp
    ) {
    }

    public record MeshHealth(
            HealthStatus status,
            boolean enabled,
            boolean registryOperative,
            boolean authOperative,
            int totalServices,
            int totalInstances,
            int healthyInstances,
            long openCircuits,
            MeshSettings features,
            Instant timestamp
    ) {
    }
}
