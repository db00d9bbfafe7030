package fr.lapetina.mesh.infrastructure.registry;

import fr.lapetina.mesh.domain.model.ServiceInstance;
import fr.lapetina.mesh.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.mesh.domain.strategy.SelectionStrategy;
import fr.lapetina.mesh.domain.strategy.StrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Registry of service instances, keyed by service name.
 *
 * Owns all instance health transitions. Selection only ever considers
 * instances whose healthy flag is set; when none is, {@link #selectInstance}
 * returns {@code null} and the caller must treat the service as unavailable.
 *
 * Health is asymmetric: {@code unhealthyThreshold} consecutive failed
 * probes mark an instance unhealthy, a single successful probe marks it
 * healthy again.
 */
public final class ServiceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final Map<String, List<ServiceInstance>> services = new ConcurrentHashMap<>();
    private final Map<SelectionStrategy, LoadBalancingStrategy> strategies = StrategyFactory.createAll();
    private final AtomicReference<SelectionStrategy> defaultStrategy;
    private final int unhealthyThreshold;
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    private final AtomicLong registrations = new AtomicLong();
    private final AtomicLong deregistrations = new AtomicLong();
    private final AtomicLong healthChecks = new AtomicLong();
    private final AtomicLong failedHealthChecks = new AtomicLong();
    private final AtomicLong discoveryRequests = new AtomicLong();

    public ServiceRegistry(SelectionStrategy defaultStrategy, int unhealthyThreshold) {
        if (unhealthyThreshold < 1) {
            throw new IllegalArgumentException("unhealthyThreshold must be at least 1");
        }
        this.defaultStrategy = new AtomicReference<>(Objects.requireNonNull(defaultStrategy));
        this.unhealthyThreshold = unhealthyThreshold;
    }

    public ServiceRegistry() {
        this(SelectionStrategy.ROUND_ROBIN, 3);
    }

    /**
     * Registers an instance, assigning an id when it has none.
     * Re-registering an existing id replaces that instance in place.
     *
     * @return The stored instance, healthy
     */
    public ServiceInstance register(ServiceInstance instance) {
        ServiceInstance stored = instance.getId() == null || instance.getId().isBlank()
                ? instance.toBuilder().id(generateId(instance.getServiceName())).build()
                : instance;
        // A stored instance always starts healthy, even one that was marked down before a deregister
        if (!stored.isHealthy()) {
            stored.setHealthy(true);
        }
        stored.resetProbeFailures();

        boolean[] replaced = new boolean[1];
        services.compute(stored.getServiceName(), (name, existing) -> {
            List<ServiceInstance> instances = existing != null ? existing : new CopyOnWriteArrayList<>();
            for (int i = 0; i < instances.size(); i++) {
                if (instances.get(i).getId().equals(stored.getId())) {
                    instances.set(i, stored);
                    replaced[0] = true;
                    return instances;
                }
            }
            instances.add(stored);
            return instances;
        });

        registrations.incrementAndGet();
        log.info("Instance {}: service={}, instanceId={}, version={}, address={}:{}, weight={}",
                replaced[0] ? "re-registered" : "registered",
                stored.getServiceName(), stored.getId(), stored.getVersion(),
                stored.getHost(), stored.getPort(), stored.getWeight());
        notifyListeners(new RegistryEvent(replaced[0] ? RegistryEvent.Type.UPDATED : RegistryEvent.Type.ADDED, stored));
        return stored;
    }

    /**
     * Removes an instance.
     *
     * @return false if the service or instance is unknown
     */
    public boolean deregister(String serviceName, String instanceId) {
        AtomicReference<ServiceInstance> removed = new AtomicReference<>();
        services.computeIfPresent(serviceName, (name, instances) -> {
            for (ServiceInstance instance : instances) {
                if (instance.getId().equals(instanceId)) {
                    instances.remove(instance);
                    removed.set(instance);
                    break;
                }
            }
            return instances.isEmpty() ? null : instances;
        });

        ServiceInstance instance = removed.get();
        if (instance == null) {
            log.debug("Deregistration ignored, unknown instance: service={}, instanceId={}", serviceName, instanceId);
            return false;
        }

        if (!services.containsKey(serviceName)) {
            strategies.values().forEach(strategy -> strategy.forget(serviceName));
        }
        deregistrations.incrementAndGet();
        log.info("Instance deregistered: service={}, instanceId={}", serviceName, instanceId);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.REMOVED, instance));
        return true;
    }

    public Optional<ServiceInstance> getInstance(String serviceName, String instanceId) {
        return getInstances(serviceName).stream()
                .filter(instance -> instance.getId().equals(instanceId))
                .findFirst();
    }

    /**
     * All instances of a service, healthy or not, in registration order.
     */
    public List<ServiceInstance> getInstances(String serviceName) {
        List<ServiceInstance> instances = services.get(serviceName);
        return instances == null ? List.of() : List.copyOf(instances);
    }

    public List<ServiceInstance> getAllInstances() {
        List<ServiceInstance> all = new ArrayList<>();
        services.values().forEach(all::addAll);
        return all;
    }

    public Set<String> getServiceNames() {
        return new TreeSet<>(services.keySet());
    }

    /**
     * Lists instances of a service matching an optional version and tag set.
     */
    public List<ServiceInstance> discover(String serviceName, String version, Set<String> tags, boolean healthyOnly) {
        discoveryRequests.incrementAndGet();
        return getInstances(serviceName).stream()
                .filter(instance -> !healthyOnly || instance.isHealthy())
                .filter(instance -> version == null || version.equals(instance.getVersion()))
                .filter(instance -> instance.hasTags(tags))
                .toList();
    }

    public ServiceInstance selectInstance(String serviceName, SelectionStrategy strategy) {
        return selectInstance(serviceName, strategy, null);
    }

    /**
     * Selects one healthy instance of the service using the given strategy.
     *
     * @param version Restricts candidates to one version when not null
     * @return The instance, or {@code null} when no healthy candidate exists
     */
    public ServiceInstance selectInstance(String serviceName, SelectionStrategy strategy, String version) {
        List<ServiceInstance> candidates = discover(serviceName, version, null, true);
        if (candidates.isEmpty()) {
            log.debug("No healthy instance: service={}, version={}", serviceName, version);
            return null;
        }

        SelectionStrategy type = strategy != null ? strategy : defaultStrategy.get();
        ServiceInstance selected = strategies.get(type).selectInstance(serviceName, candidates).orElse(null);
        if (selected != null) {
            log.debug("Instance selected: service={}, instanceId={}, strategy={}, candidates={}",
                    serviceName, selected.getId(), type, candidates.size());
        }
        return selected;
    }

    /**
     * Overrides the health flag of an instance.
     *
     * @return false if the instance is unknown
     */
    public boolean setHealth(String serviceName, String instanceId, boolean healthy) {
        Optional<ServiceInstance> instance = getInstance(serviceName, instanceId);
        if (instance.isEmpty()) {
            return false;
        }
        instance.get().resetProbeFailures();
        applyHealth(instance.get(), healthy);
        return true;
    }

    /**
     * Applies the outcome of one health probe.
     *
     * @return The health flag after the probe
     */
    public boolean recordProbeResult(ServiceInstance instance, boolean success) {
        healthChecks.incrementAndGet();
        if (success) {
            instance.resetProbeFailures();
            applyHealth(instance, true);
            return true;
        }

        failedHealthChecks.incrementAndGet();
        int failures = instance.recordProbeFailure();
        if (failures >= unhealthyThreshold) {
            applyHealth(instance, false);
        } else {
            log.debug("Probe failed below threshold: service={}, instanceId={}, consecutiveFailures={}/{}",
                    instance.getServiceName(), instance.getId(), failures, unhealthyThreshold);
        }
        return instance.isHealthy();
    }

    private void applyHealth(ServiceInstance instance, boolean healthy) {
        boolean previous = instance.setHealthy(healthy);
        if (previous != healthy) {
            log.info("Instance health changed: service={}, instanceId={}, healthy={}, consecutiveFailures={}",
                    instance.getServiceName(), instance.getId(), healthy, instance.getConsecutiveProbeFailures());
            notifyListeners(new RegistryEvent(RegistryEvent.Type.HEALTH_CHANGED, instance));
        }
    }

    public SelectionStrategy getDefaultStrategy() {
        return defaultStrategy.get();
    }

    public void setDefaultStrategy(SelectionStrategy strategy) {
        SelectionStrategy old = defaultStrategy.getAndSet(Objects.requireNonNull(strategy));
        if (old != strategy) {
            log.info("Default selection strategy changed: {} -> {}", old, strategy);
        }
    }

    public int getUnhealthyThreshold() {
        return unhealthyThreshold;
    }

    public int size() {
        return services.values().stream().mapToInt(List::size).sum();
    }

    public long countHealthy(String serviceName) {
        return getInstances(serviceName).stream().filter(ServiceInstance::isHealthy).count();
    }

    public RegistryStats getStats() {
        List<ServiceInstance> all = getAllInstances();
        int healthy = (int) all.stream().filter(ServiceInstance::isHealthy).count();
        return new RegistryStats(
                services.size(),
                all.size(),
                healthy,
                all.size() - healthy,
                registrations.get(),
                deregistrations.get(),
                healthChecks.get(),
                failedHealthChecks.get(),
                discoveryRequests.get()
        );
    }

    /**
     * Zeroes the counters; instances are kept.
     */
    public void resetStats() {
        registrations.set(0);
        deregistrations.set(0);
        healthChecks.set(0);
        failedHealthChecks.set(0);
        discoveryRequests.set(0);
        log.info("Registry stats reset");
    }

    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying registry listener", e);
            }
        }
    }

    private static String generateId(String serviceName) {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return serviceName + "-" + System.currentTimeMillis() + "-" + suffix.substring(0, Math.min(9, suffix.length()));
    }

    public record RegistryStats(
            int totalServices,
            int totalInstances,
            int healthyInstances,
            int unhealthyInstances,
            long registrations,
            long deregistrations,
            long healthChecks,
            long failedHealthChecks,
            long discoveryRequests
    ) {
    }

    /**
     * Event for registry changes.
     */
    public record RegistryEvent(Type type, ServiceInstance instance) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED,
            HEALTH_CHANGED
        }
    }
}
