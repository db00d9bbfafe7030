package fr.lapetina.mesh.infrastructure.health;

import fr.lapetina.mesh.domain.model.ServiceInstance;
import fr.lapetina.mesh.infrastructure.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background health checker for registered instances.
 *
 * Runs on its own daemon scheduler and probes asynchronously, so probing
 * never occupies gateway threads. Probe outcomes are handed to the
 * registry, which owns the health transitions.
 */
public final class InstanceHealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InstanceHealthChecker.class);

    private final ServiceRegistry registry;
    private final HealthProbe probe;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final Duration probeTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> task;

    public InstanceHealthChecker(
            ServiceRegistry registry,
            HealthProbe probe,
            Duration checkInterval,
            Duration probeTimeout
    ) {
        this.registry = registry;
        this.probe = probe;
        this.checkInterval = checkInterval;
        this.probeTimeout = probeTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "instance-health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic probing. Calling it again while running is a no-op.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            task = scheduler.scheduleWithFixedDelay(
                    this::checkAllInstances,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health checker started: interval={}, probeTimeout={}, unhealthyThreshold={}",
                    checkInterval, probeTimeout, registry.getUnhealthyThreshold());
        }
    }

    /**
     * Pauses probing without releasing the scheduler, so it can be restarted.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            ScheduledFuture<?> current = task;
            if (current != null) {
                current.cancel(false);
            }
            log.info("Health checker paused");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void checkAllInstances() {
        if (!running.get()) {
            return;
        }

        List<ServiceInstance> instances = registry.getAllInstances();
        log.debug("Starting health check cycle: instanceCount={}", instances.size());
        for (ServiceInstance instance : instances) {
            checkInstance(instance);
        }
    }

    /**
     * Probes one instance and reports the outcome to the registry.
     *
     * @return Future completing with the health flag after the probe
     */
    public CompletableFuture<Boolean> checkInstance(ServiceInstance instance) {
        CompletableFuture<Boolean> probeFuture;
        try {
            probeFuture = probe.probe(instance);
        } catch (Exception e) {
            probeFuture = CompletableFuture.failedFuture(e);
        }

        return probeFuture
                .orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((healthy, ex) -> {
                    boolean success = ex == null && Boolean.TRUE.equals(healthy);
                    if (!success) {
                        log.warn("Health check failed: service={}, instanceId={}, error={}",
                                instance.getServiceName(), instance.getId(),
                                ex != null ? ex.toString() : "unhealthy response");
                    }
                    return registry.recordProbeResult(instance, success);
                });
    }

    /**
     * Probes every instance of a service immediately.
     */
    public CompletableFuture<Void> forceCheck(String serviceName) {
        CompletableFuture<?>[] futures = registry.getInstances(serviceName).stream()
                .map(this::checkInstance)
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(futures);
    }

    @Override
    public void close() {
        running.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Health checker stopped");
    }
}
