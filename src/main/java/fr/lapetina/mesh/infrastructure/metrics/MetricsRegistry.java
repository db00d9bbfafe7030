package fr.lapetina.mesh.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Gateway request counters and latency per route
 * - Cache hit/miss counters
 * - Circuit breaker transition counters
 * - Auth denial counters
 * - Healthy instance gauges per service
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> authDenialCounters = new ConcurrentHashMap<>();
    private final Set<String> serviceGauges = ConcurrentHashMap.newKeySet();

    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.cacheHits = Counter.builder(prefix + "_gateway_cache_requests_total")
                .description("Gateway cache lookups")
                .tag("result", "hit")
                .register(registry);
        this.cacheMisses = Counter.builder(prefix + "_gateway_cache_requests_total")
                .description("Gateway cache lookups")
                .tag("result", "miss")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the gateway ring buffer")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("mesh");
    }

    /**
     * Counts one gateway request by route and response status.
     */
    public void incrementGatewayRequest(String route, int status) {
        String key = route + ":" + status;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_gateway_requests_total")
                        .description("Total number of gateway requests")
                        .tag("route", route)
                        .tag("status", Integer.toString(status))
                        .register(registry)
        ).increment();
    }

    public void recordRouteLatency(String route, Duration latency) {
        latencyTimers.computeIfAbsent(route, k ->
                Timer.builder(prefix + "_gateway_request_latency")
                        .description("Gateway request latency")
                        .tag("route", route)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void recordCacheLookup(boolean hit) {
        (hit ? cacheHits : cacheMisses).increment();
    }

    public void incrementBreakerTransition(String circuit, String toState) {
        String key = circuit + ":" + toState;
        transitionCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_circuit_transitions_total")
                        .description("Circuit breaker state transitions")
                        .tag("circuit", circuit)
                        .tag("state", toState)
                        .register(registry)
        ).increment();
    }

    public void incrementAuthDenial(String reason) {
        authDenialCounters.computeIfAbsent(reason, k ->
                Counter.builder(prefix + "_auth_denials_total")
                        .description("Service-to-service calls refused by certificate or ACL checks")
                        .tag("reason", reason)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for the healthy instance count of a service, once per service.
     */
    public void registerHealthyInstances(String serviceName, Supplier<Number> healthyCount) {
        if (serviceGauges.add(serviceName)) {
            Gauge.builder(prefix + "_healthy_instances", healthyCount, s -> s.get().doubleValue())
                    .description("Healthy instances per service")
                    .tag("service", serviceName)
                    .register(registry);
        }
    }

    /**
     * Exposes a monotonically increasing count kept by another component.
     */
    public <T> void registerFunctionCounter(String name, String description, T source, ToDoubleFunction<T> count) {
        FunctionCounter.builder(prefix + "_" + name, source, count)
                .description(description)
                .register(registry);
    }

    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
