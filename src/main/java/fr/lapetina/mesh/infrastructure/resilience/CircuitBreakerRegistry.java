package fr.lapetina.mesh.infrastructure.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Named circuit breakers, created lazily on first use.
 * Each name has its own independent state.
 */
public final class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final AtomicReference<CircuitBreakerConfig> defaultConfig;
    private final List<Consumer<CircuitBreaker.StateTransition>> listeners = new CopyOnWriteArrayList<>();

    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig) {
        this.defaultConfig = new AtomicReference<>(Objects.requireNonNull(defaultConfig));
    }

    public CircuitBreakerRegistry() {
        this(CircuitBreakerConfig.defaults());
    }

    public CircuitBreaker getOrCreate(String name) {
        return getOrCreate(name, null);
    }

    /**
     * Returns the breaker for {@code name}, creating it with {@code config}
     * (or the registry default) on first use. The config of an existing breaker is kept.
     */
    public CircuitBreaker getOrCreate(String name, CircuitBreakerConfig config) {
        return breakers.computeIfAbsent(name, key -> {
            CircuitBreakerConfig effective = config != null ? config : defaultConfig.get();
            CircuitBreaker breaker = new CircuitBreaker(key, effective);
            listeners.forEach(breaker::addListener);
            log.info("Circuit breaker created: name={}, failureThreshold={}, successThreshold={}, timeoutMs={}, " +
                            "monitoringPeriodMs={}, halfOpenMaxCalls={}",
                    key, effective.failureThreshold(), effective.successThreshold(),
                    effective.timeout().toMillis(), effective.monitoringPeriod().toMillis(),
                    effective.halfOpenMaxCalls());
            return breaker;
        });
    }

    /**
     * Runs {@code call} through the breaker named {@code name}.
     *
     * @throws fr.lapetina.mesh.domain.exception.CircuitOpenException when the breaker rejects the call
     */
    public <T> T withCircuitBreaker(String name, Callable<T> call, CircuitBreakerConfig config) throws Exception {
        return getOrCreate(name, config).execute(call);
    }

    public <T> T withCircuitBreaker(String name, Callable<T> call) throws Exception {
        return withCircuitBreaker(name, call, null);
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    /**
     * State of a breaker without creating it. Unknown names read as CLOSED.
     */
    public CircuitBreaker.State stateOf(String name) {
        CircuitBreaker breaker = breakers.get(name);
        return breaker == null ? CircuitBreaker.State.CLOSED : breaker.getState();
    }

    public List<CircuitBreaker.CircuitBreakerStats> getAllStats() {
        return breakers.values().stream()
                .map(CircuitBreaker::getStats)
                .sorted(Comparator.comparing(CircuitBreaker.CircuitBreakerStats::name))
                .toList();
    }

    public long countInState(CircuitBreaker.State state) {
        return breakers.values().stream().filter(breaker -> breaker.getState() == state).count();
    }

    public boolean areAllHealthy() {
        return breakers.values().stream().allMatch(breaker -> breaker.getState() == CircuitBreaker.State.CLOSED);
    }

    /**
     * Closes every breaker and zeroes its counters.
     */
    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        log.info("All circuit breakers reset: count={}", breakers.size());
    }

    /**
     * Zeroes counters only; states are kept.
     */
    public void resetAllStats() {
        breakers.values().forEach(CircuitBreaker::resetStats);
    }

    public CircuitBreakerConfig getDefaultConfig() {
        return defaultConfig.get();
    }

    /**
     * Changes the config used for breakers created from now on.
     */
    public void setDefaultConfig(CircuitBreakerConfig config) {
        defaultConfig.set(Objects.requireNonNull(config));
    }

    /**
     * Registers a transition listener on current and future breakers.
     */
    public void addListener(Consumer<CircuitBreaker.StateTransition> listener) {
        listeners.add(listener);
        breakers.values().forEach(breaker -> breaker.addListener(listener));
    }

    public int size() {
        return breakers.size();
    }
}
