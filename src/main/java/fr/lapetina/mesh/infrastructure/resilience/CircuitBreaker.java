package fr.lapetina.mesh.infrastructure.resilience;

import fr.lapetina.mesh.domain.exception.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Circuit breaker guarding one named operation.
 *
 * States:
 * - CLOSED: calls pass; failures are counted over a sliding window
 * - OPEN: calls are rejected without being invoked until the timeout elapses
 * - HALF_OPEN: at most {@code halfOpenMaxCalls} trial calls run at once;
 *   enough consecutive successes close the circuit, any failure reopens it
 *
 * Transitions and permission decisions happen under one lock, so concurrent
 * outcomes never race into the same transition. Outcomes of calls admitted
 * before the latest transition only update the counters.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final CircuitBreakerConfig config;
    private final Object lock = new Object();
    private final List<Consumer<StateTransition>> listeners = new CopyOnWriteArrayList<>();

    // Guarded by lock
    private final Deque<Long> failureTimestamps = new ArrayDeque<>();
    private volatile State state = State.CLOSED;
    private long epoch;
    private long openedAtMillis;
    private int halfOpenInFlight;
    private int halfOpenSuccesses;
    private volatile Instant stateChangedAt = Instant.now();
    private volatile Instant lastFailureTime;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong rejectedRequests = new AtomicLong();
    private final AtomicLong consecutiveSuccesses = new AtomicLong();
    private final AtomicLong consecutiveFailures = new AtomicLong();

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this.name = name;
        this.config = config;
    }

    public CircuitBreaker(String name) {
        this(name, CircuitBreakerConfig.defaults());
    }

    /**
     * Runs the call through the breaker.
     *
     * @throws CircuitOpenException if the circuit rejects the call; {@code call} is not invoked
     * @throws Exception whatever {@code call} throws, after it has been recorded as a failure
     */
    public <T> T execute(Callable<T> call) throws Exception {
        Permit permit = acquirePermission();
        T result;
        try {
            result = call.call();
        } catch (Exception e) {
            onFailure(permit);
            throw e;
        }
        onSuccess(permit);
        return result;
    }

    /**
     * Asynchronous variant: the outcome of the returned future drives the state machine.
     * A rejection surfaces as a future failed with {@link CircuitOpenException}.
     */
    public <T> CompletableFuture<T> executeAsync(Supplier<CompletableFuture<T>> call) {
        Permit permit;
        try {
            permit = acquirePermission();
        } catch (CircuitOpenException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            onFailure(permit);
            return CompletableFuture.failedFuture(e);
        }

        return future.whenComplete((result, throwable) -> {
            if (throwable != null) {
                onFailure(permit);
            } else {
                onSuccess(permit);
            }
        });
    }

    /**
     * Asks for permission to run one call.
     *
     * @return A permit that must be handed back through {@link #onSuccess} or {@link #onFailure}
     * @throws CircuitOpenException if the circuit is OPEN, or HALF_OPEN with all trial slots taken
     */
    public Permit acquirePermission() {
        synchronized (lock) {
            long now = System.currentTimeMillis();
            advanceIfTimeoutElapsed(now);

            switch (state) {
                case CLOSED:
                    totalRequests.incrementAndGet();
                    return new Permit(epoch, false);

                case HALF_OPEN:
                    if (halfOpenInFlight < config.halfOpenMaxCalls()) {
                        halfOpenInFlight++;
                        totalRequests.incrementAndGet();
                        log.debug("Circuit breaker trial call admitted: name={}, trialsInFlight={}/{}",
                                name, halfOpenInFlight, config.halfOpenMaxCalls());
                        return new Permit(epoch, true);
                    }
                    rejectedRequests.incrementAndGet();
                    log.debug("Circuit breaker trial slots exhausted: name={}", name);
                    throw new CircuitOpenException(name, 0);

                case OPEN:
                default:
                    rejectedRequests.incrementAndGet();
                    long retryAfter = Math.max(0, openedAtMillis + config.timeout().toMillis() - now);
                    throw new CircuitOpenException(name, retryAfter);
            }
        }
    }

    /**
     * Records a successful call.
     */
    public void onSuccess(Permit permit) {
        successfulRequests.incrementAndGet();
        consecutiveSuccesses.incrementAndGet();
        consecutiveFailures.set(0);

        synchronized (lock) {
            if (permit.epoch != epoch) {
                return;
            }
            if (state == State.HALF_OPEN && permit.trial) {
                halfOpenInFlight--;
                halfOpenSuccesses++;
                if (halfOpenSuccesses >= config.successThreshold()) {
                    transitionTo(State.CLOSED, System.currentTimeMillis());
                }
            }
        }
    }

    /**
     * Records a failed call.
     */
    public void onFailure(Permit permit) {
        failedRequests.incrementAndGet();
        consecutiveFailures.incrementAndGet();
        consecutiveSuccesses.set(0);
        lastFailureTime = Instant.now();

        synchronized (lock) {
            if (permit.epoch != epoch) {
                return;
            }
            long now = System.currentTimeMillis();
            if (state == State.HALF_OPEN) {
                transitionTo(State.OPEN, now);
                return;
            }
            if (state == State.CLOSED) {
                failureTimestamps.addLast(now);
                pruneFailures(now);
                if (failureTimestamps.size() >= config.failureThreshold()) {
                    transitionTo(State.OPEN, now);
                }
            }
        }
    }

    /**
     * Forces the circuit to a specific state. For admin use.
     */
    public void forceState(State newState) {
        synchronized (lock) {
            transitionTo(newState, System.currentTimeMillis());
        }
    }

    /**
     * Returns the circuit to CLOSED and zeroes the window and counters.
     */
    public void reset() {
        synchronized (lock) {
            transitionTo(State.CLOSED, System.currentTimeMillis());
        }
        resetStats();
    }

    /**
     * Zeroes the counters; the state is kept.
     */
    public void resetStats() {
        totalRequests.set(0);
        successfulRequests.set(0);
        failedRequests.set(0);
        rejectedRequests.set(0);
        consecutiveSuccesses.set(0);
        consecutiveFailures.set(0);
    }

    /**
     * Current state, applying the OPEN to HALF_OPEN transition if its timeout has elapsed.
     */
    public State getState() {
        if (state == State.OPEN) {
            synchronized (lock) {
                advanceIfTimeoutElapsed(System.currentTimeMillis());
            }
        }
        return state;
    }

    private void advanceIfTimeoutElapsed(long now) {
        if (state == State.OPEN && now - openedAtMillis >= config.timeout().toMillis()) {
            transitionTo(State.HALF_OPEN, now);
        }
    }

    private void pruneFailures(long now) {
        long windowStart = now - config.monitoringPeriod().toMillis();
        while (!failureTimestamps.isEmpty() && failureTimestamps.peekFirst() < windowStart) {
            failureTimestamps.pollFirst();
        }
    }

    // Caller holds lock
    private void transitionTo(State newState, long now) {
        State previous = state;
        epoch++;
        state = newState;
        stateChangedAt = Instant.ofEpochMilli(now);
        halfOpenInFlight = 0;
        halfOpenSuccesses = 0;
        if (newState == State.OPEN) {
            openedAtMillis = now;
        }
        if (newState == State.CLOSED) {
            failureTimestamps.clear();
        }

        if (previous == newState) {
            log.info("Circuit breaker re-entered {}: name={}", newState, name);
        } else if (newState == State.OPEN) {
            log.warn("Circuit breaker OPENED: name={}, from={}, windowFailures={}, retryInMs={}",
                    name, previous, failureTimestamps.size(), config.timeout().toMillis());
        } else {
            log.info("Circuit breaker {} -> {}: name={}", previous, newState, name);
        }

        StateTransition transition = new StateTransition(name, previous, newState, stateChangedAt);
        for (Consumer<StateTransition> listener : listeners) {
            try {
                listener.accept(transition);
            } catch (Exception e) {
                log.error("Error notifying circuit breaker listener: name={}", name, e);
            }
        }
    }

    public void addListener(Consumer<StateTransition> listener) {
        listeners.add(listener);
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    public int getFailureCount() {
        synchronized (lock) {
            pruneFailures(System.currentTimeMillis());
            return failureTimestamps.size();
        }
    }

    public Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public Instant getStateChangedAt() {
        return stateChangedAt;
    }

    public CircuitBreakerStats getStats() {
        int halfOpenCount;
        synchronized (lock) {
            halfOpenCount = halfOpenSuccesses;
        }
        return new CircuitBreakerStats(
                name,
                getState(),
                getFailureCount(),
                halfOpenCount,
                totalRequests.get(),
                successfulRequests.get(),
                failedRequests.get(),
                rejectedRequests.get(),
                consecutiveSuccesses.get(),
                consecutiveFailures.get(),
                lastFailureTime,
                stateChangedAt
        );
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "name='" + name + '\'' +
                ", state=" + state +
                ", failures=" + failureTimestamps.size() +
                '}';
    }

    /**
     * Token for one admitted call.
     */
    public static final class Permit {
        private final long epoch;
        private final boolean trial;

        private Permit(long epoch, boolean trial) {
            this.epoch = epoch;
            this.trial = trial;
        }

        public boolean isTrial() {
            return trial;
        }
    }

    public record StateTransition(String name, State from, State to, Instant at) {
    }

    public record CircuitBreakerStats(
            String name,
            State state,
            int failureCount,
            int successCount,
            long totalRequests,
            long successfulRequests,
            long failedRequests,
            long rejectedRequests,
            long consecutiveSuccesses,
            long consecutiveFailures,
            Instant lastFailureTime,
            Instant stateChangedAt
    ) {
    }
}
