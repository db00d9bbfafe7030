package fr.lapetina.mesh.infrastructure.resilience;

import fr.lapetina.mesh.domain.exception.CircuitOpenException;
import fr.lapetina.mesh.domain.exception.GatewayTimeoutException;
import fr.lapetina.mesh.domain.exception.RetryExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs asynchronous calls with exponential backoff.
 *
 * Every attempt goes through the operation's circuit breaker: if the breaker
 * is OPEN when an attempt is due, the loop stops with
 * {@link CircuitOpenException} instead of spending the remaining attempts.
 * Only failures whose code is in the policy's retryable set are retried;
 * anything else is propagated as is. Running out of attempts raises
 * {@link RetryExhaustedException} wrapping the last failure.
 *
 * Delays are scheduled, never slept, so no thread is held between attempts.
 */
public final class RetryPolicyEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicyEngine.class);

    private final CircuitBreakerRegistry circuitBreakers;
    private final AtomicReference<RetryPolicy> defaultPolicy;
    private final Map<String, RetryPolicy> policies = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final long budgetWindowMs;

    // Guarded by budgetLock
    private final Object budgetLock = new Object();
    private final Deque<Long> callWindow = new ArrayDeque<>();
    private final Deque<Long> retryWindow = new ArrayDeque<>();

    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong totalAttempts = new AtomicLong();
    private final AtomicLong successfulRetries = new AtomicLong();
    private final AtomicLong failedRetries = new AtomicLong();
    private final AtomicLong retriesExhausted = new AtomicLong();
    private final AtomicLong budgetExceeded = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong circuitAborts = new AtomicLong();
    private final Map<String, AtomicLong> retriesByErrorType = new ConcurrentHashMap<>();

    public RetryPolicyEngine(CircuitBreakerRegistry circuitBreakers, RetryPolicy defaultPolicy, long budgetWindowMs) {
        this.circuitBreakers = Objects.requireNonNull(circuitBreakers);
        this.defaultPolicy = new AtomicReference<>(Objects.requireNonNull(defaultPolicy));
        this.budgetWindowMs = budgetWindowMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retry-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public RetryPolicyEngine(CircuitBreakerRegistry circuitBreakers) {
        this(circuitBreakers, RetryPolicy.defaults("default"), 10_000);
    }

    /**
     * Registers or replaces the policy for {@code policy.operation()}.
     */
    public void registerPolicy(RetryPolicy policy) {
        RetryPolicy previous = policies.put(policy.operation(), policy);
        log.info("Retry policy {}: operation={}, maxAttempts={}, backoffBaseMs={}, multiplier={}, maxBackoffMs={}",
                previous == null ? "registered" : "updated",
                policy.operation(), policy.maxAttempts(), policy.backoffBaseMs(),
                policy.backoffMultiplier(), policy.maxBackoffMs());
    }

    public boolean removePolicy(String operation) {
        return policies.remove(operation) != null;
    }

    /**
     * Registered policy for the operation, or the default policy renamed to it.
     */
    public RetryPolicy getPolicy(String operation) {
        RetryPolicy policy = policies.get(operation);
        return policy != null ? policy : defaultPolicy.get().withOperation(operation);
    }

    public List<RetryPolicy> getPolicies() {
        return policies.values().stream()
                .sorted(Comparator.comparing(RetryPolicy::operation))
                .toList();
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy.get();
    }

    public void setDefaultPolicy(RetryPolicy policy) {
        defaultPolicy.set(Objects.requireNonNull(policy));
    }

    public <T> CompletableFuture<T> execute(String operation, AttemptSupplier<T> attempt) {
        return execute(operation, operation, getPolicy(operation), attempt);
    }

    /**
     * Runs {@code attempt} under {@code policy}, guarded by the breaker named {@code circuitName}.
     *
     * @return Future completing with the first successful result, or failing with
     *         {@link CircuitOpenException}, {@link RetryExhaustedException} or a non-retryable failure
     */
    public <T> CompletableFuture<T> execute(
            String operation,
            String circuitName,
            RetryPolicy policy,
            AttemptSupplier<T> attempt
    ) {
        totalCalls.incrementAndGet();
        boolean retriesAllowed = tryEnterBudget(policy);
        int maxAttempts = retriesAllowed ? policy.maxAttempts() : 1;
        if (!retriesAllowed) {
            budgetExceeded.incrementAndGet();
            log.warn("Retry budget exceeded, single attempt only: operation={}, budgetPercent={}",
                    operation, policy.budgetPercent());
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        runAttempt(new Execution<>(operation, circuitName, policy, maxAttempts, attempt, result), 1);
        return result;
    }

    private <T> void runAttempt(Execution<T> execution, int attemptNumber) {
        if (execution.result.isDone()) {
            return;
        }
        totalAttempts.incrementAndGet();
        if (attemptNumber > 1) {
            recordRetry();
        }

        CircuitBreaker breaker = circuitBreakers.getOrCreate(execution.circuitName);
        long timeoutMs = execution.policy.attemptTimeoutMs();
        AttemptContext context = new AttemptContext(execution.operation, attemptNumber, execution.maxAttempts, timeoutMs);

        CompletableFuture<T> outcome = breaker.executeAsync(() -> {
            CompletableFuture<T> future = execution.attempt.attempt(context);
            if (timeoutMs > 0) {
                future.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
            }
            return future;
        });

        outcome.whenComplete((value, throwable) -> {
            if (throwable == null) {
                if (attemptNumber > 1) {
                    successfulRetries.incrementAndGet();
                    log.info("Call succeeded after retry: operation={}, attempt={}/{}",
                            execution.operation, attemptNumber, execution.maxAttempts);
                }
                execution.result.complete(value);
                return;
            }
            handleFailure(execution, attemptNumber, throwable);
        });
    }

    private <T> void handleFailure(Execution<T> execution, int attemptNumber, Throwable throwable) {
        Throwable failure = FailureClassifier.unwrap(throwable);
        if (failure instanceof TimeoutException) {
            failure = new GatewayTimeoutException(execution.operation, execution.policy.attemptTimeoutMs());
        }
        if (failure instanceof GatewayTimeoutException) {
            timeouts.incrementAndGet();
        }
        if (attemptNumber > 1) {
            failedRetries.incrementAndGet();
        }

        if (failure instanceof CircuitOpenException) {
            circuitAborts.incrementAndGet();
            log.warn("Retry loop aborted, circuit open: operation={}, attempt={}/{}",
                    execution.operation, attemptNumber, execution.maxAttempts);
            execution.result.completeExceptionally(failure);
            return;
        }

        String errorCode = FailureClassifier.classify(failure);
        if (!execution.policy.isRetryable(errorCode)) {
            log.debug("Non-retryable failure: operation={}, attempt={}, errorCode={}",
                    execution.operation, attemptNumber, errorCode);
            execution.result.completeExceptionally(failure);
            return;
        }

        if (attemptNumber >= execution.maxAttempts) {
            if (execution.maxAttempts == 1 && execution.policy.maxAttempts() > 1) {
                // Budget denied retries: surface the raw failure
                execution.result.completeExceptionally(failure);
                return;
            }
            retriesExhausted.incrementAndGet();
            log.warn("Retries exhausted: operation={}, attempts={}, lastErrorCode={}",
                    execution.operation, attemptNumber, errorCode);
            execution.result.completeExceptionally(
                    new RetryExhaustedException(execution.operation, attemptNumber, failure));
            return;
        }

        retriesByErrorType.computeIfAbsent(errorCode, key -> new AtomicLong()).incrementAndGet();
        long delayMs = computeDelay(execution.policy, attemptNumber);
        log.info("Retrying call: operation={}, failedAttempt={}/{}, errorCode={}, delayMs={}",
                execution.operation, attemptNumber, execution.maxAttempts, errorCode, delayMs);

        try {
            scheduler.schedule(() -> runAttempt(execution, attemptNumber + 1), delayMs, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            log.error("Could not schedule retry: operation={}", execution.operation, e);
            execution.result.completeExceptionally(new RetryExhaustedException(execution.operation, attemptNumber, failure));
        }
    }

    long computeDelay(RetryPolicy policy, int failedAttempt) {
        long base = policy.baseDelayAfterAttempt(failedAttempt);
        if (!policy.jitter() || base == 0) {
            return base;
        }
        double spread = ThreadLocalRandom.current().nextDouble(-policy.jitterFactor(), policy.jitterFactor());
        return Math.max(0, Math.round(base * (1 + spread)));
    }

    private boolean tryEnterBudget(RetryPolicy policy) {
        long now = System.currentTimeMillis();
        synchronized (budgetLock) {
            prune(callWindow, now);
            prune(retryWindow, now);
            boolean allowed = policy.budgetPercent() <= 0
                    || callWindow.isEmpty()
                    || retryWindow.size() * 100.0 / callWindow.size() < policy.budgetPercent();
            callWindow.addLast(now);
            return allowed;
        }
    }

    private void recordRetry() {
        long now = System.currentTimeMillis();
        synchronized (budgetLock) {
            retryWindow.addLast(now);
            prune(retryWindow, now);
        }
    }

    private void prune(Deque<Long> window, long now) {
        long windowStart = now - budgetWindowMs;
        while (!window.isEmpty() && window.peekFirst() < windowStart) {
            window.pollFirst();
        }
    }

    public RetryStats getStats() {
        long calls = totalCalls.get();
        Map<String, Long> byError = new TreeMap<>();
        retriesByErrorType.forEach((code, count) -> byError.put(code, count.get()));
        return new RetryStats(
                calls,
                totalAttempts.get(),
                successfulRetries.get(),
                failedRetries.get(),
                retriesExhausted.get(),
                budgetExceeded.get(),
                timeouts.get(),
                circuitAborts.get(),
                calls == 0 ? 0.0 : (double) totalAttempts.get() / calls,
                byError,
                policies.size()
        );
    }

    /**
     * Zeroes counters and the budget window; policies are kept.
     */
    public void resetStats() {
        totalCalls.set(0);
        totalAttempts.set(0);
        successfulRetries.set(0);
        failedRetries.set(0);
        retriesExhausted.set(0);
        budgetExceeded.set(0);
        timeouts.set(0);
        circuitAborts.set(0);
        retriesByErrorType.clear();
        synchronized (budgetLock) {
            callWindow.clear();
            retryWindow.clear();
        }
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One attempt of a retried call.
     *
     * The returned future is the attempt's cancellation handle: on timeout the
     * engine completes it exceptionally, so any cleanup (releasing in-flight
     * counts, cancelling I/O) must be attached to that same future.
     */
    @FunctionalInterface
    public interface AttemptSupplier<T> {
        CompletableFuture<T> attempt(AttemptContext context);
    }

    public record AttemptContext(String operation, int attemptNumber, int maxAttempts, long timeoutMs) {
    }

    public record RetryStats(
            long totalCalls,
            long totalAttempts,
            long successfulRetries,
            long failedRetries,
            long retriesExhausted,
            long budgetExceeded,
            long timeouts,
            long circuitAborts,
            double averageAttempts,
            Map<String, Long> retriesByErrorType,
            int registeredPolicies
    ) {
    }

    private static final class Execution<T> {
        private final String operation;
        private final String circuitName;
        private final RetryPolicy policy;
        private final int maxAttempts;
        private final AttemptSupplier<T> attempt;
        private final CompletableFuture<T> result;

        private Execution(String operation, String circuitName, RetryPolicy policy, int maxAttempts,
                          AttemptSupplier<T> attempt, CompletableFuture<T> result) {
            this.operation = operation;
            this.circuitName = circuitName;
            this.policy = policy;
            this.maxAttempts = maxAttempts;
            this.attempt = attempt;
            this.result = result;
        }
    }
}
