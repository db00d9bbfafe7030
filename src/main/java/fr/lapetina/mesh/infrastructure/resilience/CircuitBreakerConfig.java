package fr.lapetina.mesh.infrastructure.resilience;

import java.time.Duration;

/**
 * Thresholds of one circuit breaker.
 *
 * @param failureThreshold   failures within {@code monitoringPeriod} that open the circuit
 * @param successThreshold   consecutive half-open successes that close it again
 * @param timeout            time spent OPEN before trial calls are let through
 * @param monitoringPeriod   sliding window over which failures are counted
 * @param halfOpenMaxCalls   concurrent trial calls allowed while HALF_OPEN
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        int successThreshold,
        Duration timeout,
        Duration monitoringPeriod,
        int halfOpenMaxCalls
) {

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be at least 1");
        }
        if (halfOpenMaxCalls < 1) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be at least 1");
        }
        if (timeout == null || timeout.isNegative() || monitoringPeriod == null || monitoringPeriod.isNegative()) {
            throw new IllegalArgumentException("timeout and monitoringPeriod must be non-negative");
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(5, 2, Duration.ofSeconds(60), Duration.ofSeconds(10), 1);
    }
}
