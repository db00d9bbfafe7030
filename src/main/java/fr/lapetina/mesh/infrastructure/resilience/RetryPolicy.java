package fr.lapetina.mesh.infrastructure.resilience;

import fr.lapetina.mesh.domain.exception.ValidationException;

import java.util.Set;

/**
 * Retry configuration for one operation.
 *
 * @param operation         operation (usually service) name the policy applies to
 * @param maxAttempts       total attempts, including the first
 * @param backoffBaseMs     delay before the second attempt
 * @param backoffMultiplier growth factor of the delay between later attempts
 * @param maxBackoffMs      upper bound of any single delay
 * @param retryableErrors   failure codes that may be retried, see {@link FailureClassifier}
 * @param jitter            whether delays are randomized by {@code jitterFactor}
 * @param jitterFactor      relative spread of the jitter, e.g. 0.1 for +/-10%
 * @param attemptTimeoutMs  deadline of a single attempt, 0 to rely on the caller's own deadline
 * @param budgetPercent     share of calls in the budget window that may retry; 0 or less disables the budget
 */
public record RetryPolicy(
        String operation,
        int maxAttempts,
        long backoffBaseMs,
        double backoffMultiplier,
        long maxBackoffMs,
        Set<String> retryableErrors,
        boolean jitter,
        double jitterFactor,
        long attemptTimeoutMs,
        int budgetPercent
) {

    public static final Set<String> DEFAULT_RETRYABLE_ERRORS = Set.of(
            "ECONNREFUSED", "ETIMEDOUT", "ENOTFOUND", "ENETUNREACH", "EAI_AGAIN",
            "NETWORK_ERROR", "TIMEOUT",
            "500", "502", "503", "504", "429"
    );

    public RetryPolicy {
        ValidationException.requireText(operation, "operation");
        if (maxAttempts < 1) {
            throw new ValidationException("maxAttempts must be at least 1");
        }
        if (backoffBaseMs < 0 || maxBackoffMs < 0 || attemptTimeoutMs < 0) {
            throw new ValidationException("backoff and timeout values must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new ValidationException("backoffMultiplier must be at least 1");
        }
        if (jitterFactor < 0 || jitterFactor >= 1) {
            throw new ValidationException("jitterFactor must be in [0, 1)");
        }
        retryableErrors = retryableErrors == null || retryableErrors.isEmpty()
                ? DEFAULT_RETRYABLE_ERRORS
                : Set.copyOf(retryableErrors);
    }

    public static RetryPolicy defaults(String operation) {
        return new RetryPolicy(operation, 3, 100, 2.0, 5000, DEFAULT_RETRYABLE_ERRORS, true, 0.1, 0, 20);
    }

    public RetryPolicy withOperation(String newOperation) {
        return new RetryPolicy(newOperation, maxAttempts, backoffBaseMs, backoffMultiplier, maxBackoffMs,
                retryableErrors, jitter, jitterFactor, attemptTimeoutMs, budgetPercent);
    }

    public RetryPolicy withAttemptTimeout(long newAttemptTimeoutMs) {
        return new RetryPolicy(operation, maxAttempts, backoffBaseMs, backoffMultiplier, maxBackoffMs,
                retryableErrors, jitter, jitterFactor, newAttemptTimeoutMs, budgetPercent);
    }

    /**
     * Same policy without retries. The budget is switched off so the single attempt is never counted against it.
     */
    public RetryPolicy singleAttempt() {
        return new RetryPolicy(operation, 1, backoffBaseMs, backoffMultiplier, maxBackoffMs,
                retryableErrors, jitter, jitterFactor, attemptTimeoutMs, 0);
    }

    /**
     * Un-jittered delay before attempt {@code k + 1}, given that attempt {@code k} (1-based) failed:
     * {@code min(backoffBaseMs * backoffMultiplier^(k-1), maxBackoffMs)}.
     */
    public long baseDelayAfterAttempt(int k) {
        double delay = backoffBaseMs * Math.pow(backoffMultiplier, Math.max(0, k - 1));
        return (long) Math.min(delay, maxBackoffMs);
    }

    public boolean isRetryable(String errorCode) {
        return retryableErrors.contains(errorCode);
    }
}
