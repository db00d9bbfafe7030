package fr.lapetina.mesh.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.mesh.domain.exception.ValidationException;
import fr.lapetina.mesh.infrastructure.resilience.RetryPolicy;

import java.util.Set;

/**
 * Body of {@code POST /mesh/retry-policies}. Absent fields fall back to the engine's default policy.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RetryPolicyRequest {

    private String operation;
    private Integer maxAttempts;
    private Long baseDelayMs;
    private Double multiplier;
    private Long maxDelayMs;
    private Set<String> retryableErrors;
    private Boolean jitter;
    private Double jitterFactor;
    private Long attemptTimeoutMs;
    private Integer budgetPercent;

    public String getOperation() { return operation; }
    public void setOperation(String operation) { this.operation = operation; }

    public Integer getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(Integer maxAttempts) { this.maxAttempts = maxAttempts; }

    public Long getBaseDelayMs() { return baseDelayMs; }
    public void setBaseDelayMs(Long baseDelayMs) { this.baseDelayMs = baseDelayMs; }

    public Double getMultiplier() { return multiplier; }
    public void setMultiplier(Double multiplier) { this.multiplier = multiplier; }

    public Long getMaxDelayMs() { return maxDelayMs; }
    public void setMaxDelayMs(Long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

    public Set<String> getRetryableErrors() { return retryableErrors; }
    public void setRetryableErrors(Set<String> retryableErrors) { this.retryableErrors = retryableErrors; }

    public Boolean getJitter() { return jitter; }
    public void setJitter(Boolean jitter) { this.jitter = jitter; }

    public Double getJitterFactor() { return jitterFactor; }
    public void setJitterFactor(Double jitterFactor) { this.jitterFactor = jitterFactor; }

    public Long getAttemptTimeoutMs() { return attemptTimeoutMs; }
    public void setAttemptTimeoutMs(Long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }

    public Integer getBudgetPercent() { return budgetPercent; }
    public void setBudgetPercent(Integer budgetPercent) { this.budgetPercent = budgetPercent; }

    public RetryPolicy toPolicy(RetryPolicy defaults) {
        ValidationException.requireText(operation, "operation");
        return new RetryPolicy(
                operation,
                maxAttempts != null ? maxAttempts : defaults.maxAttempts(),
                baseDelayMs != null ? baseDelayMs : defaults.backoffBaseMs(),
                multiplier != null ? multiplier : defaults.backoffMultiplier(),
                maxDelayMs != null ? maxDelayMs : defaults.maxBackoffMs(),
                retryableErrors != null ? retryableErrors : defaults.retryableErrors(),
                jitter != null ? jitter : defaults.jitter(),
                jitterFactor != null ? jitterFactor : defaults.jitterFactor(),
                attemptTimeoutMs != null ? attemptTimeoutMs : defaults.attemptTimeoutMs(),
                budgetPercent != null ? budgetPercent : defaults.budgetPercent()
        );
    }
}
