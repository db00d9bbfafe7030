package fr.lapetina.mesh.domain.routing;

import fr.lapetina.mesh.domain.exception.ValidationException;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gradual rollout of {@code canaryVersion} next to {@code stableVersion}.
 *
 * While RUNNING, a routing key goes to the canary when its stable hash
 * (salted with the deployment id) falls below {@code trafficPercent}; the
 * split never changes, so a key keeps its version for the deployment's
 * lifetime. PROMOTED sends everything to the canary, ROLLED_BACK everything
 * to the stable version. Both are terminal.
 */
public final class CanaryDeployment {

    private final String id;
    private final String serviceName;
    private final String canaryVersion;
    private final String stableVersion;
    private final int trafficPercent;
    private final Instant createdAt;
    private volatile CanaryStatus status = CanaryStatus.RUNNING;
    private volatile Instant updatedAt;

    private final AtomicLong canaryRequests = new AtomicLong();
    private final AtomicLong stableRequests = new AtomicLong();
    private final AtomicLong canaryErrors = new AtomicLong();
    private final AtomicLong stableErrors = new AtomicLong();

    CanaryDeployment(String serviceName, String canaryVersion, String stableVersion, int trafficPercent) {
        this.id = "canary-" + UUID.randomUUID();
        this.serviceName = ValidationException.requireText(serviceName, "serviceName");
        this.canaryVersion = ValidationException.requireText(canaryVersion, "canaryVersion");
        this.stableVersion = ValidationException.requireText(stableVersion, "stableVersion");
        if (canaryVersion.equals(stableVersion)) {
            throw new ValidationException("canaryVersion and stableVersion must differ");
        }
        if (trafficPercent < 0 || trafficPercent > 100) {
            throw new ValidationException("trafficPercent must be between 0 and 100");
        }
        this.trafficPercent = trafficPercent;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    /**
     * Version for a routing key under the current status.
     * Without a key the split is applied at random.
     */
    public String route(String routingKey) {
        String version = switch (status) {
            case PROMOTED -> canaryVersion;
            case ROLLED_BACK -> stableVersion;
            case RUNNING -> bucketOf(routingKey) < trafficPercent ? canaryVersion : stableVersion;
        };
        if (version.equals(canaryVersion)) {
            canaryRequests.incrementAndGet();
        } else {
            stableRequests.incrementAndGet();
        }
        return version;
    }

    private int bucketOf(String routingKey) {
        if (routingKey == null) {
            return ThreadLocalRandom.current().nextInt(StableHash.BUCKETS);
        }
        return StableHash.bucket(id, routingKey);
    }

    /**
     * @return true if this call moved the deployment to PROMOTED
     */
    synchronized boolean promote() {
        return transition(CanaryStatus.PROMOTED);
    }

    /**
     * @return true if this call moved the deployment to ROLLED_BACK
     */
    synchronized boolean rollback() {
        return transition(CanaryStatus.ROLLED_BACK);
    }

    private boolean transition(CanaryStatus target) {
        if (status.isTerminal()) {
            return false;
        }
        status = target;
        updatedAt = Instant.now();
        return true;
    }

    void recordOutcome(String version, boolean success) {
        if (success) {
            return;
        }
        if (canaryVersion.equals(version)) {
            canaryErrors.incrementAndGet();
        } else if (stableVersion.equals(version)) {
            stableErrors.incrementAndGet();
        }
    }

    void resetMetrics() {
        canaryRequests.set(0);
        stableRequests.set(0);
        canaryErrors.set(0);
        stableErrors.set(0);
    }

    public String getId() {
        return id;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getCanaryVersion() {
        return canaryVersion;
    }

    public String getStableVersion() {
        return stableVersion;
    }

    public int getTrafficPercent() {
        return trafficPercent;
    }

    public CanaryStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public CanaryMetrics getMetrics() {
        return new CanaryMetrics(canaryRequests.get(), stableRequests.get(), canaryErrors.get(), stableErrors.get());
    }

    @Override
    public String toString() {
        return "CanaryDeployment{" +
                "id='" + id + '\'' +
                ", service=" + serviceName +
                ", canary=" + canaryVersion +
                ", stable=" + stableVersion +
                ", percent=" + trafficPercent +
                ", status=" + status +
                '}';
    }

    public record CanaryMetrics(long canaryRequests, long stableRequests, long canaryErrors, long stableErrors) {

        public double canaryErrorRate() {
            return canaryRequests == 0 ? 0.0 : (double) canaryErrors / canaryRequests;
        }

        public double stableErrorRate() {
            return stableRequests == 0 ? 0.0 : (double) stableErrors / stableRequests;
        }
    }
}
