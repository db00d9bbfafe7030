package fr.lapetina.mesh.domain.strategy;

import fr.lapetina.mesh.domain.model.ServiceInstance;

import java.util.List;
import java.util.Optional;

/**
 * Strategy interface for choosing one instance of a service.
 *
 * Implementations must be thread-safe as they are called from the
 * gateway pipeline and from admin threads concurrently.
 */
public interface LoadBalancingStrategy {

    /**
     * Returns the strategy type for configuration and metrics.
     */
    SelectionStrategy getType();

    /**
     * Selects an instance among the candidates.
     *
     * @param serviceName The service the candidates belong to, used to key per-service state
     * @param candidates  Healthy instances only, in registration order
     * @return Selected instance, or empty if there is no candidate
     */
    Optional<ServiceInstance> selectInstance(String serviceName, List<ServiceInstance> candidates);

    /**
     * Drops per-service state, called when a service loses its last instance.
     */
    default void forget(String serviceName) {
        // Default no-op
    }

    /**
     * Resets any internal state.
     */
    default void reset() {
        // Default no-op
    }
}
