package fr.lapetina.mesh.domain.strategy;

import fr.lapetina.mesh.domain.model.ServiceInstance;

import java.util.List;
import java.util.Optional;

/**
 * Picks the instance with the fewest in-flight calls.
 * Ties go to the earliest registered instance.
 */
public final class LeastConnectionsStrategy implements LoadBalancingStrategy {

    @Override
    public SelectionStrategy getType() {
        return SelectionStrategy.LEAST_CONNECTIONS;
    }

    @Override
    public Optional<ServiceInstance> selectInstance(String serviceName, List<ServiceInstance> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        ServiceInstance best = null;
        int bestInFlight = Integer.MAX_VALUE;
        for (ServiceInstance instance : candidates) {
            int inFlight = instance.getInFlightRequests();
            if (inFlight < bestInFlight) {
                best = instance;
                bestInFlight = inFlight;
            }
        }
        return Optional.ofNullable(best);
    }
}
