package fr.lapetina.mesh.domain.strategy;

import fr.lapetina.mesh.domain.model.ServiceInstance;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Weighted random selection.
 *
 * The probability of picking an instance is its weight divided by the
 * total weight of the candidates, so weights [1, 1, 2] converge to 25/25/50.
 */
public final class WeightedStrategy implements LoadBalancingStrategy {

    @Override
    public SelectionStrategy getType() {
        return SelectionStrategy.WEIGHTED;
    }

    @Override
    public Optional<ServiceInstance> selectInstance(String serviceName, List<ServiceInstance> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        // long: a few large int weights would overflow an int sum
        long totalWeight = 0;
        for (ServiceInstance instance : candidates) {
            totalWeight += instance.getWeight();
        }

        long draw = ThreadLocalRandom.current().nextLong(totalWeight);
        for (ServiceInstance instance : candidates) {
            draw -= instance.getWeight();
            if (draw < 0) {
                return Optional.of(instance);
            }
        }

        // Unreachable while weights are positive
        return Optional.of(candidates.get(candidates.size() - 1));
    }
}
