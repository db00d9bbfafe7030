package fr.lapetina.mesh.domain.strategy;

import fr.lapetina.mesh.domain.model.ServiceInstance;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

public final class RandomStrategy implements LoadBalancingStrategy {

    @Override
    public SelectionStrategy getType() {
        return SelectionStrategy.RANDOM;
    }

    @Override
    public Optional<ServiceInstance> selectInstance(String serviceName, List<ServiceInstance> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.get(ThreadLocalRandom.current().nextInt(candidates.size())));
    }
}
