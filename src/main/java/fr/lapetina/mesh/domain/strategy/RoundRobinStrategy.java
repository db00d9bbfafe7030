package fr.lapetina.mesh.domain.strategy;

import fr.lapetina.mesh.domain.model.ServiceInstance;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin selection with one cursor per service.
 *
 * Thread-safe via atomic counters.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    private final Map<String, AtomicInteger> cursors = new ConcurrentHashMap<>();

    @Override
    public SelectionStrategy getType() {
        return SelectionStrategy.ROUND_ROBIN;
    }

    @Override
    public Optional<ServiceInstance> selectInstance(String serviceName, List<ServiceInstance> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        AtomicInteger cursor = cursors.computeIfAbsent(serviceName, key -> new AtomicInteger(0));
        int index = Math.floorMod(cursor.getAndIncrement(), candidates.size());
        return Optional.of(candidates.get(index));
    }

    @Override
    public void forget(String serviceName) {
        cursors.remove(serviceName);
    }

    @Override
    public void reset() {
        cursors.clear();
    }
}
