package fr.lapetina.mesh.domain.strategy;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Factory for load balancing strategies.
 */
public final class StrategyFactory {

    private static final Map<SelectionStrategy, Supplier<LoadBalancingStrategy>> REGISTRY =
            new EnumMap<>(SelectionStrategy.class);

    static {
        REGISTRY.put(SelectionStrategy.ROUND_ROBIN, RoundRobinStrategy::new);
        REGISTRY.put(SelectionStrategy.WEIGHTED, WeightedStrategy::new);
        REGISTRY.put(SelectionStrategy.LEAST_CONNECTIONS, LeastConnectionsStrategy::new);
        REGISTRY.put(SelectionStrategy.RANDOM, RandomStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    public static LoadBalancingStrategy create(SelectionStrategy type) {
        return REGISTRY.get(type).get();
    }

    /**
     * Creates a strategy by configuration name.
     *
     * @param name Strategy name, e.g. {@code least-connections} or {@code WEIGHTED}
     * @return Strategy instance, or empty if the name is unknown
     */
    public static Optional<LoadBalancingStrategy> create(String name) {
        return SelectionStrategy.fromName(name).map(StrategyFactory::create);
    }

    /**
     * Creates one instance of every strategy, keyed by type.
     */
    public static Map<SelectionStrategy, LoadBalancingStrategy> createAll() {
        Map<SelectionStrategy, LoadBalancingStrategy> all = new EnumMap<>(SelectionStrategy.class);
        for (SelectionStrategy type : SelectionStrategy.values()) {
            all.put(type, create(type));
        }
        return all;
    }
}
