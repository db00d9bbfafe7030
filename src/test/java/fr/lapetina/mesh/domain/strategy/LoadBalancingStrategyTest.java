package fr.lapetina.mesh.domain.strategy;

import fr.lapetina.mesh.domain.model.ServiceInstance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class LoadBalancingStrategyTest {

    private List<ServiceInstance> instances;

    @BeforeEach
    void setUp() {
        instances = List.of(
                instance("user-1", 3001, 1),
                instance("user-2", 3002, 1),
                instance("user-3", 3003, 2)
        );
    }

    private static ServiceInstance instance(String id, int port, int weight) {
        return ServiceInstance.builder()
                .id(id)
                .serviceName("user-service")
                .version("1.0.0")
                .host("localhost")
                .port(port)
                .weight(weight)
                .build();
    }

    @Nested
    @DisplayName("RoundRobinStrategy")
    class RoundRobinTests {

        private RoundRobinStrategy strategy;

        @BeforeEach
        void setUp() {
            strategy = new RoundRobinStrategy();
        }

        @Test
        @DisplayName("should cycle through instances in registration order")
        void shouldCycleInOrder() {
            String[] selections = new String[6];
            for (int i = 0; i < selections.length; i++) {
                selections[i] = strategy.selectInstance("user-service", instances)
                        .map(ServiceInstance::getId)
                        .orElse("none");
            }

            assertThat(selections).containsExactly("user-1", "user-2", "user-3", "user-1", "user-2", "user-3");
        }

        @Test
        @DisplayName("should keep one cursor per service")
        void shouldKeepCursorPerService() {
            strategy.selectInstance("user-service", instances);
            strategy.selectInstance("user-service", instances);

            Optional<ServiceInstance> other = strategy.selectInstance("booking-service", instances);

            assertThat(other).map(ServiceInstance::getId).contains("user-1");
        }

        @Test
        @DisplayName("should restart from the first instance after forget")
        void shouldRestartAfterForget() {
            strategy.selectInstance("user-service", instances);
            strategy.forget("user-service");

            assertThat(strategy.selectInstance("user-service", instances))
                    .map(ServiceInstance::getId)
                    .contains("user-1");
        }

        @Test
        @DisplayName("should handle empty candidate list")
        void shouldHandleEmptyList() {
            assertThat(strategy.selectInstance("user-service", List.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("WeightedStrategy")
    class WeightedTests {

        @Test
        @DisplayName("should converge to weight proportions")
        void shouldRespectWeights() {
            WeightedStrategy strategy = new WeightedStrategy();
            ConcurrentHashMap<String, Integer> counts = new ConcurrentHashMap<>();
            int draws = 20_000;
            for (int i = 0; i < draws; i++) {
                strategy.selectInstance("user-service", instances)
                        .ifPresent(instance -> counts.merge(instance.getId(), 1, Integer::sum));
            }

            // weights 1/1/2 -> 25/25/50
            assertThat(counts.get("user-1") / (double) draws).isBetween(0.22, 0.28);
            assertThat(counts.get("user-2") / (double) draws).isBetween(0.22, 0.28);
            assertThat(counts.get("user-3") / (double) draws).isBetween(0.47, 0.53);
        }

        @Test
        @DisplayName("should always pick the only candidate")
        void shouldPickOnlyCandidate() {
            WeightedStrategy strategy = new WeightedStrategy();

            assertThat(strategy.selectInstance("user-service", List.of(instances.get(2))))
                    .map(ServiceInstance::getId)
                    .contains("user-3");
        }

        @Test
        @DisplayName("should select among instances whose weights sum past Integer.MAX_VALUE")
        void shouldHandleLargeWeights() {
            WeightedStrategy strategy = new WeightedStrategy();
            List<ServiceInstance> heavy = List.of(
                    instance("big-1", 4001, Integer.MAX_VALUE),
                    instance("big-2", 4002, 1 << 30)
            );
            Set<String> seen = ConcurrentHashMap.newKeySet();

            for (int i = 0; i < 200; i++) {
                strategy.selectInstance("big", heavy).ifPresent(instance -> seen.add(instance.getId()));
            }

            assertThat(seen).containsExactlyInAnyOrder("big-1", "big-2");
        }
    }

    @Nested
    @DisplayName("LeastConnectionsStrategy")
    class LeastConnectionsTests {

        private LeastConnectionsStrategy strategy;

        @BeforeEach
        void setUp() {
            strategy = new LeastConnectionsStrategy();
        }

        @Test
        @DisplayName("should select the instance with fewest in-flight calls")
        void shouldSelectLeastLoaded() {
            instances.get(0).acquireConnection();
            instances.get(0).acquireConnection();
            instances.get(1).acquireConnection();

            Optional<ServiceInstance> result = strategy.selectInstance("user-service", instances);

            assertThat(result).map(ServiceInstance::getId).contains("user-3");
        }

        @Test
        @DisplayName("should break ties by registration order")
        void shouldBreakTiesByOrder() {
            instances.get(0).acquireConnection();

            Optional<ServiceInstance> result = strategy.selectInstance("user-service", instances);

            assertThat(result).map(ServiceInstance::getId).contains("user-2");
        }
    }

    @Nested
    @DisplayName("RandomStrategy")
    class RandomTests {

        @Test
        @DisplayName("should eventually select every candidate")
        void shouldReachEveryCandidate() {
            RandomStrategy strategy = new RandomStrategy();
            Set<String> seen = ConcurrentHashMap.newKeySet();
            for (int i = 0; i < 500; i++) {
                strategy.selectInstance("user-service", instances).ifPresent(instance -> seen.add(instance.getId()));
            }

            assertThat(seen).containsExactlyInAnyOrder("user-1", "user-2", "user-3");
        }
    }

    @Nested
    @DisplayName("StrategyFactory")
    class FactoryTests {

        @Test
        @DisplayName("should resolve configuration and enum spellings")
        void shouldResolveNames() {
            assertThat(StrategyFactory.create("least-connections"))
                    .map(LoadBalancingStrategy::getType)
                    .contains(SelectionStrategy.LEAST_CONNECTIONS);
            assertThat(StrategyFactory.create("WEIGHTED"))
                    .map(LoadBalancingStrategy::getType)
                    .contains(SelectionStrategy.WEIGHTED);
        }

        @Test
        @DisplayName("should return empty for unknown names")
        void shouldRejectUnknownName() {
            assertThat(StrategyFactory.create("fastest")).isEmpty();
            assertThat(SelectionStrategy.fromName(null)).isEmpty();
        }

        @Test
        @DisplayName("should create one strategy per type")
        void shouldCreateAll() {
            assertThat(StrategyFactory.createAll()).containsOnlyKeys(SelectionStrategy.values());
        }
    }

    @Nested
    @DisplayName("Thread Safety")
    class ThreadSafetyTests {

        @Test
        @DisplayName("RoundRobin should spread selections evenly across threads")
        void roundRobinShouldBeThreadSafe() throws InterruptedException {
            RoundRobinStrategy strategy = new RoundRobinStrategy();
            int threads = 10;
            int iterations = 300;
            CountDownLatch latch = new CountDownLatch(threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads);

            ConcurrentHashMap<String, Integer> counts = new ConcurrentHashMap<>();

            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    try {
                        for (int i = 0; i < iterations; i++) {
                            strategy.selectInstance("user-service", instances)
                                    .ifPresent(instance -> counts.merge(instance.getId(), 1, Integer::sum));
                        }
                    } finally {
                        latch.countDown();
                    }
                });
            }

            latch.await();
            executor.shutdown();

            assertThat(counts).containsEntry("user-1", 1000)
                    .containsEntry("user-2", 1000)
                    .containsEntry("user-3", 1000);
        }
    }
}
