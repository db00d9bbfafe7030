package fr.lapetina.mesh.infrastructure.resilience;

import fr.lapetina.mesh.domain.exception.CircuitOpenException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        // Fast circuit breaker for testing: 3 failures, 100ms recovery, 2 successes to close
        circuitBreaker = new CircuitBreaker("booking-service",
                new CircuitBreakerConfig(3, 2, Duration.ofMillis(100), Duration.ofSeconds(10), 1));
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            circuitBreaker.onFailure(circuitBreaker.acquirePermission());
        }
    }

    private void openAndWait() throws InterruptedException {
        fail(3);
        Thread.sleep(150);
    }

    @Test
    @DisplayName("should start in CLOSED state")
    void shouldStartClosed() {
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.acquirePermission().isTrial()).isFalse();
    }

    @Test
    @DisplayName("should open after threshold failures")
    void shouldOpenAfterThresholdFailures() {
        fail(2);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);

        fail(1);

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThatThrownBy(() -> circuitBreaker.acquirePermission())
                .isInstanceOf(CircuitOpenException.class)
                .satisfies(e -> assertThat(((CircuitOpenException) e).getRetryAfterMs()).isBetween(1L, 100L));
    }

    @Test
    @DisplayName("should count only failures inside the monitoring window")
    void shouldForgetOldFailures() throws InterruptedException {
        CircuitBreaker windowed = new CircuitBreaker("windowed",
                new CircuitBreakerConfig(3, 1, Duration.ofSeconds(1), Duration.ofMillis(100), 1));
        windowed.onFailure(windowed.acquirePermission());
        windowed.onFailure(windowed.acquirePermission());

        Thread.sleep(150);
        windowed.onFailure(windowed.acquirePermission());

        assertThat(windowed.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(windowed.getFailureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should not invoke the call while OPEN")
    void shouldNotInvokeCallWhenOpen() {
        fail(3);
        AtomicInteger invocations = new AtomicInteger();

        assertThatThrownBy(() -> circuitBreaker.execute(invocations::incrementAndGet))
                .isInstanceOf(CircuitOpenException.class);
        assertThat(invocations).hasValue(0);
        assertThat(circuitBreaker.getStats().rejectedRequests()).isEqualTo(1);
    }

    @Nested
    @DisplayName("Half-open")
    class HalfOpenTests {

        @Test
        @DisplayName("should transition to HALF_OPEN after the timeout")
        void shouldTransitionToHalfOpen() throws InterruptedException {
            openAndWait();

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        }

        @Test
        @DisplayName("should admit no more trial calls than allowed")
        void shouldCapTrialCalls() throws InterruptedException {
            openAndWait();

            CircuitBreaker.Permit trial = circuitBreaker.acquirePermission();

            assertThat(trial.isTrial()).isTrue();
            assertThatThrownBy(() -> circuitBreaker.acquirePermission())
                    .isInstanceOf(CircuitOpenException.class);
        }

        @Test
        @DisplayName("should close after enough successful trials")
        void shouldCloseAfterSuccesses() throws InterruptedException {
            openAndWait();

            circuitBreaker.onSuccess(circuitBreaker.acquirePermission());
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);

            circuitBreaker.onSuccess(circuitBreaker.acquirePermission());
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
            assertThat(circuitBreaker.getFailureCount()).isZero();
        }

        @Test
        @DisplayName("should reopen on any trial failure")
        void shouldReopenOnFailure() throws InterruptedException {
            openAndWait();

            circuitBreaker.onFailure(circuitBreaker.acquirePermission());

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        }

        @Test
        @DisplayName("should ignore outcomes of calls admitted before the last transition")
        void shouldIgnoreStaleOutcomes() throws InterruptedException {
            CircuitBreaker.Permit stale = circuitBreaker.acquirePermission();
            openAndWait();

            circuitBreaker.onFailure(stale);

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        }
    }

    @Nested
    @DisplayName("Asynchronous execution")
    class AsyncTests {

        @Test
        @DisplayName("should record a failed future as a failure")
        void shouldRecordFailedFuture() {
            for (int i = 0; i < 3; i++) {
                CompletableFuture<String> future = circuitBreaker.executeAsync(
                        () -> CompletableFuture.failedFuture(new IOException("connection refused")));
                assertThatThrownBy(() -> future.get(1, TimeUnit.SECONDS)).isInstanceOf(ExecutionException.class);
            }

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        }

        @Test
        @DisplayName("should fail with CircuitOpenException without invoking the supplier")
        void shouldRejectWhenOpen() {
            fail(3);
            AtomicInteger invocations = new AtomicInteger();

            CompletableFuture<String> future = circuitBreaker.executeAsync(() -> {
                invocations.incrementAndGet();
                return CompletableFuture.completedFuture("ok");
            });

            assertThat(future).isCompletedExceptionally();
            assertThatThrownBy(future::join).hasCauseInstanceOf(CircuitOpenException.class);
            assertThat(invocations).hasValue(0);
        }

        @Test
        @DisplayName("should pass results through")
        void shouldPassResultsThrough() throws Exception {
            String result = circuitBreaker.executeAsync(() -> CompletableFuture.completedFuture("ok"))
                    .get(1, TimeUnit.SECONDS);

            assertThat(result).isEqualTo("ok");
            assertThat(circuitBreaker.getStats().successfulRequests()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("should notify listeners of each transition")
    void shouldNotifyListeners() throws InterruptedException {
        List<String> transitions = new ArrayList<>();
        circuitBreaker.addListener(t -> transitions.add(t.from() + "->" + t.to()));

        openAndWait();
        circuitBreaker.getState();
        circuitBreaker.forceState(CircuitBreaker.State.CLOSED);

        assertThat(transitions).containsExactly("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED");
    }

    @Test
    @DisplayName("should close and zero counters on reset")
    void shouldReset() {
        fail(3);

        circuitBreaker.reset();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getStats().failedRequests()).isZero();
    }

    @Nested
    @DisplayName("CircuitBreakerRegistry")
    class RegistryTests {

        @Test
        @DisplayName("should keep independent state per name")
        void shouldIsolateBreakers() throws Exception {
            CircuitBreakerRegistry registry = new CircuitBreakerRegistry(
                    new CircuitBreakerConfig(1, 1, Duration.ofSeconds(60), Duration.ofSeconds(10), 1));

            assertThatThrownBy(() -> registry.withCircuitBreaker("payment-service", () -> {
                throw new IOException("down");
            })).isInstanceOf(IOException.class);

            assertThat(registry.stateOf("payment-service")).isEqualTo(CircuitBreaker.State.OPEN);
            assertThat(registry.withCircuitBreaker("user-service", () -> "ok")).isEqualTo("ok");
            assertThat(registry.countInState(CircuitBreaker.State.OPEN)).isEqualTo(1);
            assertThat(registry.areAllHealthy()).isFalse();

            registry.resetAll();

            assertThat(registry.areAllHealthy()).isTrue();
        }

        @Test
        @DisplayName("should report CLOSED for unknown names without creating them")
        void shouldNotCreateOnLookup() {
            CircuitBreakerRegistry registry = new CircuitBreakerRegistry();

            assertThat(registry.stateOf("unknown")).isEqualTo(CircuitBreaker.State.CLOSED);
            assertThat(registry.find("unknown")).isEmpty();
            assertThat(registry.size()).isZero();
        }

        @Test
        @DisplayName("should attach listeners to breakers created later")
        void shouldAttachListenersToNewBreakers() {
            CircuitBreakerRegistry registry = new CircuitBreakerRegistry();
            List<CircuitBreaker.StateTransition> transitions = new ArrayList<>();
            registry.addListener(transitions::add);

            registry.getOrCreate("notification-service").forceState(CircuitBreaker.State.OPEN);

            assertThat(transitions).hasSize(1);
            assertThat(transitions.get(0).name()).isEqualTo("notification-service");
        }
    }
}
