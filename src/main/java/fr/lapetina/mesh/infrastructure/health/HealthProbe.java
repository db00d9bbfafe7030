package fr.lapetina.mesh.infrastructure.health;

import fr.lapetina.mesh.domain.model.ServiceInstance;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous liveness check of one instance.
 * Completes with true when the instance answered as healthy.
 */
@FunctionalInterface
public interface HealthProbe {

    CompletableFuture<Boolean> probe(ServiceInstance instance);
}
