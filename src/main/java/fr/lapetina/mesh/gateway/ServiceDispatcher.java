package fr.lapetina.mesh.gateway;

import fr.lapetina.mesh.controlplane.MeshControlPlane;
import fr.lapetina.mesh.controlplane.MeshSettings;
import fr.lapetina.mesh.domain.exception.ServiceUnavailableException;
import fr.lapetina.mesh.domain.exception.UpstreamStatusException;
import fr.lapetina.mesh.domain.model.GatewayRequest;
import fr.lapetina.mesh.domain.model.GatewayResponse;
import fr.lapetina.mesh.domain.model.ServiceInstance;
import fr.lapetina.mesh.domain.routing.RoutingContext;
import fr.lapetina.mesh.domain.routing.RoutingDecision;
import fr.lapetina.mesh.domain.strategy.SelectionStrategy;
import fr.lapetina.mesh.infrastructure.http.ServiceHttpClient;
import fr.lapetina.mesh.infrastructure.registry.ServiceRegistry;
import fr.lapetina.mesh.infrastructure.resilience.RetryPolicy;
import fr.lapetina.mesh.infrastructure.resilience.RetryPolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Carries one call to a backend service through the mesh.
 *
 * <p>The target version is chosen once per call by the traffic router so
 * the caller keeps its affinity across retries. Each attempt then selects
 * a healthy instance of that version, passes the service's circuit breaker
 * and is bounded by its own deadline. The instance's in-flight count is
 * released when the attempt future completes, whichever way it completes.
 */
public final class ServiceDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ServiceDispatcher.class);

    private final MeshControlPlane controlPlane;
    private final ServiceHttpClient httpClient;
    private final long defaultTimeoutMs;

    public ServiceDispatcher(MeshControlPlane controlPlane, ServiceHttpClient httpClient, long defaultTimeoutMs) {
        this.controlPlane = controlPlane;
        this.httpClient = httpClient;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    /**
     * Calls {@code serviceName} at {@code targetPath}.
     *
     * @param strategy      instance selection, null for the registry default
     * @param timeoutMs     per-attempt deadline, 0 for the default
     * @param authenticated whether the caller's certificate was verified, for call stats
     * @return Future with the backend response (2xx to 4xx), or failing with a mesh error
     */
    public CompletableFuture<GatewayResponse> dispatch(
            String serviceName,
            String targetPath,
            GatewayRequest request,
            SelectionStrategy strategy,
            long timeoutMs,
            boolean authenticated
    ) {
        MeshSettings settings = controlPlane.getConfig();
        long deadlineMs = timeoutMs > 0 ? timeoutMs : defaultTimeoutMs;
        long startNanos = System.nanoTime();

        RoutingDecision decision = settings.enabled() && settings.trafficRouting()
                ? controlPlane.getTrafficRouter().route(serviceName,
                        new RoutingContext(request.routingKey(), request.headers()))
                : RoutingDecision.unrouted();
        String version = decision.version();

        CompletableFuture<GatewayResponse> result;
        if (!settings.enabled()) {
            result = attempt(serviceName, version, targetPath, request, strategy, deadlineMs)
                    .orTimeout(deadlineMs, TimeUnit.MILLISECONDS);
        } else {
            RetryPolicyEngine engine = controlPlane.getRetryEngine();
            RetryPolicy policy = engine.getPolicy(serviceName).withAttemptTimeout(deadlineMs);
            if (!settings.retryPolicy()) {
                policy = policy.singleAttempt();
            }
            result = engine.execute(serviceName, serviceName, policy,
                    context -> attempt(serviceName, version, targetPath, request, strategy, deadlineMs));
        }

        return result.whenComplete((response, throwable) -> {
            boolean success = throwable == null;
            long durationMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
            if (settings.enabled()) {
                controlPlane.getTrafficRouter().recordOutcome(decision, success);
                controlPlane.recordCall(success, decision.isRouted(), authenticated, durationMs);
            }
            if (success) {
                log.debug("Service call completed: service={}, requestId={}, version={}, instanceId={}, status={}, durationMs={}",
                        serviceName, request.requestId(), response.serviceVersion(), response.instanceId(),
                        response.statusCode(), durationMs);
            }
        });
    }

    private CompletableFuture<GatewayResponse> attempt(
            String serviceName,
            String version,
            String targetPath,
            GatewayRequest request,
            SelectionStrategy strategy,
            long deadlineMs
    ) {
        ServiceRegistry registry = controlPlane.getRegistry();
        ServiceInstance instance = registry.selectInstance(serviceName, strategy, version);
        if (instance == null) {
            return CompletableFuture.failedFuture(new ServiceUnavailableException(serviceName, version));
        }

        instance.acquireConnection();
        CompletableFuture<GatewayResponse> call;
        try {
            call = httpClient.send(instance, request, targetPath, Duration.ofMillis(deadlineMs));
        } catch (RuntimeException e) {
            instance.releaseConnection();
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<GatewayResponse> attempt = call.thenApply(response -> {
            int status = response.statusCode();
            if (status >= 500 || status == 429) {
                throw new UpstreamStatusException(serviceName, status);
            }
            return response;
        });
        // The caller may time this future out; cleanup must hang off this exact instance
        attempt.whenComplete((response, throwable) -> {
            instance.releaseConnection();
            if (throwable != null && !call.isDone()) {
                call.cancel(true);
            }
        });
        return attempt;
    }
}
