package fr.lapetina.mesh.integration;

import fr.lapetina.mesh.MeshFactory;
import fr.lapetina.mesh.domain.model.GatewayRequest;
import fr.lapetina.mesh.domain.model.GatewayResponse;
import fr.lapetina.mesh.domain.model.ServiceInstance;
import fr.lapetina.mesh.infrastructure.http.ServiceHttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Test extension of MeshFactory that replaces every backend with a stub.
 */
public final class TestMeshFactory extends MeshFactory {

    private final StubServiceHttpClient stubHttpClient;

    private TestMeshFactory(String configPath) {
        super(configPath, new StubServiceHttpClient());
        this.stubHttpClient = (StubServiceHttpClient) getHttpClient();
    }

    /**
     * Creates and starts a test factory from the default test configuration.
     */
    public static TestMeshFactory create() {
        return create("test-config.yaml");
    }

    public static TestMeshFactory create(String configPath) {
        TestMeshFactory factory = new TestMeshFactory(configPath);
        factory.start();
        return factory;
    }

    /**
     * Answers every backend call with the generated response.
     */
    public void setBackend(Function<BackendCall, GatewayResponse> responder) {
        stubHttpClient.setHandler(call -> CompletableFuture.completedFuture(responder.apply(call)));
    }

    /**
     * Full control over the backend future, e.g. to fail or never complete it.
     */
    public void setBackendAsync(Function<BackendCall, CompletableFuture<GatewayResponse>> handler) {
        stubHttpClient.setHandler(handler);
    }

    /**
     * Answers every backend call with the same status and JSON body.
     */
    public void setBackendResponse(int status, String body) {
        setBackend(call -> json(call, status, body));
    }

    /**
     * Fails every backend call as the transport would.
     */
    public void setBackendFailure(Throwable failure) {
        stubHttpClient.setHandler(call -> CompletableFuture.failedFuture(failure));
    }

    public List<BackendCall> getBackendCalls() {
        return stubHttpClient.calls;
    }

    public void clearBackendCalls() {
        stubHttpClient.calls.clear();
    }

    public static GatewayResponse json(BackendCall call, int status, String body) {
        return GatewayResponse.of(call.request().requestId(), status,
                Map.of("content-type", "application/json"), body);
    }

    /**
     * One call received by the stub backend.
     */
    public record BackendCall(ServiceInstance instance, GatewayRequest request, String targetPath) {
    }

    /**
     * Stub HTTP client: records calls instead of sending them, and answers every probe as healthy.
     */
    static class StubServiceHttpClient extends ServiceHttpClient {
        private final List<BackendCall> calls = new CopyOnWriteArrayList<>();
        private volatile Function<BackendCall, CompletableFuture<GatewayResponse>> handler;

        StubServiceHttpClient() {
            super(Duration.ofSeconds(1), Duration.ofSeconds(1));
        }

        void setHandler(Function<BackendCall, CompletableFuture<GatewayResponse>> handler) {
            this.handler = handler;
        }

        @Override
        public CompletableFuture<GatewayResponse> send(
                ServiceInstance instance,
                GatewayRequest request,
                String targetPath,
                Duration timeout
        ) {
            BackendCall call = new BackendCall(instance, request, targetPath);
            calls.add(call);

            Function<BackendCall, CompletableFuture<GatewayResponse>> current = handler;
            if (current == null) {
                return CompletableFuture.completedFuture(json(call, 200, "{\"ok\":true}")
                        .servedBy(instance, Duration.ZERO));
            }

            try {
                return current.apply(call)
                        .thenApply(response -> response.servedBy(instance, Duration.ZERO));
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        @Override
        public CompletableFuture<Boolean> probe(ServiceInstance instance) {
            return CompletableFuture.completedFuture(true);
        }
    }
}
