package fr.lapetina.mesh.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.mesh.controlplane.MeshControlPlane;
import fr.lapetina.mesh.controlplane.MeshSettings;
import fr.lapetina.mesh.domain.model.ErrorType;
import fr.lapetina.mesh.domain.model.GatewayRequest;
import fr.lapetina.mesh.domain.model.GatewayResponse;
import fr.lapetina.mesh.gateway.ApiGateway;
import fr.lapetina.mesh.gateway.GatewayRoute;
import fr.lapetina.mesh.infrastructure.auth.ServiceCertificate;
import fr.lapetina.mesh.infrastructure.resilience.CircuitBreaker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of the gateway pipeline against stubbed backends.
 * Configuration is externalized to test-config.yaml.
 */
class MeshGatewayIntegrationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private TestMeshFactory factory;

    @BeforeEach
    void setUp() {
        factory = TestMeshFactory.create();
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private GatewayResponse send(GatewayRequest request) throws Exception {
        return factory.getPipeline().submit(request).get(5, TimeUnit.SECONDS);
    }

    private GatewayResponse get(String path) throws Exception {
        return send(GatewayRequest.builder().method("GET").path(path).build());
    }

    private GatewayResponse get(String path, Map<String, String> headers) throws Exception {
        return send(GatewayRequest.builder().method("GET").path(path).headers(headers).build());
    }

    private GatewayResponse postBooking(String certificate) throws Exception {
        GatewayRequest.Builder builder = GatewayRequest.builder()
                .method("POST")
                .path("/api/bookings")
                .body("{\"room\":\"12\"}");
        if (certificate != null) {
            builder.headers(Map.of(GatewayRequest.CERTIFICATE_HEADER, certificate));
        }
        return send(builder.build());
    }

    @Nested
    @DisplayName("Routing")
    class RoutingTests {

        @Test
        @DisplayName("should forward a wildcard route to its target path")
        void shouldForwardWildcardRoute() throws Exception {
            factory.setBackendResponse(200, "{\"id\":42}");

            GatewayResponse response = get("/api/users/42");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEqualTo("{\"id\":42}");
            assertThat(response.instanceId()).isIn("user-1", "user-2");
            assertThat(factory.getBackendCalls()).hasSize(1);
            assertThat(factory.getBackendCalls().get(0).targetPath()).isEqualTo("/users/42");
            assertThat(factory.getBackendCalls().get(0).instance().getServiceName()).isEqualTo("user-service");
        }

        @Test
        @DisplayName("should spread calls across instances round-robin")
        void shouldBalanceAcrossInstances() throws Exception {
            for (int i = 1; i <= 4; i++) {
                assertThat(get("/api/users/" + i).statusCode()).isEqualTo(200);
            }

            Map<String, Long> perInstance = factory.getBackendCalls().stream()
                    .collect(Collectors.groupingBy(call -> call.instance().getId(), Collectors.counting()));
            assertThat(perInstance).containsEntry("user-1", 2L).containsEntry("user-2", 2L);
        }

        @Test
        @DisplayName("should answer 404 for an unknown route")
        void shouldRejectUnknownRoute() throws Exception {
            GatewayResponse response = get("/api/unknown");

            assertThat(response.statusCode()).isEqualTo(404);
            assertThat(response.errorType()).isEqualTo(ErrorType.NOT_FOUND);
            assertThat(factory.getBackendCalls()).isEmpty();
        }

        @Test
        @DisplayName("should answer 503 when no instance is healthy")
        void shouldFailWithoutHealthyInstance() throws Exception {
            factory.getServiceRegistry().setHealth("user-service", "user-1", false);
            factory.getServiceRegistry().setHealth("user-service", "user-2", false);

            GatewayResponse response = get("/api/users/1");

            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(response.errorType()).isEqualTo(ErrorType.SERVICE_UNAVAILABLE);
            assertThat(factory.getBackendCalls()).isEmpty();
        }

        @Test
        @DisplayName("should send all traffic of a full canary to the canary version")
        void shouldRouteToCanaryVersion() throws Exception {
            factory.getTrafficRouter().createCanary("booking-service", "2.0.0", "1.0.0", 100);

            for (int i = 0; i < 4; i++) {
                assertThat(get("/api/dashboard").statusCode()).isEqualTo(200);
            }

            List<String> bookingInstances = factory.getBackendCalls().stream()
                    .filter(call -> call.instance().getServiceName().equals("booking-service"))
                    .map(call -> call.instance().getId())
                    .toList();
            assertThat(bookingInstances).hasSize(4).containsOnly("booking-2");
            assertThat(factory.getTrafficRouter().getCanaries().get(0).getMetrics().canaryRequests()).isEqualTo(4);
        }

        @Test
        @DisplayName("should keep the pinned version across retries")
        void shouldKeepVersionAcrossRetries() throws Exception {
            factory.getTrafficRouter().createCanary("booking-service", "2.0.0", "1.0.0", 100);
            AtomicInteger calls = new AtomicInteger();
            factory.setBackend(call -> calls.incrementAndGet() <= 2
                    ? TestMeshFactory.json(call, 503, "{}")
                    : TestMeshFactory.json(call, 201, "{\"booked\":true}"));
            ServiceCertificate caller = factory.getServiceAuthority().issueCertificate("gateway-1", "api-gateway");

            GatewayResponse response = postBooking(caller.credential());

            assertThat(response.statusCode()).isEqualTo(201);
            assertThat(factory.getBackendCalls()).hasSize(3)
                    .allSatisfy(call -> assertThat(call.instance().getVersion()).isEqualTo("2.0.0"));
        }
    }

    @Nested
    @DisplayName("Caching")
    class CachingTests {

        @Test
        @DisplayName("should serve a repeated GET from the cache")
        void shouldServeFromCache() throws Exception {
            factory.setBackendResponse(200, "{\"id\":1}");

            GatewayResponse first = get("/api/users/1");
            GatewayResponse second = get("/api/users/1");

            assertThat(first.cacheHit()).isFalse();
            assertThat(second.cacheHit()).isTrue();
            assertThat(second.body()).isEqualTo("{\"id\":1}");
            assertThat(factory.getBackendCalls()).hasSize(1);
            assertThat(factory.getGateway().getStats().cachedResponses()).isEqualTo(1);
        }

        @Test
        @DisplayName("should cache each path and caller separately")
        void shouldPartitionCache() throws Exception {
            get("/api/users/1");
            get("/api/users/2");
            get("/api/users/1", Map.of(ApiGateway.CALLER_HEADER, "mobile-app"));
            get("/api/users/1", Map.of(ApiGateway.CALLER_HEADER, "mobile-app"));

            assertThat(factory.getBackendCalls()).hasSize(3);
        }

        @Test
        @DisplayName("should not cache error responses")
        void shouldNotCacheErrors() throws Exception {
            factory.setBackendResponse(404, "{\"error\":\"no such user\"}");

            assertThat(get("/api/users/9").statusCode()).isEqualTo(404);
            assertThat(get("/api/users/9").statusCode()).isEqualTo(404);

            assertThat(factory.getBackendCalls()).hasSize(2);
        }

        @Test
        @DisplayName("should drop cached responses when the cache is cleared")
        void shouldClearCache() throws Exception {
            get("/api/users/1");
            factory.getGateway().clearCache();
            get("/api/users/1");

            assertThat(factory.getBackendCalls()).hasSize(2);
        }
    }

    @Nested
    @DisplayName("Aggregation and transformation")
    class CompositionTests {

        @Test
        @DisplayName("should merge the answers of every target")
        void shouldAggregateTargets() throws Exception {
            factory.setBackend(call -> call.instance().getServiceName().equals("user-service")
                    ? TestMeshFactory.json(call, 200, "{\"name\":\"Ada\"}")
                    : TestMeshFactory.json(call, 200, "[{\"id\":\"b-1\"}]"));

            GatewayResponse response = get("/api/dashboard");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = objectMapper.readTree(response.body());
            assertThat(body.path("aggregated").asBoolean()).isTrue();
            assertThat(body.path("strategy").asText()).isEqualTo("parallel");
            assertThat(body.path("timestamp").asText()).isNotEmpty();
            assertThat(body.path("user").path("name").asText()).isEqualTo("Ada");
            assertThat(body.path("bookings").get(0).path("id").asText()).isEqualTo("b-1");
            assertThat(factory.getBackendCalls()).extracting(TestMeshFactory.BackendCall::targetPath)
                    .containsExactlyInAnyOrder("/users/me", "/bookings/recent");
        }

        @Test
        @DisplayName("should report a failed target in place of its answer")
        void shouldReportFailedTarget() throws Exception {
            factory.setBackend(call -> call.instance().getServiceName().equals("user-service")
                    ? TestMeshFactory.json(call, 200, "{\"name\":\"Ada\"}")
                    : TestMeshFactory.json(call, 404, "{}"));

            GatewayResponse response = get("/api/dashboard");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = objectMapper.readTree(response.body());
            assertThat(body.path("user").path("name").asText()).isEqualTo("Ada");
            assertThat(body.path("bookings").path("error").asText())
                    .isEqualTo("Service 'booking-service' responded with status 404");
        }

        @Test
        @DisplayName("should reshape the backend answer")
        void shouldTransformResponse() throws Exception {
            factory.setBackendResponse(200,
                    "{\"data\":{\"name\":\"Ada\",\"password\":\"hunter2\",\"id\":7},\"status\":\"ok\"}");

            GatewayResponse response = get("/api/profile");

            JsonNode body = objectMapper.readTree(response.body());
            assertThat(body.path("profile").path("fullName").asText()).isEqualTo("Ada");
            assertThat(body.path("profile").path("id").asInt()).isEqualTo(7);
            assertThat(body.path("profile").has("password")).isFalse();
            assertThat(body.has("status")).isFalse();
            assertThat(factory.getGateway().getStats().transformedResponses()).isEqualTo(1);
        }

        @Test
        @DisplayName("should not reshape error answers")
        void shouldNotTransformErrors() throws Exception {
            factory.setBackendResponse(404, "{\"data\":{\"name\":\"Ada\"}}");

            GatewayResponse response = get("/api/profile");

            assertThat(response.statusCode()).isEqualTo(404);
            assertThat(response.body()).isEqualTo("{\"data\":{\"name\":\"Ada\"}}");
        }
    }

    @Nested
    @DisplayName("Service authentication")
    class AuthTests {

        @Test
        @DisplayName("should answer 401 without a certificate")
        void shouldRequireCertificate() throws Exception {
            GatewayResponse response = postBooking(null);

            assertThat(response.statusCode()).isEqualTo(401);
            assertThat(response.errorType()).isEqualTo(ErrorType.UNAUTHORIZED);
            assertThat(factory.getBackendCalls()).isEmpty();
        }

        @Test
        @DisplayName("should answer 401 for a forged certificate")
        void shouldRejectForgedCertificate() throws Exception {
            GatewayResponse response = postBooking("not-a-certificate");

            assertThat(response.statusCode()).isEqualTo(401);
            assertThat(factory.getBackendCalls()).isEmpty();
        }

        @Test
        @DisplayName("should answer 403 when the ACL denies the caller")
        void shouldDenyByAcl() throws Exception {
            ServiceCertificate caller = factory.getServiceAuthority().issueCertificate("frontend-1", "frontend");

            GatewayResponse response = postBooking(caller.credential());

            assertThat(response.statusCode()).isEqualTo(403);
            assertThat(response.errorType()).isEqualTo(ErrorType.FORBIDDEN);
            assertThat(factory.getBackendCalls()).isEmpty();
        }

        @Test
        @DisplayName("should forward the call of an allowed caller")
        void shouldAllowCaller() throws Exception {
            factory.setBackendResponse(201, "{\"booked\":true}");
            ServiceCertificate caller = factory.getServiceAuthority().issueCertificate("gateway-1", "api-gateway");

            GatewayResponse response = postBooking(caller.credential());

            assertThat(response.statusCode()).isEqualTo(201);
            assertThat(factory.getBackendCalls()).hasSize(1);
            assertThat(factory.getBackendCalls().get(0).request().body()).isEqualTo("{\"room\":\"12\"}");
            assertThat(factory.getControlPlane().getCallStats().authenticatedCalls()).isEqualTo(1);
        }

        private void registerSecuredCachedRoute() {
            factory.getGateway().registerRoute(GatewayRoute.builder()
                    .path("/api/bookings/mine")
                    .method("GET")
                    .serviceName("booking-service")
                    .cacheTtlSeconds(60)
                    .requiresAuth(true)
                    .build());
        }

        @Test
        @DisplayName("should not serve a cached response to a caller without a certificate")
        void shouldNotServeCachedResponseWithoutCertificate() throws Exception {
            registerSecuredCachedRoute();
            factory.setBackendResponse(200, "{\"secret\":42}");
            ServiceCertificate caller = factory.getServiceAuthority().issueCertificate("gateway-1", "api-gateway");

            GatewayResponse allowed = get("/api/bookings/mine", Map.of(
                    GatewayRequest.CERTIFICATE_HEADER, caller.credential(),
                    ApiGateway.CALLER_HEADER, "alice"));
            GatewayResponse impostor = get("/api/bookings/mine", Map.of(ApiGateway.CALLER_HEADER, "alice"));
            GatewayResponse spoofed = get("/api/bookings/mine", Map.of(
                    ApiGateway.CALLER_HEADER, "service:gateway-1"));

            assertThat(allowed.statusCode()).isEqualTo(200);
            assertThat(impostor.statusCode()).isEqualTo(401);
            assertThat(impostor.cacheHit()).isFalse();
            assertThat(impostor.body()).doesNotContain("secret");
            assertThat(spoofed.statusCode()).isEqualTo(401);
            assertThat(factory.getBackendCalls()).hasSize(1);
        }

        @Test
        @DisplayName("should serve the cache again to the same verified caller")
        void shouldServeCacheToVerifiedCaller() throws Exception {
            registerSecuredCachedRoute();
            ServiceCertificate caller = factory.getServiceAuthority().issueCertificate("gateway-1", "api-gateway");
            Map<String, String> headers = Map.of(GatewayRequest.CERTIFICATE_HEADER, caller.credential());

            get("/api/bookings/mine", headers);
            GatewayResponse second = get("/api/bookings/mine", headers);

            assertThat(second.statusCode()).isEqualTo(200);
            assertThat(second.cacheHit()).isTrue();
            assertThat(factory.getBackendCalls()).hasSize(1);
        }

        @Test
        @DisplayName("should refuse a cached route as soon as the ACL is removed")
        void shouldApplyAclRemovalToCachedRoute() throws Exception {
            registerSecuredCachedRoute();
            ServiceCertificate caller = factory.getServiceAuthority().issueCertificate("gateway-1", "api-gateway");
            Map<String, String> headers = Map.of(GatewayRequest.CERTIFICATE_HEADER, caller.credential());

            assertThat(get("/api/bookings/mine", headers).statusCode()).isEqualTo(200);
            factory.getServiceAuthority().removeAcl("api-gateway", "booking-service");
            GatewayResponse afterRemoval = get("/api/bookings/mine", headers);

            assertThat(afterRemoval.statusCode()).isEqualTo(403);
            assertThat(afterRemoval.cacheHit()).isFalse();
        }
    }

    @Nested
    @DisplayName("Resilience")
    class ResilienceTests {

        @Test
        @DisplayName("should retry a failing backend until it succeeds")
        void shouldRetryUntilSuccess() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            factory.setBackend(call -> calls.incrementAndGet() <= 2
                    ? TestMeshFactory.json(call, 503, "{}")
                    : TestMeshFactory.json(call, 200, "{\"id\":1}"));

            GatewayResponse response = get("/api/users/1");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(factory.getBackendCalls()).hasSize(3);
            assertThat(factory.getRetryEngine().getStats().successfulRetries()).isEqualTo(1);
        }

        @Test
        @DisplayName("should answer 502 once every attempt failed")
        void shouldExhaustRetries() throws Exception {
            factory.setBackendResponse(503, "{}");

            GatewayResponse response = get("/api/users/1");

            assertThat(response.statusCode()).isEqualTo(502);
            assertThat(response.errorType()).isEqualTo(ErrorType.RETRY_EXHAUSTED);
            assertThat(factory.getBackendCalls()).hasSize(3);
        }

        @Test
        @DisplayName("should answer 504 when every attempt timed out")
        void shouldTimeOut() throws Exception {
            factory.setBackendAsync(call -> new CompletableFuture<>());

            GatewayResponse response = get("/api/payments");

            assertThat(response.statusCode()).isEqualTo(504);
            assertThat(factory.getBackendCalls()).hasSize(2);
            assertThat(factory.getRetryEngine().getStats().timeouts()).isEqualTo(2);
        }

        @Test
        @DisplayName("should fail fast with Retry-After while the circuit is open")
        void shouldFailFastOnOpenCircuit() throws Exception {
            factory.getCircuitBreakers().getOrCreate("user-service").forceState(CircuitBreaker.State.OPEN);

            GatewayResponse response = get("/api/users/1");

            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(response.errorType()).isEqualTo(ErrorType.CIRCUIT_OPEN);
            assertThat(response.headers()).containsKey("retry-after");
            assertThat(factory.getBackendCalls()).isEmpty();
        }

        @Test
        @DisplayName("should open the circuit after repeated failures")
        void shouldOpenCircuitAfterFailures() throws Exception {
            factory.setBackendResponse(500, "{}");

            get("/api/users/1");
            get("/api/users/2");
            factory.clearBackendCalls();
            GatewayResponse response = get("/api/users/3");

            assertThat(factory.getCircuitBreakers().stateOf("user-service")).isEqualTo(CircuitBreaker.State.OPEN);
            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(factory.getBackendCalls()).isEmpty();
            assertThat(factory.getControlPlane().getHealth().status())
                    .isEqualTo(MeshControlPlane.HealthStatus.DEGRADED);
        }

        @Test
        @DisplayName("should map a transport failure to a generic 502")
        void shouldHideTransportFailure() throws Exception {
            factory.setBackendFailure(new IllegalStateException("socket closed by 10.0.0.7"));

            GatewayResponse response = get("/api/users/1");

            assertThat(response.statusCode()).isEqualTo(502);
            assertThat(response.body()).doesNotContain("10.0.0.7");
        }
    }

    @Nested
    @DisplayName("Feature switches")
    class FeatureSwitchTests {

        private void update(Function<MeshSettings, MeshSettings.Update> change) {
            MeshControlPlane controlPlane = factory.getControlPlane();
            controlPlane.updateConfig(change.apply(controlPlane.getConfig()));
        }

        @Test
        @DisplayName("should make a single attempt when retries are off")
        void shouldSkipRetries() throws Exception {
            update(s -> new MeshSettings.Update(null, null, false, null, null, null, null));
            factory.setBackendResponse(503, "{}");

            GatewayResponse response = get("/api/users/1");

            assertThat(response.statusCode()).isEqualTo(502);
            assertThat(factory.getBackendCalls()).hasSize(1);
        }

        @Test
        @DisplayName("should let unauthenticated calls through when service auth is off")
        void shouldSkipAuth() throws Exception {
            update(s -> new MeshSettings.Update(null, null, null, null, false, null, null));

            GatewayResponse response = postBooking(null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(factory.getBackendCalls()).hasSize(1);
        }

        @Test
        @DisplayName("should ignore canaries when traffic routing is off")
        void shouldSkipRouting() throws Exception {
            factory.getTrafficRouter().createCanary("booking-service", "2.0.0", "1.0.0", 100);
            update(s -> new MeshSettings.Update(null, null, null, false, null, null, null));

            for (int i = 0; i < 4; i++) {
                get("/api/dashboard");
            }

            assertThat(factory.getBackendCalls())
                    .filteredOn(call -> call.instance().getServiceName().equals("booking-service"))
                    .extracting(call -> call.instance().getId())
                    .contains("booking-1", "booking-2");
        }

        @Test
        @DisplayName("should call the backend directly when the mesh is off")
        void shouldBypassMesh() throws Exception {
            factory.getCircuitBreakers().getOrCreate("user-service").forceState(CircuitBreaker.State.OPEN);
            update(s -> new MeshSettings.Update(false, null, null, null, null, null, null));

            GatewayResponse response = get("/api/users/1");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(factory.getBackendCalls()).hasSize(1);
            assertThat(factory.getControlPlane().getCallStats().totalServiceCalls()).isZero();
        }
    }

    @Test
    @DisplayName("should process concurrent requests through the pipeline")
    void shouldProcessConcurrentRequests() throws Exception {
        int count = 40;
        CompletableFuture<?>[] futures = new CompletableFuture[count];
        for (int i = 0; i < count; i++) {
            futures[i] = factory.getPipeline().submit(
                    GatewayRequest.builder().method("GET").path("/api/users/" + i).build());
        }

        CompletableFuture.allOf(futures).get(10, TimeUnit.SECONDS);

        for (CompletableFuture<?> future : futures) {
            assertThat(((GatewayResponse) future.get()).statusCode()).isEqualTo(200);
        }
        ApiGateway.GatewayStats stats = factory.getGateway().getStats();
        assertThat(stats.totalRequests()).isEqualTo(count);
        assertThat(stats.successfulRequests()).isEqualTo(count);
        assertThat(stats.routeStats().get("GET:/api/users/**").requests()).isEqualTo(count);
    }
}
