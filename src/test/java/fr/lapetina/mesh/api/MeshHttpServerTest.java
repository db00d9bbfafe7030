package fr.lapetina.mesh.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.mesh.integration.TestMeshFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MeshHttpServerTest {

    private static final String ADMIN = "Bearer test-token";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();

    private TestMeshFactory factory;
    private MeshHttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        factory = TestMeshFactory.create();
        server = new MeshHttpServer(factory);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        factory.close();
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                .timeout(Duration.ofSeconds(5));
    }

    private HttpResponse<String> send(HttpRequest request) throws Exception {
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return send(request(path).GET().build());
    }

    private HttpResponse<String> sendJson(String method, String path, String body, String authorization) throws Exception {
        HttpRequest.Builder builder = request(path)
                .header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(body));
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return send(builder.build());
    }

    @Nested
    @DisplayName("Gateway traffic")
    class GatewayTests {

        @Test
        @DisplayName("should relay the backend answer with a request id")
        void shouldRelayBackendAnswer() throws Exception {
            factory.setBackendResponse(200, "{\"id\":7}");

            HttpResponse<String> response = get("/api/users/7?expand=true");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEqualTo("{\"id\":7}");
            assertThat(response.headers().firstValue("X-Request-ID")).isPresent();
            assertThat(factory.getBackendCalls()).hasSize(1);
            assertThat(factory.getBackendCalls().get(0).request().query()).isEqualTo("expand=true");
        }

        @Test
        @DisplayName("should flag answers served from the cache")
        void shouldFlagCacheHits() throws Exception {
            get("/api/users/7");
            HttpResponse<String> second = get("/api/users/7");

            assertThat(second.statusCode()).isEqualTo(200);
            assertThat(second.headers().firstValue("X-Cache")).contains("HIT");
        }

        @Test
        @DisplayName("should answer a JSON error for an unknown route")
        void shouldAnswerNotFound() throws Exception {
            HttpResponse<String> response = get("/api/unknown");

            assertThat(response.statusCode()).isEqualTo(404);
            JsonNode body = objectMapper.readTree(response.body());
            assertThat(body.path("error").asText()).isEqualTo("NOT_FOUND");
        }
    }

    @Nested
    @DisplayName("Health and metrics")
    class ObservabilityTests {

        @Test
        @DisplayName("should report a healthy mesh")
        void shouldReportHealth() throws Exception {
            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = objectMapper.readTree(response.body());
            assertThat(body.path("status").asText()).isEqualTo("healthy");
            assertThat(body.path("pipeline").path("running").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("should expose Prometheus metrics")
        void shouldExposeMetrics() throws Exception {
            get("/api/users/1");

            HttpResponse<String> response = get("/metrics");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("mesh_test");
        }
    }

    @Nested
    @DisplayName("Admin API")
    class AdminTests {

        private static final String REGISTRATION = "{\"id\":\"user-3\",\"serviceName\":\"user-service\","
                + "\"version\":\"1.0.0\",\"host\":\"localhost\",\"port\":9010}";

        @Test
        @DisplayName("should require the admin token for changes")
        void shouldRequireToken() throws Exception {
            HttpResponse<String> response = sendJson("POST", "/mesh/services", REGISTRATION, null);

            assertThat(response.statusCode()).isEqualTo(401);
            assertThat(factory.getServiceRegistry().getInstance("user-service", "user-3")).isEmpty();
        }

        @Test
        @DisplayName("should reject a wrong admin token")
        void shouldRejectWrongToken() throws Exception {
            HttpResponse<String> response = sendJson("POST", "/mesh/services", REGISTRATION, "Bearer test-tokem");

            assertThat(response.statusCode()).isEqualTo(401);
            assertThat(factory.getServiceRegistry().getInstance("user-service", "user-3")).isEmpty();
        }

        @Test
        @DisplayName("should match only the exact bearer header")
        void shouldMatchExactBearer() {
            assertThat(MeshHttpServer.bearerMatches("Bearer test-token", "test-token")).isTrue();
            assertThat(MeshHttpServer.bearerMatches("Bearer test-token ", "test-token")).isFalse();
            assertThat(MeshHttpServer.bearerMatches("test-token", "test-token")).isFalse();
            assertThat(MeshHttpServer.bearerMatches(null, "test-token")).isFalse();
        }

        @Test
        @DisplayName("should register and list an instance")
        void shouldRegisterInstance() throws Exception {
            HttpResponse<String> created = sendJson("POST", "/mesh/services", REGISTRATION, ADMIN);
            HttpResponse<String> listed = get("/mesh/services/user-service");

            assertThat(created.statusCode()).isEqualTo(201);
            assertThat(objectMapper.readTree(created.body()).path("success").asBoolean()).isTrue();
            assertThat(listed.statusCode()).isEqualTo(200);
            assertThat(objectMapper.readTree(listed.body()).path("data")).hasSize(3);
        }

        @Test
        @DisplayName("should refuse registrations while discovery is off")
        void shouldRefuseRegistrationWhenDiscoveryIsOff() throws Exception {
            HttpResponse<String> updated = sendJson("PUT", "/mesh/config", "{\"serviceDiscovery\":false}", ADMIN);
            HttpResponse<String> response = sendJson("POST", "/mesh/services", REGISTRATION, ADMIN);

            assertThat(updated.statusCode()).isEqualTo(200);
            assertThat(factory.getControlPlane().getConfig().serviceDiscovery()).isFalse();
            assertThat(factory.getControlPlane().getConfig().enabled()).isTrue();
            assertThat(response.statusCode()).isEqualTo(503);
        }

        @Test
        @DisplayName("should reject a malformed body")
        void shouldRejectMalformedBody() throws Exception {
            HttpResponse<String> response = sendJson("POST", "/mesh/services", "{not json", ADMIN);

            assertThat(response.statusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should answer 404 for an unknown instance")
        void shouldAnswerUnknownInstance() throws Exception {
            HttpResponse<String> response = get("/mesh/services/user-service/user-99");

            assertThat(response.statusCode()).isEqualTo(404);
        }
    }
}
