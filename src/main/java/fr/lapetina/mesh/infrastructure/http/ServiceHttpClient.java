package fr.lapetina.mesh.infrastructure.http;

import fr.lapetina.mesh.domain.model.GatewayRequest;
import fr.lapetina.mesh.domain.model.GatewayResponse;
import fr.lapetina.mesh.domain.model.ServiceInstance;
import fr.lapetina.mesh.infrastructure.health.HealthProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP client forwarding gateway requests to backend service instances.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. The client relays
 * whatever status the backend answers; classifying it is up to the caller.
 */
public class ServiceHttpClient implements HealthProbe, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceHttpClient.class);

    // Rejected by java.net.http or meaningless past the gateway
    private static final Set<String> SKIPPED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade",
            "keep-alive", "transfer-encoding", "te", "trailer", "proxy-connection",
            GatewayRequest.CERTIFICATE_HEADER
    );

    private final HttpClient httpClient;
    private final Duration healthCheckTimeout;

    public ServiceHttpClient(Duration connectTimeout, Duration healthCheckTimeout) {
        this.healthCheckTimeout = healthCheckTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    public ServiceHttpClient() {
        this(Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    /**
     * Forwards a request to one instance.
     *
     * @param instance   Target instance
     * @param request    Incoming gateway request
     * @param targetPath Path on the backend, without query
     * @param timeout    Request timeout, or null for none
     * @return Future completing with the backend response, whatever its status,
     *         or failing with the transport error
     */
    public CompletableFuture<GatewayResponse> send(
            ServiceInstance instance,
            GatewayRequest request,
            String targetPath,
            Duration timeout
    ) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(instance, request, targetPath, timeout);
        } catch (IllegalArgumentException e) {
            log.error("Failed to build backend request: instanceId={}, requestId={}, path={}",
                    instance.getId(), request.requestId(), targetPath, e);
            return CompletableFuture.failedFuture(e);
        }

        Instant startTime = Instant.now();
        log.debug("Forwarding request: instanceId={}, requestId={}, method={}, uri={}",
                instance.getId(), request.requestId(), request.method(), httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    Duration latency = Duration.between(startTime, Instant.now());
                    log.debug("Backend answered: instanceId={}, requestId={}, status={}, latencyMs={}",
                            instance.getId(), request.requestId(), response.statusCode(), latency.toMillis());
                    return GatewayResponse.of(request.requestId(), response.statusCode(),
                                    flattenHeaders(response.headers().map()), response.body())
                            .servedBy(instance, latency);
                });
    }

    private HttpRequest buildHttpRequest(
            ServiceInstance instance,
            GatewayRequest request,
            String targetPath,
            Duration timeout
    ) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(buildUri(instance, targetPath, request.query()));
        if (timeout != null && !timeout.isZero()) {
            builder.timeout(timeout);
        }

        request.headers().forEach((name, value) -> {
            if (!SKIPPED_HEADERS.contains(name) && !name.equals("x-request-id")) {
                builder.header(name, value);
            }
        });
        builder.header("X-Request-ID", request.requestId());
        if (request.header(GatewayRequest.CORRELATION_HEADER) == null) {
            builder.header("X-Correlation-ID", request.correlationId());
        }

        String body = request.body();
        HttpRequest.BodyPublisher publisher = body == null || body.isEmpty()
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        builder.method(request.method(), publisher);
        return builder.build();
    }

    private URI buildUri(ServiceInstance instance, String targetPath, String query) {
        String base = instance.getBaseUri().toString().replaceAll("/$", "");
        String path = targetPath == null || targetPath.isEmpty() ? "/" : targetPath;
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        return URI.create(base + path + (query == null || query.isEmpty() ? "" : "?" + query));
    }

    private static Map<String, String> flattenHeaders(Map<String, List<String>> headers) {
        Map<String, String> flat = new HashMap<>();
        headers.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (!values.isEmpty() && !lower.startsWith(":") && !SKIPPED_HEADERS.contains(lower)) {
                flat.put(lower, String.join(",", values));
            }
        });
        return flat;
    }

    /**
     * Performs a health check against an instance. Any 2xx answer counts as healthy.
     */
    @Override
    public CompletableFuture<Boolean> probe(ServiceInstance instance) {
        URI uri = instance.getHealthUri();

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(healthCheckTimeout)
                .GET()
                .build();

        log.debug("Health check started: instanceId={}, uri={}", instance.getId(), uri);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean healthy = response.statusCode() >= 200 && response.statusCode() < 300;
                    if (healthy) {
                        log.debug("Health check passed: instanceId={}, status={}", instance.getId(), response.statusCode());
                    } else {
                        log.warn("Health check failed: instanceId={}, status={}", instance.getId(), response.statusCode());
                    }
                    return healthy;
                })
                .exceptionally(ex -> {
                    log.warn("Health check error: instanceId={}, error={}", instance.getId(), ex.getMessage());
                    return false;
                });
    }

    @Override
    public void close() {
        // HttpClient has no close() before JDK 21
    }
}
