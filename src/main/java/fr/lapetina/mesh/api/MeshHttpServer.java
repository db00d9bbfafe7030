package fr.lapetina.mesh.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.mesh.MeshFactory;
import fr.lapetina.mesh.api.dto.AclRequest;
import fr.lapetina.mesh.api.dto.ApiResponse;
import fr.lapetina.mesh.api.dto.CanaryRequest;
import fr.lapetina.mesh.api.dto.CertificateRequest;
import fr.lapetina.mesh.api.dto.RetryPolicyRequest;
import fr.lapetina.mesh.api.dto.ServiceRegistrationRequest;
import fr.lapetina.mesh.api.dto.TrafficRouteRequest;
import fr.lapetina.mesh.controlplane.MeshControlPlane;
import fr.lapetina.mesh.controlplane.MeshSettings;
import fr.lapetina.mesh.disruptor.GatewayPipeline;
import fr.lapetina.mesh.disruptor.exception.BackpressureException;
import fr.lapetina.mesh.domain.exception.MeshException;
import fr.lapetina.mesh.domain.exception.NotFoundException;
import fr.lapetina.mesh.domain.exception.ValidationException;
import fr.lapetina.mesh.domain.model.ErrorType;
import fr.lapetina.mesh.domain.model.GatewayRequest;
import fr.lapetina.mesh.domain.model.GatewayResponse;
import fr.lapetina.mesh.domain.model.ServiceInstance;
import fr.lapetina.mesh.domain.routing.CanaryDeployment;
import fr.lapetina.mesh.domain.routing.TrafficRoute;
import fr.lapetina.mesh.domain.routing.TrafficRouter;
import fr.lapetina.mesh.domain.strategy.SelectionStrategy;
import fr.lapetina.mesh.gateway.ApiGateway;
import fr.lapetina.mesh.gateway.GatewayRoute;
import fr.lapetina.mesh.infrastructure.auth.ServiceAuthority;
import fr.lapetina.mesh.infrastructure.auth.ServiceCertificate;
import fr.lapetina.mesh.infrastructure.config.ConfigLoader;
import fr.lapetina.mesh.infrastructure.config.MeshGatewayConfig;
import fr.lapetina.mesh.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mesh.infrastructure.registry.ServiceRegistry;
import fr.lapetina.mesh.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.mesh.infrastructure.resilience.RetryPolicy;
import fr.lapetina.mesh.infrastructure.resilience.RetryPolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - /mesh/** - administrative API, JSON envelope {success, data, error, message, count}
 * - GET /health - liveness summary
 * - GET /metrics - Prometheus metrics endpoint
 * - everything else - gateway pass-through, served by the gateway pipeline
 *
 * Mutating admin calls need {@code Authorization: Bearer <server.adminToken>} when a token is configured.
 */
public final class MeshHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MeshHttpServer.class);

    private static final long RESPONSE_WAIT_SECONDS = 120;
    private static final Set<String> SKIPPED_RESPONSE_HEADERS = Set.of(
            "content-length", "transfer-encoding", "connection", "keep-alive"
    );

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final MeshControlPlane controlPlane;
    private final ApiGateway gateway;
    private final GatewayPipeline pipeline;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;
    private final String adminToken;

    public MeshHttpServer(MeshFactory factory) throws IOException {
        this(factory, factory.getConfig().getServer());
    }

    public MeshHttpServer(MeshFactory factory, MeshGatewayConfig.ServerConfig serverConfig) throws IOException {
        this.objectMapper = factory.getObjectMapper();
        this.controlPlane = factory.getControlPlane();
        this.gateway = factory.getGateway();
        this.pipeline = factory.getPipeline();
        this.metricsRegistry = factory.getMetricsRegistry();
        this.configLoader = factory.getConfigLoader();
        this.adminToken = serverConfig.getAdminToken();

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort()),
                serverConfig.getBacklog()
        );

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(serverConfig.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "http-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/mesh", new AdminHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/", new GatewayHandler());

        log.info("HTTP server configured: host={}, port={}", serverConfig.getHost(), serverConfig.getPort());
    }

    /**
     * Constant-time comparison of an {@code Authorization} header against the admin token.
     */
    static boolean bearerMatches(String authorization, String token) {
        if (authorization == null || token == null) {
            return false;
        }
        byte[] expected = ("Bearer " + token).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(authorization.getBytes(StandardCharsets.UTF_8), expected);
    }

    public void start() {
        server.start();
        log.info("HTTP server started: port={}", getPort());
    }

    /**
     * Bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== GATEWAY HANDLER ====================

    private class GatewayHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = UUID.randomUUID().toString();
            MDC.put("requestId", requestId);

            try {
                GatewayRequest request = toGatewayRequest(exchange, requestId);

                CompletableFuture<GatewayResponse> future;
                try {
                    future = pipeline.submit(request);
                } catch (BackpressureException e) {
                    log.warn("Backpressure: requestId={}, reason={}", requestId, e.getReason());
                    sendJson(exchange, e.getHttpStatus(), ApiResponse.error(e.getErrorType().name(), e.getMessage()));
                    return;
                }

                GatewayResponse response = future.get(RESPONSE_WAIT_SECONDS, TimeUnit.SECONDS);
                sendGatewayResponse(exchange, request, response);

            } catch (TimeoutException e) {
                log.warn("Gateway response not ready in time: requestId={}", requestId);
                sendJson(exchange, 504, ApiResponse.error(ErrorType.GATEWAY_TIMEOUT.name(), "Gateway timed out"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sendJson(exchange, 503, ApiResponse.error(ErrorType.SERVICE_UNAVAILABLE.name(), "Gateway shutting down"));
            } catch (ExecutionException e) {
                log.error("Gateway pipeline failed: requestId={}", requestId, e.getCause());
                sendJson(exchange, 500, ApiResponse.error(ErrorType.INTERNAL_ERROR.name(), "Internal server error"));
            } finally {
                MDC.clear();
            }
        }

        private GatewayRequest toGatewayRequest(HttpExchange exchange, String requestId) throws IOException {
            Map<String, String> headers = new LinkedHashMap<>();
            exchange.getRequestHeaders().forEach((name, values) -> {
                if (!values.isEmpty()) {
                    headers.put(name, String.join(",", values));
                }
            });

            String body;
            try (InputStream is = exchange.getRequestBody()) {
                byte[] bytes = is.readAllBytes();
                body = bytes.length == 0 ? null : new String(bytes, StandardCharsets.UTF_8);
            }

            return GatewayRequest.builder()
                    .requestId(requestId)
                    .correlationId(exchange.getRequestHeaders().getFirst("X-Correlation-ID"))
                    .method(exchange.getRequestMethod())
                    .path(exchange.getRequestURI().getPath())
                    .query(exchange.getRequestURI().getRawQuery())
                    .headers(headers)
                    .body(body)
                    .build();
        }

        private void sendGatewayResponse(HttpExchange exchange, GatewayRequest request, GatewayResponse response)
                throws IOException {
            response.headers().forEach((name, value) -> {
                if (!SKIPPED_RESPONSE_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                    exchange.getResponseHeaders().set(name, value);
                }
            });
            exchange.getResponseHeaders().set("X-Request-ID", request.requestId());
            if (response.cacheHit()) {
                exchange.getResponseHeaders().set("X-Cache", "HIT");
            }

            byte[] bytes = response.body() == null ? new byte[0] : response.body().getBytes(StandardCharsets.UTF_8);
            boolean noBody = "HEAD".equals(request.method())
                    || response.statusCode() == 204 || response.statusCode() == 304;
            if (noBody || bytes.length == 0) {
                exchange.sendResponseHeaders(response.statusCode(), -1);
                exchange.close();
                return;
            }
            exchange.sendResponseHeaders(response.statusCode(), bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "METHOD_NOT_ALLOWED", "Method Not Allowed");
                return;
            }

            MeshControlPlane.MeshHealth health = controlPlane.getHealth();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", health.status());
            body.put("timestamp", health.timestamp());
            body.put("mesh", health);

            Map<String, Object> pipelineStats = new LinkedHashMap<>();
            pipelineStats.put("running", pipeline.isRunning());
            pipelineStats.put("ringBufferRemaining", pipeline.getRemainingCapacity());
            body.put("pipeline", pipelineStats);

            boolean serving = health.status() != MeshControlPlane.HealthStatus.UNHEALTHY && pipeline.isRunning();
            sendJson(exchange, serving ? 200 : 503, body);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "METHOD_NOT_ALLOWED", "Method Not Allowed");
                return;
            }

            metricsRegistry.setRingBufferRemaining((int) pipeline.getRemainingCapacity());

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);

            try {
                if (!"GET".equals(method) && !isAdmin(exchange)) {
                    log.warn("Admin call rejected: method={}, path={}", method, path);
                    sendError(exchange, 401, ErrorType.UNAUTHORIZED.name(), "Admin token required");
                    return;
                }
                route(exchange, method, segments(path));
            } catch (MeshException e) {
                log.warn("Admin call failed: method={}, path={}, errorType={}, message={}",
                        method, path, e.getErrorType(), e.getMessage());
                sendError(exchange, e.getHttpStatus(), e.getErrorType().name(), e.getMessage());
            } catch (JsonProcessingException e) {
                log.warn("Malformed admin payload: method={}, path={}, reason={}", method, path, e.getOriginalMessage());
                sendError(exchange, 400, ErrorType.VALIDATION_ERROR.name(), "Malformed JSON body");
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, ErrorType.VALIDATION_ERROR.name(), e.getMessage());
            } catch (Exception e) {
                log.error("Error in admin handler: method={}, path={}", method, path, e);
                sendError(exchange, 500, ErrorType.INTERNAL_ERROR.name(), "Internal server error");
            }
        }

        private boolean isAdmin(HttpExchange exchange) {
            if (adminToken == null || adminToken.isBlank()) {
                return true;
            }
            return bearerMatches(exchange.getRequestHeaders().getFirst("Authorization"), adminToken);
        }

        private void route(HttpExchange exchange, String method, List<String> seg) throws IOException {
            // seg.get(0) is always "mesh"
            String resource = seg.size() > 1 ? seg.get(1) : "";
            switch (resource) {
                case "status":
                    requireMethod(method, "GET");
                    handleStatus(exchange);
                    break;
                case "config":
                    handleConfig(exchange, method);
                    break;
                case "stats":
                    handleStats(exchange, method, seg);
                    break;
                case "health":
                    requireMethod(method, "GET");
                    sendJson(exchange, 200, ApiResponse.ok(controlPlane.getHealth()));
                    break;
                case "reload":
                    requireMethod(method, "POST");
                    handleReload(exchange);
                    break;
                case "strategy":
                    handleStrategy(exchange, method);
                    break;
                case "services":
                    handleServices(exchange, method, seg);
                    break;
                case "circuit-breakers":
                    handleCircuitBreakers(exchange, method, seg);
                    break;
                case "retry-policies":
                    handleRetryPolicies(exchange, method, seg);
                    break;
                case "routes":
                    handleRoutes(exchange, method, seg);
                    break;
                case "canaries":
                    handleCanaries(exchange, method, seg);
                    break;
                case "certificates":
                    handleCertificates(exchange, method, seg);
                    break;
                case "acls":
                    handleAcls(exchange, method, seg);
                    break;
                case "gateway-routes":
                    handleGatewayRoutes(exchange, method, seg);
                    break;
                case "gateway-cache":
                    requireMethod(method, "DELETE");
                    gateway.clearCache();
                    sendJson(exchange, 200, ApiResponse.ok(null, "Gateway cache cleared"));
                    break;
                default:
                    throw new NotFoundException("Endpoint", exchange.getRequestURI().getPath());
            }
        }

        // ---- control plane ----

        private void handleStatus(HttpExchange exchange) throws IOException {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("config", controlPlane.getConfig());
            status.put("health", controlPlane.getHealth());
            status.put("callStats", controlPlane.getCallStats());
            sendJson(exchange, 200, ApiResponse.ok(status));
        }

        private void handleConfig(HttpExchange exchange, String method) throws IOException {
            if ("GET".equals(method)) {
                sendJson(exchange, 200, ApiResponse.ok(controlPlane.getConfig()));
                return;
            }
            requireMethod(method, "PUT");
            MeshSettings.Update update = readBody(exchange, MeshSettings.Update.class);
            MeshSettings updated = controlPlane.updateConfig(update);
            sendJson(exchange, 200, ApiResponse.ok(updated, "Mesh configuration updated"));
        }

        private void handleStats(HttpExchange exchange, String method, List<String> seg) throws IOException {
            if (seg.size() == 3 && "reset".equals(seg.get(2))) {
                requireMethod(method, "POST");
                controlPlane.resetAllStats();
                gateway.resetStats();
                sendJson(exchange, 200, ApiResponse.ok(null, "Statistics reset"));
                return;
            }
            requireMethod(method, "GET");
            requireDepth(seg, 2);
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("mesh", controlPlane.getStats());
            stats.put("gateway", gateway.getStats());
            sendJson(exchange, 200, ApiResponse.ok(stats));
        }

        private void handleReload(HttpExchange exchange) throws IOException {
            MeshGatewayConfig reloaded = configLoader.reload();
            sendJson(exchange, 200, ApiResponse.ok(Map.of(
                    "services", reloaded.getServices().size(),
                    "gatewayRoutes", reloaded.getGateway().getRoutes().size()
            ), "Configuration reloaded"));
        }

        private void handleStrategy(HttpExchange exchange, String method) throws IOException {
            ServiceRegistry registry = controlPlane.getRegistry();
            if ("GET".equals(method)) {
                sendJson(exchange, 200, ApiResponse.ok(Map.of(
                        "current", registry.getDefaultStrategy().getConfigName(),
                        "available", Arrays.stream(SelectionStrategy.values())
                                .map(SelectionStrategy::getConfigName)
                                .toList()
                )));
                return;
            }
            requireMethod(method, "PUT");
            Map<?, ?> request = readBody(exchange, Map.class);
            Object name = request.get("strategy");
            if (name == null || name.toString().isBlank()) {
                throw new ValidationException("strategy is required");
            }
            SelectionStrategy strategy = SelectionStrategy.fromName(name.toString())
                    .orElseThrow(() -> new ValidationException("Unknown strategy: " + name));
            registry.setDefaultStrategy(strategy);
            sendJson(exchange, 200, ApiResponse.ok(Map.of("strategy", strategy.getConfigName()),
                    "Strategy changed successfully"));
        }

        // ---- registry ----

        private void handleServices(HttpExchange exchange, String method, List<String> seg) throws IOException {
            ServiceRegistry registry = controlPlane.getRegistry();

            if (seg.size() == 2) {
                if ("GET".equals(method)) {
                    Map<String, List<ServiceInstance>> services = new LinkedHashMap<>();
                    for (String serviceName : registry.getServiceNames()) {
                        services.put(serviceName, registry.getInstances(serviceName));
                    }
                    ApiResponse response = ApiResponse.ok(services);
                    response.setCount(registry.size());
                    sendJson(exchange, 200, response);
                    return;
                }
                requireMethod(method, "POST");
                requireDiscovery();
                ServiceRegistrationRequest request = readBody(exchange, ServiceRegistrationRequest.class);
                ServiceInstance registered = registry.register(request.toInstance());
                sendJson(exchange, 201, ApiResponse.ok(registered, "Service registered"));
                return;
            }

            String serviceName = seg.get(2);
            if (seg.size() == 3) {
                requireMethod(method, "GET");
                sendJson(exchange, 200, ApiResponse.ok(registry.getInstances(serviceName)));
                return;
            }

            if (seg.size() == 4 && "discover".equals(seg.get(3))) {
                requireMethod(method, "GET");
                Map<String, String> query = queryParams(exchange);
                Set<String> tags = null;
                if (query.get("tags") != null && !query.get("tags").isBlank()) {
                    tags = new LinkedHashSet<>(Arrays.asList(query.get("tags").split(",")));
                }
                boolean healthyOnly = !"false".equalsIgnoreCase(query.get("healthyOnly"));
                List<ServiceInstance> found = registry.discover(serviceName, query.get("version"), tags, healthyOnly);
                sendJson(exchange, 200, ApiResponse.ok(found));
                return;
            }

            String instanceId = seg.get(3);
            if (seg.size() == 4) {
                if ("GET".equals(method)) {
                    ServiceInstance instance = registry.getInstance(serviceName, instanceId)
                            .orElseThrow(() -> new NotFoundException("Instance", serviceName + "/" + instanceId));
                    sendJson(exchange, 200, ApiResponse.ok(instance));
                    return;
                }
                requireMethod(method, "DELETE");
                requireDiscovery();
                if (!registry.deregister(serviceName, instanceId)) {
                    throw new NotFoundException("Instance", serviceName + "/" + instanceId);
                }
                sendJson(exchange, 200, ApiResponse.ok(null, "Service deregistered"));
                return;
            }

            if (seg.size() == 5 && "health".equals(seg.get(4))) {
                requireMethod(method, "PUT");
                Map<?, ?> request = readBody(exchange, Map.class);
                Object healthy = request.get("healthy");
                if (!(healthy instanceof Boolean)) {
                    throw new ValidationException("healthy must be a boolean");
                }
                if (!registry.setHealth(serviceName, instanceId, (Boolean) healthy)) {
                    throw new NotFoundException("Instance", serviceName + "/" + instanceId);
                }
                sendJson(exchange, 200, ApiResponse.ok(registry.getInstance(serviceName, instanceId).orElse(null)));
                return;
            }

            throw new NotFoundException("Endpoint", exchange.getRequestURI().getPath());
        }

        private void requireDiscovery() {
            if (!controlPlane.getConfig().serviceDiscovery()) {
                throw new MeshException(ErrorType.SERVICE_UNAVAILABLE, "Service discovery is disabled");
            }
        }

        // ---- resilience ----

        private void handleCircuitBreakers(HttpExchange exchange, String method, List<String> seg) throws IOException {
            if (seg.size() == 2) {
                requireMethod(method, "GET");
                sendJson(exchange, 200, ApiResponse.ok(controlPlane.getCircuitBreakers().getAllStats()));
                return;
            }
            if (seg.size() == 3 && "reset".equals(seg.get(2))) {
                requireMethod(method, "POST");
                controlPlane.getCircuitBreakers().resetAll();
                sendJson(exchange, 200, ApiResponse.ok(null, "Circuit breakers reset"));
                return;
            }
            if (seg.size() == 4 && "state".equals(seg.get(3))) {
                requireMethod(method, "PUT");
                String name = seg.get(2);
                CircuitBreaker breaker = controlPlane.getCircuitBreakers().find(name)
                        .orElseThrow(() -> new NotFoundException("Circuit breaker", name));
                Map<?, ?> request = readBody(exchange, Map.class);
                Object state = request.get("state");
                if (state == null) {
                    throw new ValidationException("state is required");
                }
                breaker.forceState(CircuitBreaker.State.valueOf(state.toString().toUpperCase(Locale.ROOT)));
                sendJson(exchange, 200, ApiResponse.ok(breaker.getStats()));
                return;
            }
            throw new NotFoundException("Endpoint", exchange.getRequestURI().getPath());
        }

        private void handleRetryPolicies(HttpExchange exchange, String method, List<String> seg) throws IOException {
            RetryPolicyEngine engine = controlPlane.getRetryEngine();
            if (seg.size() == 2) {
                if ("GET".equals(method)) {
                    sendJson(exchange, 200, ApiResponse.ok(engine.getPolicies()));
                    return;
                }
                requireMethod(method, "POST");
                RetryPolicyRequest request = readBody(exchange, RetryPolicyRequest.class);
                RetryPolicy policy = request.toPolicy(engine.getDefaultPolicy());
                engine.registerPolicy(policy);
                sendJson(exchange, 201, ApiResponse.ok(policy, "Retry policy registered"));
                return;
            }
            requireDepth(seg, 3);
            requireMethod(method, "DELETE");
            if (!engine.removePolicy(seg.get(2))) {
                throw new NotFoundException("Retry policy", seg.get(2));
            }
            sendJson(exchange, 200, ApiResponse.ok(null, "Retry policy removed"));
        }

        // ---- traffic routing ----

        private void handleRoutes(HttpExchange exchange, String method, List<String> seg) throws IOException {
            TrafficRouter router = controlPlane.getTrafficRouter();
            if (seg.size() == 2) {
                if ("GET".equals(method)) {
                    sendJson(exchange, 200, ApiResponse.ok(router.getRoutes()));
                    return;
                }
                requireMethod(method, "POST");
                TrafficRouteRequest request = readBody(exchange, TrafficRouteRequest.class);
                TrafficRoute route = router.createRoute(request.getName(), request.getServiceName(),
                        request.toRules(), request.getEnabled() == null || request.getEnabled());
                sendJson(exchange, 201, ApiResponse.ok(route, "Traffic route created"));
                return;
            }

            requireDepth(seg, 3);
            String routeId = seg.get(2);
            switch (method) {
                case "GET":
                    sendJson(exchange, 200, ApiResponse.ok(router.getRoute(routeId)
                            .orElseThrow(() -> new NotFoundException("Route", routeId))));
                    break;
                case "PUT":
                    TrafficRouteRequest request = readBody(exchange, TrafficRouteRequest.class);
                    TrafficRoute updated = router.updateRoute(routeId, request.getName(), request.toRules(),
                            request.getEnabled());
                    sendJson(exchange, 200, ApiResponse.ok(updated, "Traffic route updated"));
                    break;
                case "DELETE":
                    if (!router.deleteRoute(routeId)) {
                        throw new NotFoundException("Route", routeId);
                    }
                    sendJson(exchange, 200, ApiResponse.ok(null, "Traffic route deleted"));
                    break;
                default:
                    throw methodNotAllowed(method);
            }
        }

        private void handleCanaries(HttpExchange exchange, String method, List<String> seg) throws IOException {
            TrafficRouter router = controlPlane.getTrafficRouter();
            if (seg.size() == 2) {
                if ("GET".equals(method)) {
                    sendJson(exchange, 200, ApiResponse.ok(router.getCanaries()));
                    return;
                }
                requireMethod(method, "POST");
                CanaryRequest request = readBody(exchange, CanaryRequest.class);
                CanaryDeployment canary = router.createCanary(
                        request.getServiceName(),
                        request.getCanaryVersion(),
                        request.getStableVersion(),
                        ValidationException.requireNonNull(request.getTrafficPercent(), "trafficPercent"));
                sendJson(exchange, 201, ApiResponse.ok(canary, "Canary deployment created"));
                return;
            }

            String canaryId = seg.get(2);
            if (seg.size() == 3) {
                requireMethod(method, "GET");
                sendJson(exchange, 200, ApiResponse.ok(router.getCanary(canaryId)
                        .orElseThrow(() -> new NotFoundException("Canary", canaryId))));
                return;
            }
            requireDepth(seg, 4);
            requireMethod(method, "POST");
            switch (seg.get(3)) {
                case "promote":
                    sendJson(exchange, 200, ApiResponse.ok(router.promoteCanary(canaryId), "Canary promoted"));
                    break;
                case "rollback":
                    sendJson(exchange, 200, ApiResponse.ok(router.rollbackCanary(canaryId), "Canary rolled back"));
                    break;
                default:
                    throw new NotFoundException("Endpoint", exchange.getRequestURI().getPath());
            }
        }

        // ---- service auth ----

        private void handleCertificates(HttpExchange exchange, String method, List<String> seg) throws IOException {
            ServiceAuthority authority = controlPlane.getServiceAuthority();
            if (seg.size() == 2) {
                if ("GET".equals(method)) {
                    sendJson(exchange, 200, ApiResponse.ok(authority.getCertificates()));
                    return;
                }
                requireMethod(method, "POST");
                CertificateRequest request = readBody(exchange, CertificateRequest.class);
                ServiceCertificate certificate = authority.issueCertificate(request.getServiceId(), request.getServiceName());
                sendJson(exchange, 201, ApiResponse.ok(certificate, "Certificate issued"));
                return;
            }

            String serviceId = seg.get(2);
            if (seg.size() == 3) {
                if ("GET".equals(method)) {
                    sendJson(exchange, 200, ApiResponse.ok(authority.getCertificate(serviceId)
                            .orElseThrow(() -> new NotFoundException("Certificate", serviceId))));
                    return;
                }
                requireMethod(method, "DELETE");
                if (!authority.revokeCertificate(serviceId)) {
                    throw new NotFoundException("Certificate", serviceId);
                }
                sendJson(exchange, 200, ApiResponse.ok(null, "Certificate revoked"));
                return;
            }
            if (seg.size() == 4 && "rotate".equals(seg.get(3))) {
                requireMethod(method, "POST");
                sendJson(exchange, 200, ApiResponse.ok(authority.rotateCertificate(serviceId), "Certificate rotated"));
                return;
            }
            throw new NotFoundException("Endpoint", exchange.getRequestURI().getPath());
        }

        private void handleAcls(HttpExchange exchange, String method, List<String> seg) throws IOException {
            ServiceAuthority authority = controlPlane.getServiceAuthority();
            if (seg.size() == 2) {
                if ("GET".equals(method)) {
                    sendJson(exchange, 200, ApiResponse.ok(authority.getAcls()));
                    return;
                }
                requireMethod(method, "POST");
                AclRequest request = readBody(exchange, AclRequest.class);
                sendJson(exchange, 201, ApiResponse.ok(authority.addAcl(request.toAclEntry()), "ACL saved"));
                return;
            }
            requireDepth(seg, 4);
            requireMethod(method, "DELETE");
            if (!authority.removeAcl(seg.get(2), seg.get(3))) {
                throw new NotFoundException("ACL", seg.get(2) + ":" + seg.get(3));
            }
            sendJson(exchange, 200, ApiResponse.ok(null, "ACL removed"));
        }

        // ---- gateway ----

        private void handleGatewayRoutes(HttpExchange exchange, String method, List<String> seg) throws IOException {
            requireDepth(seg, 2);
            switch (method) {
                case "GET":
                    sendJson(exchange, 200, ApiResponse.ok(gateway.getRoutes()));
                    break;
                case "POST":
                    MeshGatewayConfig.RouteConfig request = readBody(exchange, MeshGatewayConfig.RouteConfig.class);
                    GatewayRoute route = gateway.registerRoute(toRoute(request));
                    sendJson(exchange, 201, ApiResponse.ok(route, "Gateway route registered"));
                    break;
                case "DELETE":
                    Map<String, String> query = queryParams(exchange);
                    String path = ValidationException.requireText(query.get("path"), "path");
                    String routeMethod = query.getOrDefault("method", "GET");
                    if (!gateway.removeRoute(routeMethod, path)) {
                        throw new NotFoundException("Gateway route", GatewayRoute.key(routeMethod, path));
                    }
                    sendJson(exchange, 200, ApiResponse.ok(null, "Gateway route removed"));
                    break;
                default:
                    throw methodNotAllowed(method);
            }
        }

        private GatewayRoute toRoute(MeshGatewayConfig.RouteConfig request) {
            try {
                return request.toRoute();
            } catch (ConfigLoader.ConfigurationException e) {
                throw new ValidationException(e.getMessage());
            }
        }

        // ---- helpers ----

        private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
            try (InputStream is = exchange.getRequestBody()) {
                byte[] bytes = is.readAllBytes();
                if (bytes.length == 0) {
                    throw new ValidationException("Request body is required");
                }
                T value = objectMapper.readValue(bytes, type);
                if (value == null) {
                    throw new ValidationException("Request body is required");
                }
                return value;
            }
        }

        private void requireMethod(String actual, String expected) {
            if (!expected.equals(actual)) {
                throw methodNotAllowed(actual);
            }
        }

        private MeshException methodNotAllowed(String method) {
            return new MethodNotAllowedException(method);
        }

        private void requireDepth(List<String> seg, int depth) {
            if (seg.size() != depth) {
                throw new NotFoundException("Endpoint", "/" + String.join("/", seg));
            }
        }
    }

    private static List<String> segments(String path) {
        return Arrays.stream(path.split("/"))
                .filter(s -> !s.isEmpty())
                .map(s -> URLDecoder.decode(s, StandardCharsets.UTF_8))
                .toList();
    }

    private static Map<String, String> queryParams(HttpExchange exchange) {
        Map<String, String> params = new LinkedHashMap<>();
        String raw = exchange.getRequestURI().getRawQuery();
        if (raw == null || raw.isEmpty()) {
            return params;
        }
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String error, String message) throws IOException {
        sendJson(exchange, statusCode, ApiResponse.error(error, message));
    }

    /**
     * Admin endpoint called with an unsupported HTTP method.
     */
    static final class MethodNotAllowedException extends MeshException {
        MethodNotAllowedException(String method) {
            super(ErrorType.VALIDATION_ERROR, "Method not allowed: " + method);
        }

        @Override
        public int getHttpStatus() {
            return 405;
        }
    }
}
