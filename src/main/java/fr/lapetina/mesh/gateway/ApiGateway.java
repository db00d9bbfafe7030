package fr.lapetina.mesh.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.mesh.controlplane.MeshControlPlane;
import fr.lapetina.mesh.controlplane.MeshSettings;
import fr.lapetina.mesh.domain.exception.NotFoundException;
import fr.lapetina.mesh.domain.exception.UnauthorizedServiceException;
import fr.lapetina.mesh.domain.model.GatewayRequest;
import fr.lapetina.mesh.domain.model.GatewayResponse;
import fr.lapetina.mesh.infrastructure.auth.ServiceAuthority;
import fr.lapetina.mesh.infrastructure.auth.ServiceCertificate;
import fr.lapetina.mesh.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Public façade of the mesh: binds (method, path) to backend services and
 * runs each request through cache, service auth and the dispatcher.
 *
 * <p>The stages are exposed one by one so the ingress pipeline can run
 * them in its own handlers; {@link #handle} chains them for direct use.
 */
public final class ApiGateway {

    private static final Logger log = LoggerFactory.getLogger(ApiGateway.class);

    public static final String CALLER_HEADER = "x-caller-id";

    private final MeshControlPlane controlPlane;
    private final ServiceDispatcher dispatcher;
    private final ResponseCache cache;
    private final ResponseTransformer transformer;
    private final GatewayErrorMapper errorMapper;
    private final MetricsRegistry metrics;
    private final ObjectMapper objectMapper;

    private final Map<String, GatewayRoute> routes = new ConcurrentHashMap<>();

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong cachedResponses = new AtomicLong();
    private final AtomicLong aggregatedRequests = new AtomicLong();
    private final AtomicLong transformedResponses = new AtomicLong();
    private final Map<String, Counters> routeStats = new ConcurrentHashMap<>();
    private final Map<String, Counters> serviceStats = new ConcurrentHashMap<>();

    public ApiGateway(
            MeshControlPlane controlPlane,
            ServiceDispatcher dispatcher,
            ResponseCache cache,
            ObjectMapper objectMapper,
            MetricsRegistry metrics
    ) {
        this.controlPlane = controlPlane;
        this.dispatcher = dispatcher;
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.transformer = new ResponseTransformer(objectMapper);
        this.errorMapper = new GatewayErrorMapper(objectMapper);
    }

    /**
     * Binds a route. A route with the same method and path is replaced and its cached responses dropped.
     */
    public GatewayRoute registerRoute(GatewayRoute route) {
        GatewayRoute previous = routes.put(route.getRouteKey(), route);
        if (previous != null) {
            cache.invalidateRoute(route.getRouteKey());
        }
        log.info("Gateway route {}: route={}, service={}, targetPath={}, cacheTtlSeconds={}, requiresAuth={}, aggregated={}",
                previous == null ? "registered" : "replaced", route.getRouteKey(), route.serviceName(),
                route.targetPath(), route.cacheTtlSeconds(), route.requiresAuth(), route.aggregation() != null);
        return route;
    }

    public boolean removeRoute(String method, String path) {
        String key = GatewayRoute.key(method, path);
        GatewayRoute removed = routes.remove(key);
        if (removed != null) {
            cache.invalidateRoute(key);
            log.info("Gateway route removed: route={}", key);
        }
        return removed != null;
    }

    public List<GatewayRoute> getRoutes() {
        return routes.values().stream()
                .sorted(Comparator.comparing(GatewayRoute::getRouteKey))
                .toList();
    }

    /**
     * Exact (method, path) first, then the most specific wildcard route of the method.
     *
     * @throws NotFoundException if no route serves the request
     */
    public GatewayRoute resolveRoute(GatewayRequest request) {
        GatewayRoute exact = routes.get(GatewayRoute.key(request.method(), request.path()));
        if (exact != null) {
            return exact;
        }
        return routes.values().stream()
                .filter(route -> route.isWildcard()
                        && route.method().equals(request.method())
                        && route.matches(request.path()))
                .max(Comparator.comparingInt(GatewayRoute::specificity))
                .orElseThrow(() -> new NotFoundException("Route", request.method() + " " + request.path()));
    }

    /**
     * Cached response of a cacheable route, re-addressed to this request. Must run after
     * {@link #authorize}, so that refused callers never reach the cache.
     *
     * @param caller The verified caller, or null when the route does not enforce auth
     */
    public Optional<GatewayResponse> lookupCache(GatewayRoute route, GatewayRequest request,
                                                 ServiceCertificate caller) {
        if (!route.isCacheable()) {
            return Optional.empty();
        }
        Optional<GatewayResponse> cached = cache.get(cacheKey(request, caller))
                .map(response -> response.asCacheHit(request.requestId()));
        recordCacheLookup(cached.isPresent());
        if (cached.isPresent()) {
            log.debug("Gateway cache hit: route={}, requestId={}", route.getRouteKey(), request.requestId());
        }
        return cached;
    }

    private void recordCacheLookup(boolean hit) {
        if (metrics != null && controlPlane.getConfig().observability()) {
            metrics.recordCacheLookup(hit);
        }
    }

    /**
     * Verifies the caller's certificate and ACL for routes that require it.
     *
     * @return The caller's certificate, or null when the route or the mesh does not enforce auth
     * @throws UnauthorizedServiceException when the call is refused
     */
    public ServiceCertificate authorize(GatewayRoute route, GatewayRequest request) {
        MeshSettings settings = controlPlane.getConfig();
        if (!route.requiresAuth() || !settings.enabled() || !settings.serviceAuth()) {
            return null;
        }

        ServiceAuthority authority = controlPlane.getServiceAuthority();
        String permission = permissionFor(request.method());
        try {
            ServiceCertificate caller = null;
            for (String target : targetServices(route)) {
                caller = authority.authenticate(request.certificate(), target, permission);
            }
            return caller;
        } catch (UnauthorizedServiceException e) {
            if (metrics != null && settings.observability()) {
                metrics.incrementAuthDenial(e.getErrorType().name().toLowerCase(Locale.ROOT));
            }
            throw e;
        }
    }

    static String permissionFor(String method) {
        return switch (method) {
            case "POST", "PUT", "PATCH" -> "write";
            case "DELETE" -> "delete";
            default -> "read";
        };
    }

    private static Set<String> targetServices(GatewayRoute route) {
        Set<String> targets = new LinkedHashSet<>();
        if (route.aggregation() != null) {
            route.aggregation().targets().forEach(target -> targets.add(target.serviceName()));
        } else {
            targets.add(route.serviceName());
        }
        return targets;
    }

    /**
     * Calls the backend(s) of a route, then transforms and caches the answer.
     */
    public CompletableFuture<GatewayResponse> dispatch(GatewayRoute route, GatewayRequest request,
                                                       ServiceCertificate caller) {
        boolean authenticated = caller != null;
        CompletableFuture<GatewayResponse> call;
        if (route.aggregation() != null) {
            aggregatedRequests.incrementAndGet();
            call = aggregate(route, request, authenticated);
        } else {
            call = dispatcher.dispatch(route.serviceName(), route.resolveTargetPath(request.path()), request,
                    route.strategy(), route.timeoutMs(), authenticated);
        }

        return call.thenApply(response -> {
            GatewayResponse result = response;
            if (route.transformation() != null && !route.transformation().isEmpty() && response.isSuccess()) {
                result = response.withBody(transformer.transform(response.body(), route.transformation()));
                transformedResponses.incrementAndGet();
            }
            if (route.isCacheable() && result.isSuccess()) {
                cache.put(cacheKey(request, caller), route.getRouteKey(), result, Duration.ofSeconds(route.cacheTtlSeconds()));
            }
            return result;
        });
    }

    private CompletableFuture<GatewayResponse> aggregate(GatewayRoute route, GatewayRequest request,
                                                         boolean authenticated) {
        AggregationConfig aggregation = route.aggregation();
        Map<String, JsonNode> parts = new ConcurrentHashMap<>();

        CompletableFuture<Void> all;
        if (aggregation.mode() == AggregationConfig.Mode.PARALLEL) {
            all = CompletableFuture.allOf(aggregation.targets().stream()
                    .map(target -> callTarget(target, request, authenticated, parts))
                    .toArray(CompletableFuture[]::new));
        } else {
            all = CompletableFuture.completedFuture(null);
            for (AggregationConfig.Target target : aggregation.targets()) {
                all = all.thenCompose(ignored -> callTarget(target, request, authenticated, parts));
            }
        }

        return all.thenApply(ignored -> {
            ObjectNode merged = objectMapper.createObjectNode();
            merged.put("aggregated", true);
            merged.put("strategy", aggregation.mode().name().toLowerCase(Locale.ROOT));
            merged.put("timestamp", Instant.now().toString());
            for (AggregationConfig.Target target : aggregation.targets()) {
                merged.set(target.mapTo(), parts.get(target.mapTo()));
            }
            return GatewayResponse.of(request.requestId(), 200, Map.of("content-type", "application/json"),
                    merged.toString());
        });
    }

    private CompletableFuture<Void> callTarget(AggregationConfig.Target target, GatewayRequest request,
                                               boolean authenticated, Map<String, JsonNode> parts) {
        GatewayRequest targetRequest = GatewayRequest.builder()
                .requestId(request.requestId())
                .correlationId(request.correlationId())
                .method("GET")
                .path(target.path())
                .query(request.query())
                .headers(request.headers())
                .receivedAt(request.receivedAt())
                .build();

        return dispatcher.dispatch(target.serviceName(), target.path(), targetRequest, null, 0, authenticated)
                .handle((response, throwable) -> {
                    parts.put(target.mapTo(), throwable == null
                            ? partOf(target, response)
                            : errorNode(errorMapper.safeMessage(throwable)));
                    if (throwable != null) {
                        log.warn("Aggregation target failed: service={}, path={}, requestId={}, error={}",
                                target.serviceName(), target.path(), request.requestId(), throwable.toString());
                    }
                    return null;
                });
    }

    private JsonNode partOf(AggregationConfig.Target target, GatewayResponse response) {
        if (!response.isSuccess()) {
            return errorNode("Service '" + target.serviceName() + "' responded with status " + response.statusCode());
        }
        if (response.body() == null || response.body().isBlank()) {
            return objectMapper.nullNode();
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            return objectMapper.getNodeFactory().textNode(response.body());
        }
    }

    private JsonNode errorNode(String message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("error", message);
        return node;
    }

    /**
     * Final stage: maps a failure to its gateway response and records stats for the request.
     *
     * @param route null when the request never resolved to a route
     */
    public GatewayResponse complete(GatewayRoute route, GatewayRequest request, GatewayResponse response,
                                    Throwable failure) {
        GatewayResponse result = failure != null ? errorMapper.toResponse(request.requestId(), failure) : response;
        String routeKey = route != null ? route.getRouteKey() : "unmatched";
        String service = route == null ? "none" : route.aggregation() != null ? "aggregate" : route.serviceName();
        boolean success = failure == null && result.statusCode() < 500;

        totalRequests.incrementAndGet();
        (success ? successfulRequests : failedRequests).incrementAndGet();
        if (result.cacheHit()) {
            cachedResponses.incrementAndGet();
        }
        routeStats.computeIfAbsent(routeKey, k -> new Counters()).record(success);
        serviceStats.computeIfAbsent(service, k -> new Counters()).record(success);

        if (metrics != null && controlPlane.getConfig().observability()) {
            metrics.incrementGatewayRequest(routeKey, result.statusCode());
            metrics.recordRouteLatency(routeKey, Duration.between(request.receivedAt(), Instant.now()));
        }
        return result;
    }

    /**
     * Runs every stage for one request. The future never fails: errors become error responses.
     */
    public CompletableFuture<GatewayResponse> handle(GatewayRequest request) {
        GatewayRoute route = null;
        try {
            route = resolveRoute(request);
            ServiceCertificate caller = authorize(route, request);
            Optional<GatewayResponse> cached = lookupCache(route, request, caller);
            if (cached.isPresent()) {
                return CompletableFuture.completedFuture(complete(route, request, cached.get(), null));
            }
            GatewayRoute resolved = route;
            return dispatch(route, request, caller)
                    .handle((response, throwable) -> complete(resolved, request, response, throwable));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(complete(route, request, null, e));
        }
    }

    static String cacheKey(GatewayRequest request, ServiceCertificate caller) {
        return ResponseCache.key(GatewayRoute.key(request.method(), request.path()),
                callerIdOf(request, caller), request.query());
    }

    /**
     * Caller identity used to partition cached responses. A verified certificate always wins over
     * the self-declared caller header.
     */
    static String callerIdOf(GatewayRequest request, ServiceCertificate caller) {
        if (caller != null) {
            return "service:" + caller.serviceId();
        }
        String declared = request.header(CALLER_HEADER);
        return declared != null ? declared : request.certificate();
    }

    public GatewayStats getStats() {
        long total = totalRequests.get();
        return new GatewayStats(
                total,
                successfulRequests.get(),
                failedRequests.get(),
                cachedResponses.get(),
                aggregatedRequests.get(),
                transformedResponses.get(),
                total == 0 ? 0.0 : cachedResponses.get() * 100.0 / total,
                routes.size(),
                cache.size(),
                snapshot(routeStats),
                snapshot(serviceStats)
        );
    }

    private static Map<String, CounterSnapshot> snapshot(Map<String, Counters> counters) {
        Map<String, CounterSnapshot> copy = new TreeMap<>();
        counters.forEach((key, value) -> copy.put(key, new CounterSnapshot(value.requests.get(), value.failures.get())));
        return copy;
    }

    public void resetStats() {
        totalRequests.set(0);
        successfulRequests.set(0);
        failedRequests.set(0);
        cachedResponses.set(0);
        aggregatedRequests.set(0);
        transformedResponses.set(0);
        routeStats.clear();
        serviceStats.clear();
        cache.resetStats();
    }

    public void clearCache() {
        cache.clear();
        log.info("Gateway cache cleared");
    }

    private static final class Counters {
        private final AtomicLong requests = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();

        void record(boolean success) {
            requests.incrementAndGet();
            if (!success) {
                failures.incrementAndGet();
            }
        }
    }

    public record CounterSnapshot(long requests, long failures) {
    }

    public record GatewayStats(
            long totalRequests,
            long successfulRequests,
            long failedRequests,
            long cachedResponses,
            long aggregatedRequests,
            long transformedResponses,
            double cacheHitRate,
            int totalRoutes,
            long cacheSize,
            Map<String, CounterSnapshot> routeStats,
            Map<String, CounterSnapshot> serviceStats
    ) {
    }
}
