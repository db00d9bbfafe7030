package fr.lapetina.mesh.gateway;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.mesh.domain.exception.ValidationException;
import fr.lapetina.mesh.domain.strategy.SelectionStrategy;

import java.util.Locale;
import java.util.Set;

/**
 * Binding of an inbound (method, path) to a backend service.
 *
 * <p>A path ending in {@code /**} matches every path below it; the remainder
 * is appended to {@code targetPath}. Immutable: re-registering the same
 * method and path replaces the route.
 *
 * @param cacheTtlSeconds 0 disables caching
 * @param timeoutMs       per-attempt deadline, 0 for the gateway default
 * @param strategy        instance selection, null for the registry default
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GatewayRoute(
        String path,
        String method,
        String serviceName,
        String targetPath,
        int cacheTtlSeconds,
        long timeoutMs,
        boolean requiresAuth,
        SelectionStrategy strategy,
        AggregationConfig aggregation,
        TransformationConfig transformation
) {
    private static final String WILDCARD = "/**";
    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD", "OPTIONS");

    public GatewayRoute {
        ValidationException.requireText(path, "path");
        if (!path.startsWith("/")) {
            throw new ValidationException("path must start with '/'");
        }
        method = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        if (!METHODS.contains(method)) {
            throw new ValidationException("unsupported method: " + method);
        }
        if (aggregation == null) {
            ValidationException.requireText(serviceName, "serviceName");
        }
        if (cacheTtlSeconds < 0 || timeoutMs < 0) {
            throw new ValidationException("cacheTtlSeconds and timeoutMs must not be negative");
        }
        if (targetPath == null || targetPath.isBlank()) {
            targetPath = isWildcard(path) ? path.substring(0, path.length() - WILDCARD.length()) : path;
        }
    }

    private static boolean isWildcard(String path) {
        return path.endsWith(WILDCARD);
    }

    @JsonIgnore
    public String getRouteKey() {
        return key(method, path);
    }

    public static String key(String method, String path) {
        return method.toUpperCase(Locale.ROOT) + ":" + path;
    }

    @JsonIgnore
    public boolean isWildcard() {
        return isWildcard(path);
    }

    @JsonIgnore
    public boolean isCacheable() {
        return cacheTtlSeconds > 0 && "GET".equals(method);
    }

    /**
     * Length of the literal prefix, used to prefer the most specific wildcard.
     */
    @JsonIgnore
    int specificity() {
        return isWildcard() ? path.length() - WILDCARD.length() : Integer.MAX_VALUE;
    }

    /**
     * @return true if this route serves {@code requestPath}
     */
    public boolean matches(String requestPath) {
        if (!isWildcard()) {
            return path.equals(requestPath);
        }
        String prefix = path.substring(0, path.length() - WILDCARD.length());
        return requestPath.equals(prefix) || requestPath.startsWith(prefix + "/");
    }

    /**
     * Backend path for a request path this route matches.
     */
    public String resolveTargetPath(String requestPath) {
        if (!isWildcard()) {
            return targetPath;
        }
        String prefix = path.substring(0, path.length() - WILDCARD.length());
        String remainder = requestPath.substring(prefix.length());
        String base = targetPath.endsWith("/") ? targetPath.substring(0, targetPath.length() - 1) : targetPath;
        String resolved = base + remainder;
        return resolved.isEmpty() ? "/" : resolved;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String path;
        private String method = "GET";
        private String serviceName;
        private String targetPath;
        private int cacheTtlSeconds;
        private long timeoutMs;
        private boolean requiresAuth;
        private SelectionStrategy strategy;
        private AggregationConfig aggregation;
        private TransformationConfig transformation;

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder targetPath(String targetPath) {
            this.targetPath = targetPath;
            return this;
        }

        public Builder cacheTtlSeconds(int cacheTtlSeconds) {
            this.cacheTtlSeconds = cacheTtlSeconds;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder requiresAuth(boolean requiresAuth) {
            this.requiresAuth = requiresAuth;
            return this;
        }

        public Builder strategy(SelectionStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder aggregation(AggregationConfig aggregation) {
            this.aggregation = aggregation;
            return this;
        }

        public Builder transformation(TransformationConfig transformation) {
            this.transformation = transformation;
            return this;
        }

        public GatewayRoute build() {
            return new GatewayRoute(path, method, serviceName, targetPath, cacheTtlSeconds, timeoutMs,
                    requiresAuth, strategy, aggregation, transformation);
        }
    }
}
