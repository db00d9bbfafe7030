package fr.lapetina.mesh.domain.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A request received by the gateway, to be routed to a backend service.
 * Immutable and thread-safe. Header names are stored lower-cased.
 */
public record GatewayRequest(
        String requestId,
        String correlationId,
        String method,
        String path,
        String query,
        Map<String, String> headers,
        String body,
        Instant receivedAt
) {
    public static final String CERTIFICATE_HEADER = "x-service-certificate";
    public static final String ROUTING_KEY_HEADER = "x-routing-key";
    public static final String CORRELATION_HEADER = "x-correlation-id";

    public GatewayRequest {
        Objects.requireNonNull(method, "Method is required");
        Objects.requireNonNull(path, "Path is required");
        method = method.toUpperCase(Locale.ROOT);
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (correlationId == null) {
            correlationId = requestId;
        }
        if (receivedAt == null) {
            receivedAt = Instant.now();
        }
        headers = headers == null ? Map.of() : headers.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(
                        e -> e.getKey().toLowerCase(Locale.ROOT),
                        Map.Entry::getValue,
                        (first, second) -> first));
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public String certificate() {
        return header(CERTIFICATE_HEADER);
    }

    /**
     * Key used for sticky version routing, falling back to the caller's certificate.
     */
    public String routingKey() {
        String key = header(ROUTING_KEY_HEADER);
        return key != null ? key : certificate();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String correlationId;
        private String method = "GET";
        private String path;
        private String query;
        private Map<String, String> headers;
        private String body;
        private Instant receivedAt;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public GatewayRequest build() {
            return new GatewayRequest(requestId, correlationId, method, path, query, headers, body, receivedAt);
        }
    }
}
