package fr.lapetina.mesh.domain.model;

import java.time.Duration;
import java.util.Map;

/**
 * Response returned by the gateway, either relayed from a backend or produced locally on error.
 * Immutable and thread-safe.
 */
public record GatewayResponse(
        String requestId,
        int statusCode,
        Map<String, String> headers,
        String body,
        String instanceId,
        String serviceVersion,
        boolean cacheHit,
        Duration latency,
        ErrorType errorType,
        String errorMessage
) {
    public GatewayResponse {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public boolean isSuccess() {
        return errorType == null && statusCode >= 200 && statusCode < 300;
    }

    public boolean isError() {
        return errorType != null;
    }

    public static GatewayResponse of(String requestId, int statusCode, Map<String, String> headers, String body) {
        return new GatewayResponse(requestId, statusCode, headers, body, null, null, false, null, null, null);
    }

    public static GatewayResponse error(String requestId, ErrorType errorType, int statusCode, String message,
                                        Map<String, String> headers) {
        return new GatewayResponse(requestId, statusCode, headers, null, null, null, false, null, errorType, message);
    }

    public GatewayResponse servedBy(ServiceInstance instance, Duration latency) {
        return new GatewayResponse(requestId, statusCode, headers, body, instance.getId(), instance.getVersion(),
                cacheHit, latency, errorType, errorMessage);
    }

    public GatewayResponse withBody(String newBody) {
        return new GatewayResponse(requestId, statusCode, headers, newBody, instanceId, serviceVersion,
                cacheHit, latency, errorType, errorMessage);
    }

    /**
     * Copy served from the response cache for another request.
     */
    public GatewayResponse asCacheHit(String forRequestId) {
        return new GatewayResponse(forRequestId, statusCode, headers, body, instanceId, serviceVersion,
                true, Duration.ZERO, errorType, errorMessage);
    }
}
