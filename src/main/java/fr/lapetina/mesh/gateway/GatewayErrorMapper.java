package fr.lapetina.mesh.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.mesh.domain.exception.CircuitOpenException;
import fr.lapetina.mesh.domain.exception.GatewayTimeoutException;
import fr.lapetina.mesh.domain.exception.MeshException;
import fr.lapetina.mesh.domain.model.ErrorType;
import fr.lapetina.mesh.domain.model.GatewayResponse;
import fr.lapetina.mesh.infrastructure.resilience.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Translates failures into gateway responses.
 *
 * Mesh errors keep their own status and message. Anything else becomes a
 * generic 502; its details stay in the server log.
 */
public final class GatewayErrorMapper {

    private static final Logger log = LoggerFactory.getLogger(GatewayErrorMapper.class);

    static final String GENERIC_MESSAGE = "Upstream call failed";

    private final ObjectMapper objectMapper;

    public GatewayErrorMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public GatewayResponse toResponse(String requestId, Throwable throwable) {
        Throwable failure = FailureClassifier.unwrap(throwable);
        if (!(failure instanceof MeshException) && FailureClassifier.isTimeout(failure)) {
            failure = new GatewayTimeoutException("Upstream call timed out");
        }

        if (failure instanceof MeshException) {
            MeshException meshException = (MeshException) failure;
            Map<String, String> headers = Map.of("content-type", "application/json");
            if (meshException instanceof CircuitOpenException) {
                headers = Map.of(
                        "content-type", "application/json",
                        "retry-after", Long.toString(((CircuitOpenException) meshException).getRetryAfterSeconds()));
            }
            if (meshException.getCause() != null) {
                log.warn("Request failed: requestId={}, errorType={}, message={}, cause={}",
                        requestId, meshException.getErrorType(), meshException.getMessage(),
                        meshException.getCause().toString());
            } else {
                log.warn("Request failed: requestId={}, errorType={}, message={}",
                        requestId, meshException.getErrorType(), meshException.getMessage());
            }
            return GatewayResponse.error(requestId, meshException.getErrorType(), meshException.getHttpStatus(),
                    meshException.getMessage(), headers)
                    .withBody(errorBody(meshException.getErrorType(), meshException.getMessage()));
        }

        log.error("Unexpected gateway failure: requestId={}", requestId, failure);
        return GatewayResponse.error(requestId, ErrorType.BAD_GATEWAY, ErrorType.BAD_GATEWAY.getHttpStatus(),
                        GENERIC_MESSAGE, Map.of("content-type", "application/json"))
                .withBody(errorBody(ErrorType.BAD_GATEWAY, GENERIC_MESSAGE));
    }

    /**
     * Message safe to show a caller for a failure, as used in aggregated responses.
     */
    public String safeMessage(Throwable throwable) {
        Throwable failure = FailureClassifier.unwrap(throwable);
        return failure instanceof MeshException ? failure.getMessage() : GENERIC_MESSAGE;
    }

    String errorBody(ErrorType errorType, String message) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("success", false);
        body.put("error", errorType.name());
        body.put("message", message);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize error body", e);
        }
    }
}
