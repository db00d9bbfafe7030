package fr.lapetina.mesh.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.mesh.domain.event.EventState;
import fr.lapetina.mesh.domain.event.GatewayRequestEvent;
import fr.lapetina.mesh.domain.model.GatewayResponse;
import fr.lapetina.mesh.gateway.ApiGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Final stage handler: answers requests that never reached a backend and clears the event.
 *
 * Cache hits and early failures are completed here. Dispatched requests are
 * completed by the dispatcher callback instead.
 */
public final class CompletionHandler implements EventHandler<GatewayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    private final ApiGateway gateway;

    public CompletionHandler(ApiGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public void onEvent(GatewayRequestEvent event, long sequence, boolean endOfBatch) {
        setupMDC(event);
        try {
            completeLocally(event);
        } finally {
            clearMDC();
            event.clear();
        }
    }

    private void completeLocally(GatewayRequestEvent event) {
        CompletableFuture<GatewayResponse> future = event.getResponseFuture();
        if (future == null || future.isDone() || event.getState() == EventState.DISPATCHED) {
            return;
        }

        GatewayResponse response;
        if (event.getState() == EventState.CACHE_HIT) {
            response = gateway.complete(event.getRoute(), event.getRequest(), event.getCachedResponse(), null);
        } else {
            Throwable failure = event.getFailure() != null
                    ? event.getFailure()
                    : new IllegalStateException("Request left the pipeline in state " + event.getState());
            response = gateway.complete(event.getRoute(), event.getRequest(), null, failure);
        }

        log.debug("Request completed in pipeline: requestId={}, state={}, status={}, latencyMs={}",
                event.getRequest().requestId(), event.getState(), response.statusCode(),
                Duration.between(event.getAcceptedAt(), Instant.now()).toMillis());
        future.complete(response);
    }

    private void setupMDC(GatewayRequestEvent event) {
        if (event.getRequest() != null) {
            MDC.put("requestId", event.getRequest().requestId());
            MDC.put("correlationId", event.getRequest().correlationId());
        }
        if (event.getRoute() != null) {
            MDC.put("route", event.getRoute().getRouteKey());
        }
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("correlationId");
        MDC.remove("route");
    }
}
