package fr.lapetina.mesh.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.mesh.domain.event.EventState;
import fr.lapetina.mesh.domain.event.GatewayRequestEvent;
import fr.lapetina.mesh.domain.model.GatewayRequest;
import fr.lapetina.mesh.domain.model.GatewayResponse;
import fr.lapetina.mesh.gateway.ApiGateway;
import fr.lapetina.mesh.gateway.GatewayRoute;
import fr.lapetina.mesh.infrastructure.auth.ServiceCertificate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Third stage handler: hands authorized requests to the gateway dispatcher.
 *
 * IMPORTANT: the backend call completes after this handler returns, when the
 * event may already have been cleared and reused. Everything the callback
 * needs is copied into locals before dispatching.
 */
public final class DispatchHandler implements EventHandler<GatewayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final ApiGateway gateway;

    public DispatchHandler(ApiGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public void onEvent(GatewayRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.AUTHORIZED) {
            return;
        }

        GatewayRoute route = event.getRoute();
        GatewayRequest request = event.getRequest();
        ServiceCertificate caller = event.getCaller();
        CompletableFuture<GatewayResponse> responseFuture = event.getResponseFuture();

        CompletableFuture<GatewayResponse> call;
        try {
            call = gateway.dispatch(route, request, caller);
        } catch (RuntimeException e) {
            event.markFailed(e);
            return;
        }
        event.markDispatched();

        log.debug("Request dispatched: requestId={}, route={}, service={}",
                request.requestId(), route.getRouteKey(), route.serviceName());

        call.whenComplete((response, throwable) ->
                responseFuture.complete(gateway.complete(route, request, response, throwable)));
    }
}
