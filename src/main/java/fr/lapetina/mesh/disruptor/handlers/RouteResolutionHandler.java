package fr.lapetina.mesh.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.mesh.domain.event.GatewayRequestEvent;
import fr.lapetina.mesh.domain.model.GatewayRequest;
import fr.lapetina.mesh.gateway.ApiGateway;
import fr.lapetina.mesh.gateway.GatewayRoute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage handler: resolves the gateway route.
 */
public final class RouteResolutionHandler implements EventHandler<GatewayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(RouteResolutionHandler.class);

    private final ApiGateway gateway;

    public RouteResolutionHandler(ApiGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public void onEvent(GatewayRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            return;
        }
        event.setSequence(sequence);
        GatewayRequest request = event.getRequest();

        try {
            GatewayRoute route = gateway.resolveRoute(request);
            event.markRouteResolved(route);
            log.debug("Route resolved: requestId={}, route={}, sequence={}",
                    request.requestId(), route.getRouteKey(), sequence);
        } catch (RuntimeException e) {
            event.markFailed(e);
            log.debug("Route resolution failed: requestId={}, method={}, path={}, error={}",
                    request.requestId(), request.method(), request.path(), e.getMessage());
        }
    }
}
