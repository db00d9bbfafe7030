package fr.lapetina.mesh.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.mesh.domain.event.GatewayRequestEvent;
import fr.lapetina.mesh.domain.model.GatewayResponse;
import fr.lapetina.mesh.gateway.ApiGateway;
import fr.lapetina.mesh.infrastructure.auth.ServiceCertificate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Second stage handler: enforces service certificates and ACLs on routes that require them,
 * then serves cache hits. The cache is only consulted for callers that passed this check.
 */
public final class AuthorizationHandler implements EventHandler<GatewayRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationHandler.class);

    private final ApiGateway gateway;

    public AuthorizationHandler(ApiGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public void onEvent(GatewayRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            return;
        }

        try {
            ServiceCertificate caller = gateway.authorize(event.getRoute(), event.getRequest());
            event.markAuthorized(caller);
            if (caller != null) {
                log.debug("Caller authorized: requestId={}, caller={}, route={}",
                        event.getRequest().requestId(), caller.serviceName(), event.getRoute().getRouteKey());
            }

            Optional<GatewayResponse> cached = gateway.lookupCache(event.getRoute(), event.getRequest(), caller);
            cached.ifPresent(event::markCacheHit);
        } catch (RuntimeException e) {
            event.markFailed(e);
        }
    }
}
