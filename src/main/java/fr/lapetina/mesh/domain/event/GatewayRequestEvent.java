package fr.lapetina.mesh.domain.event;

import fr.lapetina.mesh.domain.model.GatewayRequest;
import fr.lapetina.mesh.domain.model.GatewayResponse;
import fr.lapetina.mesh.gateway.GatewayRoute;
import fr.lapetina.mesh.infrastructure.auth.ServiceCertificate;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * Each handler stage updates the event as it progresses through the pipeline.
 *
 * IMPORTANT: the event is cleared and reused once the last handler has seen it.
 * Asynchronous callbacks must capture what they need beforehand and never
 * read the event afterwards.
 */
public final class GatewayRequestEvent {

    private GatewayRequest request;
    private CompletableFuture<GatewayResponse> responseFuture;

    private EventState state;
    private GatewayRoute route;
    private ServiceCertificate caller;
    private GatewayResponse cachedResponse;
    private Throwable failure;

    private Instant acceptedAt;
    private Instant routeResolvedAt;
    private Instant dispatchedAt;

    private long sequence;

    /**
     * Clears the event for reuse.
     * Called by the EventFactory and at the end of processing.
     */
    public void clear() {
        this.request = null;
        this.responseFuture = null;
        this.state = null;
        this.route = null;
        this.caller = null;
        this.cachedResponse = null;
        this.failure = null;
        this.acceptedAt = null;
        this.routeResolvedAt = null;
        this.dispatchedAt = null;
        this.sequence = -1;
    }

    public void initialize(GatewayRequest request, CompletableFuture<GatewayResponse> responseFuture) {
        clear();
        this.request = request;
        this.responseFuture = responseFuture;
        this.state = EventState.CREATED;
        this.acceptedAt = Instant.now();
    }

    public GatewayRequest getRequest() {
        return request;
    }

    public CompletableFuture<GatewayResponse> getResponseFuture() {
        return responseFuture;
    }

    public EventState getState() {
        return state;
    }

    public GatewayRoute getRoute() {
        return route;
    }

    public ServiceCertificate getCaller() {
        return caller;
    }

    public GatewayResponse getCachedResponse() {
        return cachedResponse;
    }

    public Throwable getFailure() {
        return failure;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getRouteResolvedAt() {
        return routeResolvedAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void markRouteResolved(GatewayRoute route) {
        this.route = route;
        this.state = EventState.ROUTE_RESOLVED;
        this.routeResolvedAt = Instant.now();
    }

    public void markCacheHit(GatewayResponse response) {
        this.cachedResponse = response;
        this.state = EventState.CACHE_HIT;
    }

    public void markAuthorized(ServiceCertificate caller) {
        this.caller = caller;
        this.state = EventState.AUTHORIZED;
    }

    public void markDispatched() {
        this.state = EventState.DISPATCHED;
        this.dispatchedAt = Instant.now();
    }

    public void markFailed(Throwable failure) {
        this.failure = failure;
        this.state = EventState.FAILED;
    }

    /**
     * Checks if later stages should leave the event alone.
     */
    public boolean shouldSkip() {
        return state == EventState.CACHE_HIT
                || state == EventState.FAILED
                || state == EventState.DISPATCHED;
    }

    @Override
    public String toString() {
        return "GatewayRequestEvent{" +
                "requestId=" + (request != null ? request.requestId() : "null") +
                ", state=" + state +
                ", route=" + (route != null ? route.getRouteKey() : "null") +
                ", seq=" + sequence +
                '}';
    }
}
