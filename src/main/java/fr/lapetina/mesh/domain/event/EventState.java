package fr.lapetina.mesh.domain.event;

/**
 * Lifecycle state of a gateway request event in the Disruptor pipeline.
 */
public enum EventState {
    /** Event just published, awaiting route resolution */
    CREATED,

    /** Request matched a gateway route */
    ROUTE_RESOLVED,

    /** Served from the response cache, no backend call needed */
    CACHE_HIT,

    /** Caller passed service auth, or the route does not require it */
    AUTHORIZED,

    /** Handed to the dispatcher; the response arrives asynchronously */
    DISPATCHED,

    /** Failed before dispatch (unknown route, auth refusal, internal error) */
    FAILED
}
