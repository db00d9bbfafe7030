package fr.lapetina.mesh.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates GatewayRequestEvent instances for the ring buffer.
 * Events are reused by clearing and re-initializing them.
 */
public final class GatewayRequestEventFactory implements EventFactory<GatewayRequestEvent> {

    @Override
    public GatewayRequestEvent newInstance() {
        return new GatewayRequestEvent();
    }
}
