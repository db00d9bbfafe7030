package fr.lapetina.mesh.infrastructure.config;

/**
 * Notified after every successful (re)load of the mesh configuration.
 * Exceptions thrown by a listener are logged by the loader and do not reach other listeners.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * @param oldConfig previous configuration, null on the initial load
     * @param newConfig configuration now in effect
     */
    void onConfigChanged(MeshGatewayConfig oldConfig, MeshGatewayConfig newConfig);
}
