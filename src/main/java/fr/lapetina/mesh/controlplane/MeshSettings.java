package fr.lapetina.mesh.controlplane;

/**
 * Subsystem-wide feature switches of the mesh. Immutable; see {@link #apply(Update)}.
 *
 * @param enabled          master switch; when off the gateway calls the backend directly,
 *                         without routing, breaker or retries
 * @param serviceDiscovery when off, runtime registration and deregistration are refused
 * @param retryPolicy      when off, every call gets a single attempt
 * @param trafficRouting   when off, canaries and traffic routes are ignored
 * @param serviceAuth      when off, certificates and ACLs are not enforced
 * @param healthChecking   runs the periodic instance probes
 * @param observability    records gateway metrics
 */
public record MeshSettings(
        boolean enabled,
        boolean serviceDiscovery,
        boolean retryPolicy,
        boolean trafficRouting,
        boolean serviceAuth,
        boolean healthChecking,
        boolean observability
) {

    public static MeshSettings defaults() {
        return new MeshSettings(true, true, true, true, true, true, true);
    }

    /**
     * Returns a copy with every non-null field of {@code update} applied.
     */
    public MeshSettings apply(Update update) {
        return new MeshSettings(
                pick(update.enabled(), enabled),
                pick(update.serviceDiscovery(), serviceDiscovery),
                pick(update.retryPolicy(), retryPolicy),
                pick(update.trafficRouting(), trafficRouting),
                pick(update.serviceAuth(), serviceAuth),
                pick(update.healthChecking(), healthChecking),
                pick(update.observability(), observability)
        );
    }

    private static boolean pick(Boolean value, boolean current) {
        return value != null ? value : current;
    }

    /**
     * Partial settings; null fields are left unchanged.
     */
    public record Update(
            Boolean enabled,
            Boolean serviceDiscovery,
            Boolean retryPolicy,
            Boolean trafficRouting,
            Boolean serviceAuth,
            Boolean healthChecking,
            Boolean observability
    ) {
        public static Update of(MeshSettings settings) {
            return new Update(settings.enabled(), settings.serviceDiscovery(), settings.retryPolicy(),
                    settings.trafficRouting(), settings.serviceAuth(), settings.healthChecking(),
                    settings.observability());
        }
    }
}
