package fr.lapetina.mesh.domain.routing;

/**
 * Outcome of routing one request.
 *
 * @param version  target version, or null when no canary or rule applies
 * @param source   {@code canary}, {@code rule} or {@code none}
 * @param sourceId id of the deciding canary or route
 */
public record RoutingDecision(String version, String source, String sourceId) {

    static final String CANARY = "canary";
    static final String RULE = "rule";
    static final String NONE = "none";

    public static RoutingDecision unrouted() {
        return new RoutingDecision(null, NONE, null);
    }

    public boolean isRouted() {
        return version != null;
    }

    public boolean isCanary() {
        return CANARY.equals(source);
    }
}
