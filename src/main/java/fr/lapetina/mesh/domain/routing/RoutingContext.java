package fr.lapetina.mesh.domain.routing;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * What the router knows about one request.
 *
 * @param routingKey caller-chosen affinity key, typically the user id; may be null
 * @param headers    request headers, names lower-cased
 */
public record RoutingContext(String routingKey, Map<String, String> headers) {

    public RoutingContext {
        Map<String, String> normalized = new HashMap<>();
        if (headers != null) {
            headers.forEach((name, value) -> normalized.put(name.toLowerCase(Locale.ROOT), value));
        }
        headers = Map.copyOf(normalized);
    }

    public static RoutingContext of(String routingKey) {
        return new RoutingContext(routingKey, Map.of());
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }
}
