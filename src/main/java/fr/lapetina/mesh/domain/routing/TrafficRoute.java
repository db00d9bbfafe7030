package fr.lapetina.mesh.domain.routing;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Ordered rules deciding which version of a service receives a request.
 * Evaluation is first-match-wins. Instances are immutable; updates produce a new route.
 */
public record TrafficRoute(
        String id,
        String name,
        String serviceName,
        boolean enabled,
        List<TrafficRule> rules,
        Instant createdAt,
        Instant updatedAt
) {

    public TrafficRoute {
        rules = List.copyOf(rules);
    }

    /**
     * Version chosen by the first matching rule.
     */
    public Optional<String> evaluate(RoutingContext context) {
        for (TrafficRule rule : rules) {
            Optional<String> version = rule.evaluate(context, id);
            if (version.isPresent()) {
                return version;
            }
        }
        return Optional.empty();
    }

    TrafficRoute update(String newName, List<TrafficRule> newRules, Boolean newEnabled) {
        return new TrafficRoute(
                id,
                newName != null ? newName : name,
                serviceName,
                newEnabled != null ? newEnabled : enabled,
                newRules != null ? newRules : rules,
                createdAt,
                Instant.now()
        );
    }
}
