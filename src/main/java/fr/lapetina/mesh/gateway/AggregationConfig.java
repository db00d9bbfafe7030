package fr.lapetina.mesh.gateway;

import fr.lapetina.mesh.domain.exception.ValidationException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fan-out of one gateway request to several services, merged into one JSON object
 * holding each service's answer under its {@code mapTo} key.
 */
public record AggregationConfig(Mode mode, List<Target> targets) {

    public enum Mode {
        PARALLEL,
        SEQUENTIAL
    }

    public AggregationConfig {
        if (mode == null) {
            mode = Mode.PARALLEL;
        }
        if (targets == null || targets.isEmpty()) {
            throw new ValidationException("aggregation.targets must not be empty");
        }
        Set<String> keys = new HashSet<>();
        for (Target target : targets) {
            if (!keys.add(target.mapTo())) {
                throw new ValidationException("duplicate aggregation mapTo: " + target.mapTo());
            }
        }
        targets = List.copyOf(targets);
    }

    /**
     * @param serviceName backend service
     * @param path        path called on that service
     * @param mapTo       key of the answer in the merged object
     */
    public record Target(String serviceName, String path, String mapTo) {
        public Target {
            ValidationException.requireText(serviceName, "aggregation.serviceName");
            ValidationException.requireText(path, "aggregation.path");
            if (mapTo == null || mapTo.isBlank()) {
                mapTo = serviceName;
            }
        }
    }
}
