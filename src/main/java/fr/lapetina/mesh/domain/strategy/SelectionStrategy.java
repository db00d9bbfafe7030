package fr.lapetina.mesh.domain.strategy;

import java.util.Locale;
import java.util.Optional;

/**
 * Instance selection strategies understood by the registry.
 */
public enum SelectionStrategy {
    ROUND_ROBIN("round-robin"),
    WEIGHTED("weighted"),
    LEAST_CONNECTIONS("least-connections"),
    RANDOM("random");

    private final String configName;

    SelectionStrategy(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Accepts both the enum constant ({@code LEAST_CONNECTIONS}) and the
     * configuration spelling ({@code least-connections}).
     */
    public static Optional<SelectionStrategy> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (SelectionStrategy strategy : values()) {
            if (strategy.name().equals(normalized)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }
}
