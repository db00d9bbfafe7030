package fr.lapetina.mesh.domain.routing;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Comparison used by header-match rules.
 */
public enum MatchOperator {
    EQUALS,
    CONTAINS,
    REGEX,
    /** Expected value is a comma-separated list */
    IN;

    boolean matches(String actual, String expected, Pattern compiled) {
        if (actual == null) {
            return false;
        }
        return switch (this) {
            case EQUALS -> actual.equals(expected);
            case CONTAINS -> actual.contains(expected);
            case REGEX -> compiled.matcher(actual).matches();
            case IN -> Arrays.stream(expected.split(","))
                    .map(String::trim)
                    .anyMatch(actual::equals);
        };
    }
}
