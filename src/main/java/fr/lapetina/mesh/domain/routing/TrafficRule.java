package fr.lapetina.mesh.domain.routing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.mesh.domain.exception.ValidationException;

import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One match condition of a traffic route and the version it sends matching traffic to.
 * Build with {@link #headerMatch}, {@link #percentageBucket} or {@link #defaultTo}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TrafficRule {

    private final RuleKind kind;
    private final String header;
    private final MatchOperator operator;
    private final String value;
    private final Integer percent;
    private final String version;
    private final Pattern pattern;

    private TrafficRule(RuleKind kind, String header, MatchOperator operator, String value,
                        Integer percent, String version) {
        this.kind = ValidationException.requireNonNull(kind, "rule kind");
        this.version = ValidationException.requireText(version, "rule version");
        this.header = header;
        this.operator = operator;
        this.value = value;
        this.percent = percent;
        this.pattern = operator == MatchOperator.REGEX ? compile(value) : null;
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ValidationException("invalid rule regex: " + e.getDescription());
        }
    }

    public static TrafficRule headerMatch(String header, MatchOperator operator, String value, String version) {
        ValidationException.requireText(header, "rule header");
        ValidationException.requireNonNull(operator, "rule operator");
        ValidationException.requireNonNull(value, "rule value");
        return new TrafficRule(RuleKind.HEADER_MATCH, header, operator, value, null, version);
    }

    public static TrafficRule percentageBucket(int percent, String version) {
        if (percent < 0 || percent > 100) {
            throw new ValidationException("rule percent must be between 0 and 100");
        }
        return new TrafficRule(RuleKind.PERCENTAGE_BUCKET, null, null, null, percent, version);
    }

    public static TrafficRule defaultTo(String version) {
        return new TrafficRule(RuleKind.DEFAULT, null, null, null, null, version);
    }

    /**
     * Returns the target version when the rule matches.
     *
     * @param salt Keeps percentage buckets of different routes independent
     */
    public Optional<String> evaluate(RoutingContext context, String salt) {
        boolean matched = switch (kind) {
            case HEADER_MATCH -> operator.matches(context.header(header), value, pattern);
            case PERCENTAGE_BUCKET -> context.routingKey() != null
                    && StableHash.bucket(salt, context.routingKey()) < percent;
            case DEFAULT -> true;
        };
        return matched ? Optional.of(version) : Optional.empty();
    }

    public RuleKind getKind() {
        return kind;
    }

    public String getHeader() {
        return header;
    }

    public MatchOperator getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    public Integer getPercent() {
        return percent;
    }

    public String getVersion() {
        return version;
    }

    @JsonIgnore
    public boolean isCatchAll() {
        return kind == RuleKind.DEFAULT;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case HEADER_MATCH -> "header(" + header + " " + operator + " " + value + ") -> " + version;
            case PERCENTAGE_BUCKET -> "bucket(" + percent + "%) -> " + version;
            case DEFAULT -> "default -> " + version;
        };
    }
}
