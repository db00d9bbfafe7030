package fr.lapetina.mesh.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.mesh.domain.exception.ValidationException;
import fr.lapetina.mesh.domain.routing.MatchOperator;
import fr.lapetina.mesh.domain.routing.RuleKind;
import fr.lapetina.mesh.domain.routing.TrafficRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Body of {@code POST /mesh/routes} and {@code PUT /mesh/routes/:routeId}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrafficRouteRequest {

    private String name;
    private String serviceName;
    private Boolean enabled;
    private List<Rule> rules;

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getServiceName() { return serviceName; }
    public void setServiceName(String serviceName) { this.serviceName = serviceName; }

    public Boolean getEnabled() { return enabled; }
    public void setEnabled(Boolean enabled) { this.enabled = enabled; }

    public List<Rule> getRules() { return rules; }
    public void setRules(List<Rule> rules) { this.rules = rules; }

    /**
     * @return the converted rules, or null when the request carries none
     */
    public List<TrafficRule> toRules() {
        if (rules == null) {
            return null;
        }
        List<TrafficRule> converted = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            if (rule == null) {
                throw new ValidationException("rules must not contain null entries");
            }
            converted.add(rule.toRule());
        }
        return converted;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Rule {
        private String type;
        private String header;
        private String operator;
        private String value;
        private Integer percent;
        private String version;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getHeader() { return header; }
        public void setHeader(String header) { this.header = header; }

        public String getOperator() { return operator; }
        public void setOperator(String operator) { this.operator = operator; }

        public String getValue() { return value; }
        public void setValue(String value) { this.value = value; }

        public Integer getPercent() { return percent; }
        public void setPercent(Integer percent) { this.percent = percent; }

        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }

        TrafficRule toRule() {
            RuleKind kind = parse(RuleKind.class, type, "type");
            switch (kind) {
                case HEADER_MATCH:
                    MatchOperator op = operator == null ? MatchOperator.EQUALS : parse(MatchOperator.class, operator, "operator");
                    return TrafficRule.headerMatch(header, op, value, version);
                case PERCENTAGE_BUCKET:
                    return TrafficRule.percentageBucket(ValidationException.requireNonNull(percent, "percent"), version);
                default:
                    return TrafficRule.defaultTo(version);
            }
        }

        private static <E extends Enum<E>> E parse(Class<E> type, String raw, String field) {
            ValidationException.requireText(raw, field);
            try {
                return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("unknown " + field + ": " + raw);
            }
        }
    }
}
