package net.spookly.ingress.hosts;

/**
 * How a request path is matched against a routing rule.
 */
public enum MatchType {
    BEGIN("begin"),
    EXACT("exact"),
    PREFIX("prefix"),
    REGEX("regex");

    private final String configValue;

    MatchType(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    public static MatchType fromConfig(String value) {
        if (value == null) {
            return BEGIN;
        }
        for (MatchType match : values()) {
            if (match.configValue.equalsIgnoreCase(value)) {
                return match;
            }
        }
        return BEGIN;
    }
}
