package net.spookly.ingress.config;

/**
 * Default configuration written when no config file exists.
 */
public final class ConfigDefaults {
    private static final String DEFAULT_YAML = """
            # Generated default ingress-hosts config.
            hosts:
              defaultHostname: "<default>"

            observability:
              logging:
                auditChanges: false
            """;

    private ConfigDefaults() {
    }

    public static String defaultYaml() {
        return DEFAULT_YAML;
    }
}
