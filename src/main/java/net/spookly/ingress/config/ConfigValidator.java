package net.spookly.ingress.config;

import java.util.ArrayList;
import java.util.List;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(IngressConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateHosts(config, errors);

        throwIfErrors(errors);
    }

    private static void validateHosts(IngressConfig config, List<String> errors) {
        IngressConfig.HostsConfig hosts = config.hosts;
        if (hosts == null || hosts.defaultHostname == null) {
            return;
        }
        if (isBlank(hosts.defaultHostname)) {
            errors.add("hosts.defaultHostname must not be blank");
        } else if (!hosts.defaultHostname.equals(hosts.defaultHostname.trim())) {
            errors.add("hosts.defaultHostname must not have leading or trailing whitespace");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
