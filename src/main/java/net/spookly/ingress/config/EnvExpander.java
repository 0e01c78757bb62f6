package net.spookly.ingress.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

final class EnvExpander {
    private static final String ENV_PREFIX = "env:";

    private EnvExpander() {
    }

    static Object expand(Object value) {
        return expand(value, System::getenv);
    }

    static Object expand(Object value, Function<String, String> environment) {
        if (value instanceof Map) {
            Map<?, ?> raw = (Map<?, ?>) value;
            Map<Object, Object> expanded = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : raw.entrySet()) {
                expanded.put(entry.getKey(), expand(entry.getValue(), environment));
            }
            return expanded;
        }
        if (value instanceof List) {
            List<?> raw = (List<?>) value;
            List<Object> expanded = new ArrayList<>(raw.size());
            for (Object item : raw) {
                expanded.add(expand(item, environment));
            }
            return expanded;
        }
        if (value instanceof String) {
            String raw = (String) value;
            if (raw.startsWith(ENV_PREFIX)) {
                String key = raw.substring(ENV_PREFIX.length());
                String envValue = environment.apply(key);
                if (envValue == null) {
                    throw new ConfigException("Missing required environment variable: " + key);
                }
                return envValue;
            }
        }
        return value;
    }
}
