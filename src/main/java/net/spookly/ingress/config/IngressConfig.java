package net.spookly.ingress.config;

public class IngressConfig {
    public HostsConfig hosts;
    public ObservabilityConfig observability;

    public static class HostsConfig {
        /**
         * Hostname of the catch-all host, excluded from sorted host listings.
         */
        public String defaultHostname;
    }

    public static class ObservabilityConfig {
        public LoggingConfig logging;
    }

    public static class LoggingConfig {
        public Boolean auditChanges;
    }
}
