package net.spookly.ingress.hosts;

/**
 * Default host audit logger that emits one line per event.
 */
public final class HostAuditLogger implements HostChangeListener {
    public static final HostAuditLogger INSTANCE = new HostAuditLogger();

    private HostAuditLogger() {
    }

    @Override
    public void onEvent(HostChangeEvent event) {
        System.out.println(format(event));
    }

    static String format(HostChangeEvent event) {
        StringBuilder builder = new StringBuilder("host_event");
        append(builder, "type", event.type());
        append(builder, "hostname", event.hostname());
        append(builder, "paths", event.paths());
        append(builder, "sslPassthrough", event.sslPassthrough());
        append(builder, "added", event.added());
        append(builder, "removed", event.removed());
        append(builder, "timestamp", event.timestamp());
        return builder.toString();
    }

    private static void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
