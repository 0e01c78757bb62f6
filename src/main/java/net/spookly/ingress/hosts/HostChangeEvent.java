package net.spookly.ingress.hosts;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Snapshot of a host registry change for audit logging.
 */
@Value
@Accessors(fluent = true)
public class HostChangeEvent {
    HostChangeType type;
    Instant timestamp;
    String hostname;
    Integer paths;
    Boolean sslPassthrough;
    Integer added;
    Integer removed;

    public static HostChangeEvent from(HostChangeType type, Host host, Instant timestamp) {
        return new HostChangeEvent(
                type,
                timestamp,
                host.hostname(),
                host.paths().size(),
                host.sslPassthrough(),
                null,
                null
        );
    }

    public static HostChangeEvent commit(int added, int removed, Instant timestamp) {
        return new HostChangeEvent(HostChangeType.COMMIT, timestamp, null, null, null, added, removed);
    }
}
