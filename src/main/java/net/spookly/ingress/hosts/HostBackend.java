package net.spookly.ingress.hosts;

import lombok.NonNull;
import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.ingress.backend.Backend;

/**
 * Backend identity captured when a path is bound to a host.
 */
@Value
@Accessors(fluent = true)
public class HostBackend {
    public static final HostBackend NOT_FOUND = new HostBackend("_error404", "", "", "");

    String id;
    String namespace;
    String name;
    String port;

    public static HostBackend of(@NonNull Backend backend) {
        return new HostBackend(backend.id(), backend.namespace(), backend.name(), backend.port());
    }

    public boolean isNotFound() {
        return NOT_FOUND.equals(this);
    }
}
