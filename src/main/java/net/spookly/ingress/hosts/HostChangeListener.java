package net.spookly.ingress.hosts;

/**
 * Listener for host registry change events.
 */
@FunctionalInterface
public interface HostChangeListener {
    HostChangeListener NOOP = event -> {
    };

    void onEvent(HostChangeEvent event);
}
