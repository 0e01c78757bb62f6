package net.spookly.ingress.hosts;

/**
 * Change events emitted by the host registry.
 */
public enum HostChangeType {
    ADD,
    REMOVE,
    RESTORE,
    COMMIT
}
