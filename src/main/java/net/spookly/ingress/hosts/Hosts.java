package net.spookly.ingress.hosts;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import lombok.NonNull;
import net.spookly.ingress.config.IngressConfig;

/**
 * In-memory registry of virtual hosts with per-cycle change tracking.
 * <p>
 * A rebuild cycle calls {@link #acquire} and {@link #removeAll}, then {@link #shrink}, reads the
 * delta through {@link #itemsAdded()} and {@link #itemsRemoved()}, and closes with {@link #commit()}.
 * Not thread safe: at most one cycle may mutate an instance at a time.
 */
public final class Hosts {
    public static final String DEFAULT_HOSTNAME = "<default>";

    private final Map<String, Host> items = new HashMap<>();
    private Map<String, Host> itemsAdded = new HashMap<>();
    private Map<String, Host> itemsRemoved = new HashMap<>();
    private final String defaultHostname;
    private final HostChangeListener eventListener;
    private int sslPassthroughCount;
    private boolean committed;

    public Hosts() {
        this(DEFAULT_HOSTNAME, HostChangeListener.NOOP);
    }

    public Hosts(@NonNull String defaultHostname, HostChangeListener eventListener) {
        this.defaultHostname = defaultHostname;
        this.eventListener = eventListener == null ? HostChangeListener.NOOP : eventListener;
    }

    /**
     * Build a registry with settings extracted from config.
     */
    public static Hosts fromConfig(IngressConfig config) {
        String defaultHostname = DEFAULT_HOSTNAME;
        HostChangeListener eventListener = HostChangeListener.NOOP;
        if (config != null) {
            if (config.hosts != null && config.hosts.defaultHostname != null) {
                defaultHostname = config.hosts.defaultHostname;
            }
            if (config.observability != null
                    && config.observability.logging != null
                    && Boolean.TRUE.equals(config.observability.logging.auditChanges)) {
                eventListener = HostAuditLogger.INSTANCE;
            }
        }
        return new Hosts(defaultHostname, eventListener);
    }

    /**
     * Return the host for {@code hostname}, creating and tracking it as added when missing.
     */
    public Host acquire(@NonNull String hostname) {
        Host host = items.get(hostname);
        if (host != null) {
            return host;
        }
        host = new Host(hostname, this);
        items.put(hostname, host);
        itemsAdded.put(hostname, host);
        emit(HostChangeType.ADD, host);
        return host;
    }

    /**
     * Current host for {@code hostname}, or null.
     */
    public Host find(String hostname) {
        return items.get(hostname);
    }

    /**
     * Remove every listed host that exists. Unknown hostnames are ignored.
     */
    public void removeAll(@NonNull Collection<String> hostnames) {
        for (String hostname : hostnames) {
            Host host = items.remove(hostname);
            if (host == null) {
                continue;
            }
            release(host);
            if (itemsAdded.get(hostname) == host) {
                // created and dropped in the same cycle, nothing to report
                itemsAdded.remove(hostname);
            } else {
                itemsRemoved.putIfAbsent(hostname, host);
            }
            emit(HostChangeType.REMOVE, host);
        }
    }

    /**
     * Cancel added/removed pairs whose content is identical, restoring the previous instance.
     * A pair like that means the hostname was reparsed without any real change.
     */
    public void shrink() {
        Iterator<Map.Entry<String, Host>> iterator = itemsRemoved.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Host> entry = iterator.next();
            String hostname = entry.getKey();
            Host removed = entry.getValue();
            Host added = itemsAdded.get(hostname);
            if (added != null && added.sameContent(removed)) {
                items.put(hostname, removed);
                itemsAdded.remove(hostname);
                iterator.remove();
                emit(HostChangeType.RESTORE, removed);
            }
        }
    }

    /**
     * Close the current cycle, clearing the added and removed sets.
     */
    public void commit() {
        int added = itemsAdded.size();
        int removed = itemsRemoved.size();
        itemsAdded = new HashMap<>();
        itemsRemoved = new HashMap<>();
        committed = true;
        emitCommit(added, removed);
    }

    /**
     * True once {@link #commit()} ran at least once.
     */
    public boolean hasCommitted() {
        return committed;
    }

    /**
     * True when hosts were added or removed since the last commit. Call after {@link #shrink()}.
     */
    public boolean hasChanged() {
        return !itemsAdded.isEmpty() || !itemsRemoved.isEmpty();
    }

    /**
     * All hosts but the default one, ascending by hostname, read-only. Empty when there are none.
     */
    public List<Host> sortedHosts() {
        List<Host> sorted = new ArrayList<>(items.size());
        for (Map.Entry<String, Host> entry : items.entrySet()) {
            if (!defaultHostname.equals(entry.getKey())) {
                sorted.add(entry.getValue());
            }
        }
        if (sorted.isEmpty()) {
            return Collections.emptyList();
        }
        sorted.sort(Comparator.comparing(Host::hostname));
        return Collections.unmodifiableList(sorted);
    }

    /**
     * The catch-all host, or null when it was never acquired.
     */
    public Host defaultHost() {
        return items.get(defaultHostname);
    }

    public boolean hasSslPassthrough() {
        return sslPassthroughCount > 0;
    }

    public boolean hasVarNamespace() {
        for (Host host : items.values()) {
            if (host.varNamespace()) {
                return true;
            }
        }
        return false;
    }

    public Map<String, Host> items() {
        return Collections.unmodifiableMap(items);
    }

    public Map<String, Host> itemsAdded() {
        return Collections.unmodifiableMap(itemsAdded);
    }

    public Map<String, Host> itemsRemoved() {
        return Collections.unmodifiableMap(itemsRemoved);
    }

    public int size() {
        return items.size();
    }

    public int sslPassthroughCount() {
        return sslPassthroughCount;
    }

    public String defaultHostname() {
        return defaultHostname;
    }

    void updateSslPassthroughCount(int delta) {
        sslPassthroughCount += delta;
    }

    // reverse update of the aggregates due to the removal of a host
    private void release(Host host) {
        if (host.sslPassthrough()) {
            sslPassthroughCount--;
        }
    }

    private void emit(HostChangeType type, Host host) {
        notifyListener(HostChangeEvent.from(type, host, Instant.now()));
    }

    private void emitCommit(int added, int removed) {
        notifyListener(HostChangeEvent.commit(added, removed, Instant.now()));
    }

    private void notifyListener(HostChangeEvent event) {
        try {
            eventListener.onEvent(event);
        } catch (RuntimeException e) {
            System.err.println("Failed to emit host audit event: " + e.getMessage());
        }
    }
}
