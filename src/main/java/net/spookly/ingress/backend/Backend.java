package net.spookly.ingress.backend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import net.spookly.ingress.hosts.PathLink;

/**
 * Service port that routing rules point to, with a reverse index of the paths bound to it.
 */
@Getter
@Accessors(fluent = true)
public final class Backend {
    private final String id;
    private final String namespace;
    private final String name;
    private final String port;
    @Getter(AccessLevel.NONE)
    private final NavigableSet<PathLink> pathLinks = new TreeSet<>(PathLink.comparator(false));

    public Backend(@NonNull String namespace, @NonNull String name, @NonNull String port) {
        this.id = buildId(namespace, name, port);
        this.namespace = namespace;
        this.name = name;
        this.port = port;
    }

    /**
     * Backend id in the {@code namespace_name_port} form.
     */
    public static String buildId(String namespace, String name, String port) {
        return namespace + "_" + name + "_" + port;
    }

    /**
     * Record a routing rule that points to this backend.
     */
    public void addBackendPath(@NonNull PathLink link) {
        pathLinks.add(link);
    }

    public boolean hasPathLink(PathLink link) {
        return link != null && pathLinks.contains(link);
    }

    /**
     * Links bound to this backend, ascending by hostname then path.
     */
    public List<PathLink> pathLinks() {
        return Collections.unmodifiableList(new ArrayList<>(pathLinks));
    }

    @Override
    public String toString() {
        return "Backend{id=" + id + ", paths=" + pathLinks.size() + "}";
    }
}
