package net.spookly.ingress.hosts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import net.spookly.ingress.backend.Backend;

/**
 * Virtual host with its routing rules, mutated in place during a rebuild cycle.
 */
@Getter
@Accessors(fluent = true)
public final class Host {
    // reverse order so longer paths are evaluated before their sub-paths
    private static final Comparator<HostPath> PATH_ORDER = Comparator.comparing(HostPath::path).reversed();

    private final String hostname;
    @Getter(AccessLevel.NONE)
    private final List<HostPath> paths = new ArrayList<>();
    private final HostTLSConfig tls = new HostTLSConfig();
    private HostAlias alias;
    private String rootRedirect;
    private String httpPassthroughBackend;
    private boolean varNamespace;
    private boolean sslPassthrough;
    @Getter(AccessLevel.NONE)
    private final Hosts owner;

    Host(@NonNull String hostname, @NonNull Hosts owner) {
        this.hostname = hostname;
        this.owner = owner;
    }

    /**
     * Routing rules, descending by path.
     */
    public List<HostPath> paths() {
        return Collections.unmodifiableList(paths);
    }

    /**
     * First rule declared for exactly {@code path}, or null.
     */
    public HostPath findPath(String path) {
        for (HostPath hostPath : paths) {
            if (hostPath.path().equals(path)) {
                return hostPath;
            }
        }
        return null;
    }

    /**
     * Bind {@code path} to {@code backend}, or to the 404 backend when it is null.
     * The same path added twice results in two rules.
     */
    public HostPath addPath(Backend backend, @NonNull String path, @NonNull MatchType match) {
        PathLink link = PathLink.of(hostname, path);
        HostBackend hostBackend;
        if (backend != null) {
            hostBackend = HostBackend.of(backend);
            backend.addBackendPath(link);
        } else {
            hostBackend = HostBackend.NOT_FOUND;
        }
        HostPath hostPath = new HostPath(path, link, match, hostBackend);
        paths.add(hostPath);
        paths.sort(PATH_ORDER);
        return hostPath;
    }

    /**
     * Toggle SSL passthrough, keeping the registry-wide counter in step.
     * Hosts no longer held by the registry only flip their own flag.
     */
    public void setSslPassthrough(boolean value) {
        if (sslPassthrough == value) {
            return;
        }
        if (owner.find(hostname) == this) {
            owner.updateSslPassthroughCount(value ? 1 : -1);
        }
        sslPassthrough = value;
    }

    public void setVarNamespace(boolean varNamespace) {
        this.varNamespace = varNamespace;
    }

    public void setAlias(HostAlias alias) {
        this.alias = alias;
    }

    public void setRootRedirect(String rootRedirect) {
        this.rootRedirect = rootRedirect;
    }

    public void setHttpPassthroughBackend(String httpPassthroughBackend) {
        this.httpPassthroughBackend = httpPassthroughBackend;
    }

    public boolean hasTlsAuth() {
        return tls.hasClientCa();
    }

    /**
     * Field-by-field comparison of everything that ends up in the proxy configuration.
     */
    public boolean sameContent(Host other) {
        if (other == null) {
            return false;
        }
        return owner == other.owner
                && hostname.equals(other.hostname)
                && varNamespace == other.varNamespace
                && sslPassthrough == other.sslPassthrough
                && Objects.equals(alias, other.alias)
                && Objects.equals(rootRedirect, other.rootRedirect)
                && Objects.equals(httpPassthroughBackend, other.httpPassthroughBackend)
                && tls.equals(other.tls)
                && paths.equals(other.paths);
    }

    @Override
    public String toString() {
        return "Host{hostname=" + hostname
                + ", paths=" + paths
                + ", tls=" + tls
                + ", alias=" + alias
                + ", rootRedirect=" + rootRedirect
                + ", httpPassthroughBackend=" + httpPassthroughBackend
                + ", varNamespace=" + varNamespace
                + ", sslPassthrough=" + sslPassthrough
                + "}";
    }
}
