package net.spookly.ingress.hosts;

import java.util.Comparator;

import lombok.NonNull;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Identity of a routing rule: the hostname and path it is declared on.
 */
@Value
@Accessors(fluent = true)
public class PathLink {
    public static final PathLink EMPTY = new PathLink("", "");

    String hostname;
    String path;

    public static PathLink of(@NonNull String hostname, @NonNull String path) {
        return new PathLink(hostname, path);
    }

    public boolean isEmpty() {
        return hostname.isEmpty() && path.isEmpty();
    }

    /**
     * Hostname always sorts ascending; path sorts descending when {@code reversePath} is set.
     */
    public boolean less(@NonNull PathLink other, boolean reversePath) {
        if (hostname.equals(other.hostname)) {
            if (reversePath) {
                return path.compareTo(other.path) > 0;
            }
            return path.compareTo(other.path) < 0;
        }
        return hostname.compareTo(other.hostname) < 0;
    }

    /**
     * Comparator consistent with {@link #less(PathLink, boolean)}.
     */
    public static Comparator<PathLink> comparator(boolean reversePath) {
        return (a, b) -> {
            if (a.less(b, reversePath)) {
                return -1;
            }
            if (b.less(a, reversePath)) {
                return 1;
            }
            return 0;
        };
    }
}
