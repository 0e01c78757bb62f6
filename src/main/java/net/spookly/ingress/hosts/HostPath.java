package net.spookly.ingress.hosts;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * One routing rule of a host. Built by {@link Host#addPath}.
 */
@Value
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class HostPath {
    String path;
    PathLink link;
    MatchType match;
    HostBackend backend;
}
