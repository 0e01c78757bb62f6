package net.spookly.ingress.hosts;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Alternative server name of a host, either literal or a regular expression.
 */
@Value
@Accessors(fluent = true)
public class HostAlias {
    String name;
    String regex;
}
