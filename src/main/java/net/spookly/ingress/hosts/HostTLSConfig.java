package net.spookly.ingress.hosts;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * TLS settings of a host. Only file names and content hashes are kept here.
 */
@Getter
@Setter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class HostTLSConfig {
    private String tlsFilename;
    private String tlsHash;
    private String caFilename;
    private String caHash;
    private boolean caVerifyOptional;
    private String caErrorPage;
    private String crlFilename;
    private String crlHash;

    public boolean hasTls() {
        return !isBlank(tlsFilename);
    }

    public boolean hasClientCa() {
        return !isBlank(caHash);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
