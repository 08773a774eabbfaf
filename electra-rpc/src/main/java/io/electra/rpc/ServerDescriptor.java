// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * One ElectrumX server from the catalog.
 *
 * @param host    host name
 * @param tcpPort plaintext port ({@code "t"} in the catalog), if offered
 * @param sslPort TLS port ({@code "s"} in the catalog), if offered
 * @param usable  {@code false} marks a server the catalog lists but should not be used
 */
public record ServerDescriptor(String host, @Nullable Integer tcpPort, @Nullable Integer sslPort, boolean usable) {

    public ServerDescriptor {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
    }

    public static ServerDescriptor tls(final String host, final int sslPort) {
        return new ServerDescriptor(host, null, sslPort, true);
    }

    public static ServerDescriptor plain(final String host, final int tcpPort) {
        return new ServerDescriptor(host, tcpPort, null, true);
    }

    /**
     * The port for the given transport mode, or {@code null} if the server
     * does not offer it.
     */
    public @Nullable Integer port(final boolean useSsl) {
        return useSsl ? sslPort : tcpPort;
    }

    public boolean supports(final boolean useSsl) {
        return port(useSsl) != null;
    }

    @Override
    public String toString() {
        return host;
    }
}
