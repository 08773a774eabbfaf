// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.error;

/**
 * The server refused the {@code server.version} negotiation or answered it
 * with something that is not a {@code [software, protocol]} pair.
 */
public final class HandshakeException extends TransportException {

    private final String host;

    public HandshakeException(final String host, final String message) {
        super("Handshake with " + host + " failed: " + message);
        this.host = host;
    }

    public HandshakeException(final String host, final String message, final Throwable cause) {
        super("Handshake with " + host + " failed: " + message, cause);
        this.host = host;
    }

    public String host() {
        return host;
    }
}
