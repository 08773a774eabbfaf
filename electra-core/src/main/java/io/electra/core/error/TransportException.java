// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.error;

/**
 * A connection-level failure: refused or reset socket, TLS error, closed
 * channel or an unreadable frame.
 *
 * <p>
 * Callers normally never see this exception; the client reacts to it by
 * failing over to another server.
 */
public sealed class TransportException extends ElectraException
        permits RequestTimeoutException, HandshakeException {

    public TransportException(final String message) {
        super(message);
    }

    public TransportException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
