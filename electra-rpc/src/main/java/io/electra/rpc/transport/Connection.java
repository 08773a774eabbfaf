// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc.transport;

import io.electra.core.error.TransportException;

/**
 * A full-duplex, line-framed link to one server.
 */
public interface Connection extends AutoCloseable {

    /**
     * Queues one frame for writing; the transport appends the newline.
     * Write failures surface later through {@link FrameListener#onClosed}.
     *
     * @throws TransportException if the connection is no longer open
     */
    void send(String frame);

    boolean isOpen();

    /**
     * Closes the link. Idempotent. Does not notify the listener.
     */
    @Override
    void close();
}
