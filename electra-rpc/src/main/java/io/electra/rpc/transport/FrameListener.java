// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc.transport;

import org.jspecify.annotations.Nullable;

/**
 * Receives inbound traffic of one {@link Connection}. Both callbacks run on
 * the connection's I/O thread and must not block.
 */
public interface FrameListener {

    /**
     * A complete line received from the server, without its terminator.
     */
    void onFrame(String frame);

    /**
     * The connection is gone. Called at most once.
     *
     * @param cause the failure that closed it, or {@code null} if the peer closed it
     */
    void onClosed(@Nullable Throwable cause);
}
