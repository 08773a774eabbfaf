// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc.transport;

import io.electra.core.error.TransportException;
import io.electra.rpc.ServerDescriptor;

/**
 * Opens connections to servers.
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * Connects to {@code server} and returns once the link (and TLS, when
     * requested) is established.
     *
     * @throws TransportException if the server cannot be reached
     */
    Connection open(ServerDescriptor server, boolean useSsl, FrameListener listener);
}
