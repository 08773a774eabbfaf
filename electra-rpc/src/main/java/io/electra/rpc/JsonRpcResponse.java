// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import org.jspecify.annotations.Nullable;

/**
 * Represents a JSON-RPC 2.0 response from an ElectrumX server.
 *
 * @param id     the request id this response answers, or {@code null} if the
 *               server sent an id this client never issues
 * @param result the result if successful
 * @param error  the error if failed
 */
public record JsonRpcResponse(@Nullable Long id, @Nullable Object result, @Nullable JsonRpcError error)
        implements InboundMessage {

    public boolean hasError() {
        return error != null;
    }
}
