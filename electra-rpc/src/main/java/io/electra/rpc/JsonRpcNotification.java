// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * A server push: a frame with a {@code method} and no {@code id}.
 *
 * <p>
 * ElectrumX names notifications after the subscribe method that asked for
 * them, e.g. {@code blockchain.scripthash.subscribe} with params
 * {@code [scripthash, status]}.
 *
 * @param method the subscription method
 * @param params positional parameters
 * @param error  non-standard error member; its presence is a protocol violation
 */
public record JsonRpcNotification(String method, List<Object> params, @Nullable JsonRpcError error)
        implements InboundMessage {

    public JsonRpcNotification {
        params = params == null ? List.of() : params;
    }
}
