// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.util.List;

import io.electra.core.error.RpcException;
import io.electra.rpc.internal.RpcUtils;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of one request, tagged with the method and params it was sent
 * with so multi-item calls can map results back to their inputs.
 *
 * @param method the method that was called
 * @param params the params it was called with
 * @param data   the result, absent when {@code error} is set
 * @param error  the server's error, absent on success
 */
public record RpcResult(String method, List<Object> params, @Nullable Object data, @Nullable JsonRpcError error) {

    public boolean hasError() {
        return error != null;
    }

    /**
     * The first positional param, which is the lookup key (scripthash or
     * transaction hash) for every per-item ElectrumX method.
     */
    public Object firstParam() {
        if (params.isEmpty()) {
            throw new IllegalStateException(method + " was sent without params");
        }
        return params.get(0);
    }

    /**
     * Returns the data, or throws the server's error as an {@link RpcException}.
     */
    public @Nullable Object dataOrThrow() {
        if (error != null) {
            throw new RpcException(error.code(), error.message(), RpcUtils.extractErrorData(error.data()));
        }
        return data;
    }
}
