// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A method call as the caller sees it, before an id is assigned.
 *
 * @param method the ElectrumX method name
 * @param params positional parameters
 */
public record RpcRequest(String method, List<Object> params) {

    public RpcRequest {
        Objects.requireNonNull(method, "method");
        params = params == null ? List.of() : List.copyOf(params);
    }

    public static RpcRequest of(final String method, final Object... params) {
        return new RpcRequest(method, Arrays.asList(params));
    }
}
