// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A JSON-RPC 2.0 request frame as written to the socket.
 *
 * @param jsonrpc always {@code "2.0"}
 * @param method  the ElectrumX method name
 * @param params  positional parameters
 * @param id      session-unique request id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"jsonrpc", "method", "params", "id"})
public record JsonRpcRequest(String jsonrpc, String method, List<?> params, long id) {

    public static final String VERSION = "2.0";

    public JsonRpcRequest(String method, List<?> params, long id) {
        this(VERSION, method, params, id);
    }
}
