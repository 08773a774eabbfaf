// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

/**
 * A decoded frame received from a server.
 */
public sealed interface InboundMessage permits JsonRpcResponse, JsonRpcNotification {
}
