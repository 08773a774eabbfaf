// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when an ElectrumX server answers a request with an
 * {@code error} object.
 *
 * <p>
 * The error belongs to the request, not to the connection, so it never causes
 * a failover. Typical codes:
 * <ul>
 * <li><strong>-32600</strong>: Invalid request</li>
 * <li><strong>-32601</strong>: Method not found</li>
 * <li><strong>-32602</strong>: Invalid params</li>
 * <li><strong>1</strong>: Bad request (for example an unknown scripthash format)</li>
 * <li><strong>2</strong>: Daemon error (for example a rejected transaction broadcast)</li>
 * </ul>
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      Error Specification</a>
 */
public final class RpcException extends ElectraException {

    private final int code;
    private final @Nullable String data;
    private final @Nullable Long requestId;

    public RpcException(
            final int code,
            final String message,
            final @Nullable String data,
            final @Nullable Long requestId,
            final @Nullable Throwable cause) {
        super(augmentMessage(message, requestId), cause);
        this.code = code;
        this.data = data;
        this.requestId = requestId;
    }

    public RpcException(final int code, final String message, final @Nullable String data, final @Nullable Long requestId) {
        this(code, message, data, requestId, null);
    }

    public RpcException(final int code, final String message, final @Nullable String data) {
        this(code, message, data, null, null);
    }

    public int code() {
        return code;
    }

    public @Nullable String data() {
        return data;
    }

    public @Nullable Long requestId() {
        return requestId;
    }

    /**
     * Returns {@code true} if the daemon rejected a transaction (ElectrumX
     * reports these with code 1 or 2 and the bitcoind reason in the message).
     */
    public boolean isTransactionRejected() {
        final String msg = getMessage();
        return (code == 1 || code == 2)
                && msg != null
                && (msg.contains("rejected") || msg.contains("TX decode failed") || msg.contains("missing"));
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + ", requestId="
                + requestId
                + "}";
    }

    private static String augmentMessage(final String message, final @Nullable Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }

        return "[requestId=" + requestId + "] " + message;
    }
}
