// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.error;

/**
 * Base runtime exception for all Electra client failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * ElectraException
 * ├── {@link TransportException} - connection, TLS and framing failures (recovered by failover)
 * │   ├── {@link RequestTimeoutException} - a batch did not complete in time
 * │   └── {@link HandshakeException} - {@code server.version} was rejected
 * ├── {@link RpcException} - the server answered a call with an error object
 * ├── {@link FailoverExhaustedException} - too many servers failed in one sequence
 * ├── {@link NoServersAvailableException} - no usable server is left to pick
 * ├── {@link PushProtocolViolationException} - a subscription frame carried an error
 * └── {@link CatalogException} - the server catalog could not be loaded
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     client.broadcastTransaction(rawTx);
 * } catch (RpcException e) {
 *     // Server rejected the transaction
 * } catch (FailoverExhaustedException e) {
 *     // No server could be reached
 * } catch (ElectraException e) {
 *     // Anything else
 * }
 * }</pre>
 */
public sealed class ElectraException extends RuntimeException
        permits TransportException,
        RpcException,
        FailoverExhaustedException,
        NoServersAvailableException,
        PushProtocolViolationException,
        CatalogException {

    public ElectraException(final String message) {
        super(message);
    }

    public ElectraException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
