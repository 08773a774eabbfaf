// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.time.Duration;

/**
 * Interface for collecting metrics from the Electra client.
 *
 * <p>
 * Implementations can bridge to Micrometer, Prometheus or any other
 * monitoring system. By default a no-op implementation is used
 * ({@link #noop()}).
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe; hooks
 * are called from caller threads and from the I/O thread.
 */
public interface ElectraMetrics {

    /**
     * Called when a request is written to a server.
     *
     * @param method the ElectrumX method name
     */
    default void onRequestStarted(String method) {
    }

    /**
     * Called when a response arrives for a request.
     *
     * @param method  the ElectrumX method name
     * @param latency time between send and response
     */
    default void onRequestCompleted(String method, Duration latency) {
    }

    /**
     * Called for every request of a batch that did not complete in time.
     *
     * @param method the ElectrumX method name
     */
    default void onRequestTimeout(String method) {
    }

    /**
     * Called when the client abandons a server and switches to another.
     *
     * @param fromHost the server being abandoned
     * @param cause    why it was abandoned
     */
    default void onFailover(String fromHost, Throwable cause) {
    }

    /**
     * Called when an established connection drops unexpectedly.
     *
     * @param host the server whose connection dropped
     */
    default void onConnectionLost(String host) {
    }

    /**
     * Called for every subscription push received.
     *
     * @param method the subscription method
     */
    default void onSubscriptionNotification(String method) {
    }

    /**
     * Called when a response arrives for a request that was already answered.
     *
     * @param requestId the repeated id
     */
    default void onDuplicateResponse(long requestId) {
    }

    /**
     * Returns a no-op metrics implementation.
     */
    static ElectraMetrics noop() {
        return Noop.INSTANCE;
    }

    /**
     * Singleton no-op implementation.
     */
    enum Noop implements ElectraMetrics {
        INSTANCE
    }
}
