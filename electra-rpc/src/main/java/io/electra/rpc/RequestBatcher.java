// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.electra.core.error.FailoverExhaustedException;
import io.electra.core.error.RpcException;
import io.electra.core.error.TransportException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends groups of requests and waits for all of their results.
 *
 * <p>
 * A batch is all-or-nothing with respect to its server: if any request of the
 * batch cannot be written, or the batch does not complete within the request
 * timeout, all of its ids are cancelled, the controller fails over, and the
 * whole batch is sent again to the new server. Only the controller's
 * {@code maxServers} bound ends the retries.
 */
public final class RequestBatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestBatcher.class);

    private final FailoverController controller;
    private final Duration requestTimeout;

    public RequestBatcher(final FailoverController controller, final Duration requestTimeout) {
        this.controller = controller;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Sends every request and returns their results in submission order.
     * Server-side errors are returned inside the results, not thrown.
     *
     * @throws FailoverExhaustedException if no server could complete the batch
     */
    public List<RpcResult> sendAndAwaitAll(final List<RpcRequest> requests) {
        Objects.requireNonNull(requests, "requests");
        if (requests.isEmpty()) {
            return List.of();
        }

        Session session = controller.session();
        while (true) {
            final List<Long> ids = new ArrayList<>(requests.size());
            try {
                for (RpcRequest request : requests) {
                    ids.add(session.send(request.method(), request.params()));
                }
                final List<RpcResult> results = session.awaitAll(ids, requestTimeout);
                controller.markHealthy();
                return results;
            } catch (TransportException e) {
                session.cancel(ids);
                log.warn("Batch of {} request(s) failed on {}: {}", requests.size(), session.server(), e.getMessage());
                session = controller.failover(session, e);
            }
        }
    }

    /**
     * Sends a single request and returns its result data.
     *
     * @throws RpcException if the server answered with an error
     */
    public @Nullable Object runCommand(final RpcRequest request) {
        return sendAndAwaitAll(List.of(request)).get(0).dataOrThrow();
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }
}
