// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import io.electra.core.DebugLogger;
import io.electra.core.error.ElectraException;
import io.electra.core.error.HandshakeException;
import io.electra.core.error.PushProtocolViolationException;
import io.electra.core.error.RequestTimeoutException;
import io.electra.core.error.TransportException;
import io.electra.core.model.ServerVersion;
import io.electra.rpc.internal.JsonRpcCodec;
import io.electra.rpc.internal.ResultMapper;
import io.electra.rpc.transport.Connection;
import io.electra.rpc.transport.ConnectionFactory;
import io.electra.rpc.transport.FrameListener;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One live conversation with one server: assigns request ids, writes frames,
 * and matches responses back to their requests regardless of arrival order.
 *
 * <p>
 * <strong>Threading:</strong> {@link #send} and the wait methods are called
 * from caller threads. Inbound frames arrive on the connection's I/O thread
 * through {@link #onFrame}, which completes futures and never blocks.
 *
 * <p>
 * A session is single-use. Once the connection drops, a frame cannot be
 * read, or a subscription reports an error, the session fails: every pending
 * request completes exceptionally and further sends are rejected.
 */
public final class Session implements FrameListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Session.class);

    static final String SERVER_VERSION = "server.version";

    private final ServerDescriptor server;
    private final Consumer<JsonRpcNotification> notificationSink;
    private final Consumer<ElectraException> failureListener;
    private final ElectraMetrics metrics;

    private final AtomicLong idGenerator = new AtomicLong(1);
    private final Map<Long, PendingRequest> pending = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile @Nullable Connection connection;
    private volatile @Nullable ElectraException failure;
    private volatile @Nullable ServerVersion serverVersion;

    /**
     * @param server           the server this session talks to
     * @param notificationSink receives server pushes on the I/O thread; may throw
     *                         {@link PushProtocolViolationException} to fail the session
     * @param failureListener  told when the session fails on its own (not on {@link #close()})
     * @param metrics          metrics sink
     */
    public Session(
            final ServerDescriptor server,
            final Consumer<JsonRpcNotification> notificationSink,
            final Consumer<ElectraException> failureListener,
            final ElectraMetrics metrics) {
        this.server = server;
        this.notificationSink = notificationSink;
        this.failureListener = failureListener;
        this.metrics = metrics;
    }

    /**
     * Opens the underlying connection.
     *
     * @throws TransportException if the server cannot be reached
     */
    public void connect(final ConnectionFactory factory, final boolean useSsl) {
        if (connection != null) {
            throw new IllegalStateException("Session to " + server + " is already connected");
        }
        connection = factory.open(server, useSsl, this);
    }

    /**
     * Negotiates the protocol version with {@code server.version}.
     *
     * @throws HandshakeException if the server rejects the negotiation, does not
     *                            answer in time, or answers with something unreadable
     */
    public ServerVersion handshake(
            final String clientName,
            final String minProtocol,
            final String maxProtocol,
            final Duration timeout) {
        final RpcResult result;
        try {
            long id = send(SERVER_VERSION, List.of(clientName, List.of(minProtocol, maxProtocol)));
            result = awaitResult(id, timeout);
        } catch (TransportException e) {
            throw new HandshakeException(server.host(), e.getMessage(), e);
        }
        if (result.hasError()) {
            throw new HandshakeException(server.host(), String.valueOf(result.error()));
        }
        final ServerVersion version;
        try {
            version = ResultMapper.toServerVersion(result.data());
        } catch (ElectraException e) {
            throw new HandshakeException(server.host(), e.getMessage(), e);
        }
        serverVersion = version;
        log.info("Connected to {} running {} (protocol {})", server, version.software(), version.protocolVersion());
        return version;
    }

    /**
     * Writes a request and returns its id immediately.
     *
     * @throws TransportException if the session is no longer usable
     */
    public long send(final String method, final List<Object> params) {
        return write(PendingRequest.awaited(idGenerator.getAndIncrement(), method, params));
    }

    /**
     * Writes a request whose response goes to {@code handler} (on the I/O
     * thread) instead of to a waiter.
     */
    public long sendDetached(final String method, final List<Object> params, final Consumer<RpcResult> handler) {
        return write(PendingRequest.detached(idGenerator.getAndIncrement(), method, params, handler));
    }

    private long write(final PendingRequest request) {
        ensureOpen();
        final Connection conn = connection;
        if (conn == null) {
            throw new IllegalStateException("Session to " + server + " is not connected");
        }
        pending.put(request.id(), request);
        final String frame = JsonRpcCodec.encodeRequest(request.id(), request.method(), request.params());
        DebugLogger.logRpc(request.method(), "[RPC] %s -> %s", server, frame);
        try {
            conn.send(frame);
        } catch (TransportException e) {
            pending.remove(request.id());
            throw e;
        }
        metrics.onRequestStarted(request.method());
        return request.id();
    }

    /**
     * Blocks until the response for {@code id} arrives, then consumes it.
     */
    public RpcResult awaitResult(final long id, final Duration timeout) {
        return awaitAll(List.of(id), timeout).get(0);
    }

    /**
     * Waits for all of {@code ids} concurrently, bounded by one overall
     * timeout, and returns their results in the order of {@code ids}.
     *
     * @throws RequestTimeoutException if any response is missing when the timeout
     *                                 elapses; every id of the batch is cancelled
     * @throws TransportException      if the session failed while waiting
     */
    public List<RpcResult> awaitAll(final List<Long> ids, final Duration timeout) {
        final List<PendingRequest> requests = new ArrayList<>(ids.size());
        for (Long id : ids) {
            PendingRequest request = pending.get(id);
            if (request == null) {
                ElectraException f = failure;
                if (f != null) {
                    throw asCallerException(f);
                }
                throw new IllegalArgumentException("No pending request " + id + " on " + server);
            }
            if (request.isDetached()) {
                throw new IllegalArgumentException("Request " + id + " on " + server + " is detached");
            }
            requests.add(request);
        }

        final CompletableFuture<?>[] futures = new CompletableFuture<?>[requests.size()];
        for (int i = 0; i < futures.length; i++) {
            futures[i] = requests.get(i).future();
        }
        try {
            CompletableFuture.allOf(futures).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            int missing = 0;
            for (PendingRequest request : requests) {
                if (!request.future().isDone()) {
                    missing++;
                    metrics.onRequestTimeout(request.method());
                }
            }
            cancel(ids);
            throw new RequestTimeoutException(
                    missing + " of " + ids.size() + " request(s) to " + server + " did not complete within " + timeout,
                    timeout);
        } catch (ExecutionException e) {
            cancel(ids);
            throw asCallerException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(ids);
            throw new ElectraException("Interrupted while waiting for responses from " + server, e);
        }

        final List<RpcResult> results = new ArrayList<>(requests.size());
        for (PendingRequest request : requests) {
            pending.remove(request.id());
            results.add(request.future().join());
        }
        return results;
    }

    /**
     * Forgets the given requests. Responses that arrive for them later are
     * dropped. Idempotent.
     */
    public void cancel(final Collection<Long> ids) {
        for (Long id : ids) {
            pending.remove(id);
        }
    }

    @Override
    public void onFrame(final String frame) {
        try {
            for (InboundMessage message : JsonRpcCodec.decode(frame)) {
                if (message instanceof JsonRpcNotification notification) {
                    metrics.onSubscriptionNotification(notification.method());
                    notificationSink.accept(notification);
                } else {
                    resolve((JsonRpcResponse) message);
                }
            }
        } catch (PushProtocolViolationException e) {
            log.error("Protocol violation from {}: {}", server, e.getMessage());
            fail(e);
        } catch (TransportException e) {
            log.warn("Dropping connection to {}: {}", server, e.getMessage());
            fail(e);
        }
    }

    /**
     * Delivers a response to its request.
     *
     * @return {@code true} if the response was delivered; {@code false} if the
     *         id is unknown, no longer pending, or already answered
     */
    boolean resolve(final JsonRpcResponse response) {
        final Long id = response.id();
        if (id == null) {
            log.warn("Dropping response from {} with an id this client never issued", server);
            return false;
        }
        final PendingRequest request = pending.get(id);
        if (request == null) {
            log.debug("Dropping response from {} for request {} that is no longer pending", server, id);
            return false;
        }

        DebugLogger.logRpc(request.method(), "[RPC] %s <- %s #%d %s", server, request.method(), id,
                response.error() != null ? response.error() : response.result());
        final RpcResult result = new RpcResult(request.method(), request.params(), response.result(), response.error());
        final Consumer<RpcResult> handler = request.handler();
        if (handler != null) {
            if (pending.remove(id) == null) {
                log.debug("Dropping response from {} for request {} that is no longer pending", server, id);
                return false;
            }
            metrics.onRequestCompleted(request.method(), Duration.ofNanos(System.nanoTime() - request.startNanos()));
            handler.accept(result);
            return true;
        }

        if (!request.future().complete(result)) {
            metrics.onDuplicateResponse(id);
            log.error("Request {} ({}) on {} was already resolved; ignoring duplicate response",
                    id, request.method(), server);
            return false;
        }
        metrics.onRequestCompleted(request.method(), Duration.ofNanos(System.nanoTime() - request.startNanos()));
        return true;
    }

    @Override
    public void onClosed(final @Nullable Throwable cause) {
        if (closed.get()) {
            return;
        }
        metrics.onConnectionLost(server.host());
        fail(new TransportException("Connection to " + server + " closed", cause));
    }

    private void fail(final ElectraException cause) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        failure = cause;
        closeConnection();
        failAllPending(cause);
        failureListener.accept(cause);
    }

    private void failAllPending(final ElectraException cause) {
        for (PendingRequest request : pending.values()) {
            request.future().completeExceptionally(cause);
        }
    }

    private void closeConnection() {
        final Connection conn = connection;
        if (conn != null) {
            conn.close();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            final ElectraException f = failure;
            throw f == null ? new TransportException("Session to " + server + " is closed") : asCallerException(f);
        }
    }

    private ElectraException asCallerException(final Throwable cause) {
        if (cause instanceof TransportException || cause instanceof PushProtocolViolationException) {
            return (ElectraException) cause;
        }
        return new TransportException("Session to " + server + " failed: " + cause.getMessage(), cause);
    }

    public ServerDescriptor server() {
        return server;
    }

    public @Nullable ServerVersion serverVersion() {
        return serverVersion;
    }

    public boolean isOpen() {
        return !closed.get();
    }

    /**
     * Number of requests written and not yet consumed or cancelled.
     */
    int pendingCount() {
        return pending.size();
    }

    /**
     * Fails every pending request with a transport error and closes the
     * connection. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        final TransportException closedError = new TransportException("Session to " + server + " closed");
        failure = closedError;
        closeConnection();
        failAllPending(closedError);
        log.debug("Closed session to {}", server);
    }
}
