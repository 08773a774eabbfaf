// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import io.electra.core.DebugLogger;
import io.electra.core.error.ElectraException;
import io.electra.core.error.PushProtocolViolationException;
import io.electra.core.error.TransportException;
import io.electra.core.model.BlockHeader;
import io.electra.rpc.internal.ResultMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the client's subscriptions and routes server pushes to their
 * listeners.
 *
 * <p>
 * Two kinds are supported:
 * <ul>
 * <li>{@code blockchain.scripthash.subscribe}: keyed by scripthash; the
 * listener receives the caller's address for that scripthash and the new
 * status</li>
 * <li>{@code blockchain.headers.subscribe}: every header listener receives
 * every new tip</li>
 * </ul>
 *
 * <p>
 * {@link #dispatch} runs on the I/O thread and only decodes; listeners run on
 * the subscription executor, in the order pushes arrived. Subscriptions live as
 * long as the client and are re-sent by {@link #resubscribe} after a failover.
 */
public final class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    public static final String SCRIPTHASH_SUBSCRIBE = "blockchain.scripthash.subscribe";
    public static final String HEADERS_SUBSCRIBE = "blockchain.headers.subscribe";

    private record ScripthashEntry(String address, ScripthashStatusListener listener) {
    }

    private final Map<String, ScripthashEntry> scripthashes = new ConcurrentHashMap<>();
    private final Map<String, Long> scripthashRequestIds = new ConcurrentHashMap<>();
    private final List<Consumer<BlockHeader>> headerListeners = new CopyOnWriteArrayList<>();
    private volatile long headersRequestId = -1;
    private final Executor executor;

    public SubscriptionRegistry(final Executor executor) {
        this.executor = executor;
    }

    /**
     * Registers and sends in one step; see {@link #registerScripthashes} and
     * {@link #sendScripthashSubscribes}.
     *
     * @return the request ids of the subscribe calls
     */
    public List<Long> subscribeToScripthashes(
            final Session session,
            final Map<String, String> scripthashToAddress,
            final ScripthashStatusListener listener) {
        registerScripthashes(scripthashToAddress, listener);
        return sendScripthashSubscribes(session, scripthashToAddress.keySet());
    }

    /**
     * Remembers the scripthashes so that pushes for them are routed to
     * {@code listener} and {@link #resubscribe} renews them. Registering a
     * scripthash again replaces its address and listener.
     */
    public void registerScripthashes(
            final Map<String, String> scripthashToAddress,
            final ScripthashStatusListener listener) {
        for (Map.Entry<String, String> entry : scripthashToAddress.entrySet()) {
            scripthashes.put(entry.getKey(), new ScripthashEntry(entry.getValue(), listener));
        }
    }

    /**
     * Sends {@code blockchain.scripthash.subscribe} for registered scripthashes.
     * The listener is called once with the current status from the subscribe
     * response and again on every change.
     *
     * @return the request ids of the subscribe calls
     * @throws TransportException if the session cannot send
     */
    public List<Long> sendScripthashSubscribes(final Session session, final Collection<String> keys) {
        final List<Long> ids = new ArrayList<>(keys.size());
        for (String scripthash : keys) {
            ids.add(sendScripthashSubscribe(session, scripthash));
        }
        return ids;
    }

    /**
     * Ids of the most recent subscribe requests sent for {@code keys}, in
     * the same order.
     */
    public List<Long> lastRequestIds(final Collection<String> keys) {
        final List<Long> ids = new ArrayList<>(keys.size());
        for (String scripthash : keys) {
            final Long id = scripthashRequestIds.get(scripthash);
            if (id == null) {
                throw new IllegalStateException("No subscribe request was sent for scripthash " + scripthash);
            }
            ids.add(id);
        }
        return ids;
    }

    /**
     * Registers and sends in one step; see {@link #addHeaderListener} and
     * {@link #sendHeadersSubscribe}.
     *
     * @return the request id of the subscribe call
     */
    public long subscribeToBlockHeaders(final Session session, final Consumer<BlockHeader> listener) {
        addHeaderListener(listener);
        return sendHeadersSubscribe(session, listener);
    }

    public void addHeaderListener(final Consumer<BlockHeader> listener) {
        headerListeners.add(listener);
    }

    public boolean removeHeaderListener(final Consumer<BlockHeader> listener) {
        return headerListeners.remove(listener);
    }

    /**
     * Sends {@code blockchain.headers.subscribe}; the current tip from its
     * response goes to {@code listener} only, later tips to every listener.
     *
     * @return the request id of the subscribe call
     * @throws TransportException if the session cannot send
     */
    public long sendHeadersSubscribe(final Session session, final Consumer<BlockHeader> listener) {
        final long id = session.sendDetached(
                HEADERS_SUBSCRIBE, List.of(), result -> onHeadersResponse(result, List.of(listener)));
        headersRequestId = id;
        return id;
    }

    /**
     * Id of the most recent {@code blockchain.headers.subscribe} request.
     */
    public long lastHeadersRequestId() {
        return headersRequestId;
    }

    /**
     * Re-issues every known subscription on a new session.
     */
    public void resubscribe(final Session session) {
        if (scripthashes.isEmpty() && headerListeners.isEmpty()) {
            return;
        }
        for (String scripthash : scripthashes.keySet()) {
            sendScripthashSubscribe(session, scripthash);
        }
        if (!headerListeners.isEmpty()) {
            headersRequestId = session.sendDetached(
                    HEADERS_SUBSCRIBE, List.of(), result -> onHeadersResponse(result, headerListeners));
        }
        log.info("Re-subscribed {} scripthash(es) and {} header listener(s) on {}",
                scripthashes.size(), headerListeners.size(), session.server());
    }

    /**
     * Routes one push. Runs on the I/O thread.
     *
     * @throws PushProtocolViolationException if the push carries an error
     */
    public void dispatch(final JsonRpcNotification notification) {
        DebugLogger.logSubscription(notification.method(), "[SUB] %s %s", notification.method(), notification.params());
        if (notification.error() != null) {
            throw new PushProtocolViolationException(notification.method(), notification.error().toString());
        }
        final List<Object> params = notification.params();
        try {
            switch (notification.method()) {
                case SCRIPTHASH_SUBSCRIBE -> {
                    if (params.isEmpty()) {
                        log.warn("Dropping scripthash notification without params");
                        return;
                    }
                    final Object status = params.size() > 1 ? params.get(1) : null;
                    deliverStatus(String.valueOf(params.get(0)), status == null ? null : String.valueOf(status));
                }
                case HEADERS_SUBSCRIBE -> {
                    if (params.isEmpty()) {
                        log.warn("Dropping header notification without params");
                        return;
                    }
                    deliverHeader(ResultMapper.toBlockHeader(params.get(0)), headerListeners);
                }
                default -> log.debug("Ignoring notification for unsupported method {}", notification.method());
            }
        } catch (PushProtocolViolationException e) {
            throw e;
        } catch (ElectraException e) {
            log.warn("Dropping malformed {} notification: {}", notification.method(), e.getMessage());
        }
    }

    private long sendScripthashSubscribe(final Session session, final String scripthash) {
        final long id = session.sendDetached(SCRIPTHASH_SUBSCRIBE, List.of(scripthash), this::onScripthashResponse);
        scripthashRequestIds.put(scripthash, id);
        return id;
    }

    private void onScripthashResponse(final RpcResult result) {
        if (result.hasError()) {
            throw new PushProtocolViolationException(result.method(), String.valueOf(result.error()));
        }
        final Object status = result.data();
        deliverStatus(String.valueOf(result.firstParam()), status == null ? null : String.valueOf(status));
    }

    private void onHeadersResponse(final RpcResult result, final List<Consumer<BlockHeader>> listeners) {
        if (result.hasError()) {
            throw new PushProtocolViolationException(result.method(), String.valueOf(result.error()));
        }
        try {
            deliverHeader(ResultMapper.toBlockHeader(result.data()), listeners);
        } catch (PushProtocolViolationException e) {
            throw e;
        } catch (ElectraException e) {
            log.warn("Dropping malformed {} response: {}", result.method(), e.getMessage());
        }
    }

    private void deliverStatus(final String scripthash, final @Nullable String status) {
        final ScripthashEntry entry = scripthashes.get(scripthash);
        if (entry == null) {
            log.warn("Dropping status for scripthash {} that has no subscription", scripthash);
            return;
        }
        execute("scripthash " + scripthash, () -> entry.listener().onStatus(entry.address(), status));
    }

    private void deliverHeader(final BlockHeader header, final List<Consumer<BlockHeader>> listeners) {
        for (Consumer<BlockHeader> listener : listeners) {
            execute("header " + header.height(), () -> listener.accept(header));
        }
    }

    private void execute(final String description, final Runnable callback) {
        try {
            executor.execute(() -> {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    log.error("Subscription callback for {} failed", description, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Subscription executor rejected callback for {}: {}", description, e.getMessage());
        }
    }

    public int scripthashCount() {
        return scripthashes.size();
    }

    public int headerListenerCount() {
        return headerListeners.size();
    }
}
