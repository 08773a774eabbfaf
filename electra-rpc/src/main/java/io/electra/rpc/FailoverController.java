// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import io.electra.core.error.ElectraException;
import io.electra.core.error.FailoverExhaustedException;
import io.electra.core.error.NoServersAvailableException;
import io.electra.core.error.TransportException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the current {@link Session} and replaces it when its server fails.
 *
 * <p>
 * Every server that fails (refused connection, failed handshake, dropped
 * connection, timed-out batch) joins the failed-host set and is not picked
 * again until a batch completes successfully. When the set reaches
 * {@code maxServers} the controller gives up with a
 * {@link FailoverExhaustedException} and starts from an empty set on the next
 * call.
 *
 * <p>
 * All state changes happen under this object's monitor. Several callers
 * reporting the same stale session cause a single failover; the later ones
 * get the replacement.
 */
public final class FailoverController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FailoverController.class);

    /**
     * Connects to a server and completes the handshake.
     */
    @FunctionalInterface
    public interface SessionOpener {
        /**
         * @throws TransportException if the server cannot be used; the opener closes
         *                            anything it opened before throwing
         */
        Session open(ServerDescriptor server);
    }

    private final ServerRegistry registry;
    private final SessionOpener opener;
    private final int maxServers;
    private final ElectraMetrics metrics;
    private final Set<String> failedHosts = new LinkedHashSet<>();
    private final List<Consumer<Session>> sessionListeners = new CopyOnWriteArrayList<>();

    private @Nullable Session session;
    private boolean closed;

    public FailoverController(
            final ServerRegistry registry,
            final SessionOpener opener,
            final int maxServers,
            final ElectraMetrics metrics) {
        if (maxServers <= 0) {
            throw new IllegalArgumentException("maxServers must be positive, got: " + maxServers);
        }
        this.registry = registry;
        this.opener = opener;
        this.maxServers = maxServers;
        this.metrics = metrics;
    }

    /**
     * Registers a listener told about every newly established session, before
     * it is handed to any caller.
     */
    public void addSessionListener(final Consumer<Session> listener) {
        sessionListeners.add(listener);
    }

    /**
     * Returns the current session, connecting first if there is none.
     *
     * @throws FailoverExhaustedException  if {@code maxServers} servers failed
     * @throws NoServersAvailableException if the registry has no server at all
     */
    public synchronized Session session() {
        ensureNotClosed();
        final Session current = session;
        if (current == null) {
            return connect();
        }
        if (!current.isOpen()) {
            return failover(current, new TransportException("Session to " + current.server() + " is closed"));
        }
        return current;
    }

    /**
     * Abandons {@code stale} and connects to another server. If {@code stale}
     * was already replaced, returns the replacement without failing anything.
     */
    public synchronized Session failover(final Session stale, final ElectraException cause) {
        ensureNotClosed();
        final Session current = session;
        if (current != null && current != stale) {
            log.debug("Session to {} was already replaced by {}", stale.server(), current.server());
            return current;
        }
        log.warn("Failing over from {}: {}", stale.server(), cause.getMessage());
        metrics.onFailover(stale.server().host(), cause);
        stale.close();
        session = null;
        recordFailure(stale.server(), cause);
        return connect();
    }

    /**
     * Forgets all failed hosts; called after a batch completed.
     */
    public synchronized void markHealthy() {
        if (!failedHosts.isEmpty()) {
            log.debug("Clearing {} failed host(s): {}", failedHosts.size(), failedHosts);
            failedHosts.clear();
        }
    }

    public synchronized @Nullable ServerDescriptor currentServer() {
        return session == null ? null : session.server();
    }

    synchronized Set<String> failedHosts() {
        return Set.copyOf(failedHosts);
    }

    private Session connect() {
        while (true) {
            final ServerDescriptor candidate;
            try {
                candidate = registry.pickRandom(failedHosts);
            } catch (NoServersAvailableException e) {
                if (failedHosts.isEmpty()) {
                    throw e;
                }
                throw exhausted(e);
            }

            Session opened = null;
            try {
                opened = opener.open(candidate);
                session = opened;
                for (Consumer<Session> listener : sessionListeners) {
                    listener.accept(opened);
                }
                return opened;
            } catch (TransportException e) {
                log.warn("Could not use {}: {}", candidate, e.getMessage());
                if (opened != null) {
                    opened.close();
                    session = null;
                }
                recordFailure(candidate, e);
            }
        }
    }

    private void recordFailure(final ServerDescriptor server, final Throwable cause) {
        failedHosts.add(server.host());
        if (failedHosts.size() >= maxServers) {
            throw exhausted(cause);
        }
    }

    private FailoverExhaustedException exhausted(final Throwable cause) {
        final List<String> hosts = List.copyOf(failedHosts);
        failedHosts.clear();
        log.error("Giving up after {} failed server(s): {}", hosts.size(), hosts);
        return new FailoverExhaustedException(hosts, cause);
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Client is closed");
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (session != null) {
            session.close();
            session = null;
        }
    }
}
