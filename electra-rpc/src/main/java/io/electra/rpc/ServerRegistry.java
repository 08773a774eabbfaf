// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import io.electra.core.error.NoServersAvailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The set of servers the client may connect to in its transport mode (TLS
 * or plaintext).
 *
 * <p>
 * Servers flagged unusable in the catalog are never registered. A server
 * that turns out to lack a port for the mode is dropped the first time it is
 * picked. All methods are thread-safe.
 */
public final class ServerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServerRegistry.class);

    private final Map<String, ServerDescriptor> servers = new LinkedHashMap<>();
    private final boolean useSsl;
    private final Random random;

    public ServerRegistry(final Collection<ServerDescriptor> descriptors, final boolean useSsl) {
        this(descriptors, useSsl, new Random());
    }

    public ServerRegistry(final Collection<ServerDescriptor> descriptors, final boolean useSsl, final Random random) {
        this.useSsl = useSsl;
        this.random = random;
        for (ServerDescriptor descriptor : descriptors) {
            if (!descriptor.usable()) {
                log.debug("Skipping {}: marked unusable", descriptor);
                continue;
            }
            servers.put(descriptor.host(), descriptor);
        }
    }

    /**
     * Picks a server uniformly at random among the registered servers whose
     * host is not in {@code excluded}.
     *
     * @throws NoServersAvailableException if the registry is empty or every
     *                                     remaining server is excluded
     */
    public synchronized ServerDescriptor pickRandom(final Set<String> excluded) {
        // each rejected pick removes a server, so this ends after at most size() rounds
        while (true) {
            if (servers.isEmpty()) {
                throw new NoServersAvailableException("No " + mode() + " servers registered");
            }
            final List<ServerDescriptor> candidates = new ArrayList<>(servers.size());
            for (ServerDescriptor server : servers.values()) {
                if (!excluded.contains(server.host())) {
                    candidates.add(server);
                }
            }
            if (candidates.isEmpty()) {
                throw new NoServersAvailableException(
                        "All " + servers.size() + " registered " + mode() + " servers are excluded");
            }
            final ServerDescriptor choice = candidates.get(random.nextInt(candidates.size()));
            if (choice.supports(useSsl)) {
                return choice;
            }
            log.warn("Removing {}: it has no {} port", choice, mode());
            servers.remove(choice.host());
        }
    }

    public synchronized boolean remove(final String host) {
        return servers.remove(host) != null;
    }

    public synchronized int size() {
        return servers.size();
    }

    public synchronized Set<String> hosts() {
        return Set.copyOf(servers.keySet());
    }

    public boolean useSsl() {
        return useSsl;
    }

    private String mode() {
        return useSsl ? "TLS" : "TCP";
    }
}
