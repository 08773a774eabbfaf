// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import static io.electra.rpc.internal.RpcUtils.MAPPER;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import io.electra.core.error.CatalogException;
import org.jspecify.annotations.Nullable;

/**
 * A list of known ElectrumX servers, in the format Electrum wallets ship:
 *
 * <pre>{@code
 * {
 *   "electrum.example.org": {"t": "50001", "s": "50002", "pruning": "-", "version": "1.4"},
 *   "retired.example.org":  {"s": 50002, "usable": false}
 * }
 * }</pre>
 *
 * <p>
 * Ports may be strings or numbers. Unknown keys are ignored.
 */
public final class ServerCatalog {

    /** Bundled mainnet catalog. */
    public static final String BITCOIN = "bitcoin.json";

    /** Bundled testnet catalog. */
    public static final String TESTNET = "testnet.json";

    private static final String RESOURCE_DIR = "/io/electra/rpc/servers/";

    private final List<ServerDescriptor> servers;

    private ServerCatalog(final List<ServerDescriptor> servers) {
        this.servers = List.copyOf(servers);
    }

    public static ServerCatalog of(final Collection<ServerDescriptor> servers) {
        return new ServerCatalog(new ArrayList<>(servers));
    }

    /**
     * Loads one of the catalogs bundled with the library, e.g. {@link #BITCOIN}.
     *
     * @throws CatalogException if there is no such catalog or it cannot be parsed
     */
    public static ServerCatalog bundled(final String name) {
        try (InputStream in = ServerCatalog.class.getResourceAsStream(RESOURCE_DIR + name)) {
            if (in == null) {
                throw new CatalogException("No bundled server catalog named " + name);
            }
            return parse(in, name);
        } catch (IOException e) {
            throw new CatalogException("Cannot read bundled server catalog " + name, e);
        }
    }

    public static ServerCatalog fromFile(final Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (IOException e) {
            throw new CatalogException("Cannot read server catalog " + path, e);
        }
    }

    public static ServerCatalog fromStream(final InputStream in) {
        return parse(in, "stream");
    }

    private static ServerCatalog parse(final InputStream in, final String source) {
        final JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (IOException e) {
            throw new CatalogException("Malformed server catalog " + source, e);
        }
        if (root == null || !root.isObject()) {
            throw new CatalogException("Server catalog " + source + " must be a JSON object keyed by host");
        }
        final List<ServerDescriptor> servers = new ArrayList<>(root.size());
        final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = fields.next();
            final String host = entry.getKey();
            final JsonNode node = entry.getValue();
            if (!node.isObject()) {
                throw new CatalogException("Entry for " + host + " in " + source + " must be an object");
            }
            servers.add(new ServerDescriptor(
                    host,
                    port(node.get("t"), host, source),
                    port(node.get("s"), host, source),
                    node.path("usable").asBoolean(true)));
        }
        return new ServerCatalog(servers);
    }

    private static @Nullable Integer port(final @Nullable JsonNode node, final String host, final String source) {
        if (node == null || node.isNull()) {
            return null;
        }
        final int port;
        if (node.isInt()) {
            port = node.intValue();
        } else if (node.isTextual()) {
            try {
                port = Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new CatalogException("Invalid port '" + node.asText() + "' for " + host + " in " + source, e);
            }
        } else {
            throw new CatalogException("Invalid port " + node + " for " + host + " in " + source);
        }
        if (port <= 0 || port > 65535) {
            throw new CatalogException("Port " + port + " for " + host + " in " + source + " is out of range");
        }
        return port;
    }

    public List<ServerDescriptor> servers() {
        return servers;
    }

    /**
     * Builds the registry for one transport mode.
     */
    public ServerRegistry toRegistry(final boolean useSsl) {
        return new ServerRegistry(servers, useSsl);
    }
}
