// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc.internal;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import io.electra.core.error.ElectraException;
import io.electra.core.model.AddressBalance;
import io.electra.core.model.BlockHeader;
import io.electra.core.model.HistoryEntry;
import io.electra.core.model.MerkleProof;
import io.electra.core.model.PeerServer;
import io.electra.core.model.ServerVersion;
import io.electra.core.model.UnspentOutput;
import org.jspecify.annotations.Nullable;

/**
 * Converts the generic Jackson trees of ElectrumX results into the typed
 * models of {@code io.electra.core.model}.
 *
 * <p>
 * A result of the wrong shape is reported as an {@link ElectraException}
 * naming the method; it is a server bug, not a connection problem.
 */
public final class ResultMapper {

    private ResultMapper() {
    }

    public static ServerVersion toServerVersion(final @Nullable Object data) {
        final List<Object> pair = asList(data, "server.version");
        if (pair.size() < 2) {
            throw unexpected("server.version", data);
        }
        return new ServerVersion(String.valueOf(pair.get(0)), String.valueOf(pair.get(1)));
    }

    public static AddressBalance toBalance(final String address, final @Nullable Object data) {
        final Map<String, Object> map = asMap(data, "blockchain.scripthash.get_balance");
        return new AddressBalance(
                address,
                asLong(map.get("confirmed"), "confirmed"),
                asLong(map.get("unconfirmed"), "unconfirmed"));
    }

    public static List<UnspentOutput> toUnspent(final String address, final @Nullable Object data) {
        final List<Object> items = asList(data, "blockchain.scripthash.listunspent");
        final List<UnspentOutput> outputs = new ArrayList<>(items.size());
        for (Object item : items) {
            final Map<String, Object> map = asMap(item, "blockchain.scripthash.listunspent");
            outputs.add(new UnspentOutput(
                    address,
                    asString(map.get("tx_hash"), "tx_hash"),
                    (int) asLong(map.get("tx_pos"), "tx_pos"),
                    asLong(map.get("height"), "height"),
                    asLong(map.get("value"), "value")));
        }
        return outputs;
    }

    public static List<HistoryEntry> toHistory(final String address, final @Nullable Object data, final String method) {
        final List<Object> items = asList(data, method);
        final List<HistoryEntry> entries = new ArrayList<>(items.size());
        for (Object item : items) {
            final Map<String, Object> map = asMap(item, method);
            final Object fee = map.get("fee");
            entries.add(new HistoryEntry(
                    address,
                    asString(map.get("tx_hash"), "tx_hash"),
                    asLong(map.get("height"), "height"),
                    fee == null ? null : asLong(fee, "fee")));
        }
        return entries;
    }

    public static BlockHeader toBlockHeader(final @Nullable Object data) {
        final Map<String, Object> map = asMap(data, "blockchain.headers.subscribe");
        return new BlockHeader(asLong(map.get("height"), "height"), asString(map.get("hex"), "hex"));
    }

    public static MerkleProof toMerkleProof(final String txHash, final @Nullable Object data) {
        final Map<String, Object> map = asMap(data, "blockchain.transaction.get_merkle");
        final List<Object> branch = asList(map.get("merkle"), "blockchain.transaction.get_merkle");
        final List<String> merkle = new ArrayList<>(branch.size());
        for (Object hash : branch) {
            merkle.add(asString(hash, "merkle"));
        }
        return new MerkleProof(
                txHash,
                asLong(map.get("block_height"), "block_height"),
                merkle,
                (int) asLong(map.get("pos"), "pos"));
    }

    public static List<PeerServer> toPeers(final @Nullable Object data) {
        final List<Object> items = asList(data, "server.peers.subscribe");
        final List<PeerServer> peers = new ArrayList<>(items.size());
        for (Object item : items) {
            final List<Object> entry = asList(item, "server.peers.subscribe");
            if (entry.size() < 3) {
                throw unexpected("server.peers.subscribe", item);
            }
            final List<String> features = new ArrayList<>();
            for (Object feature : asList(entry.get(2), "server.peers.subscribe")) {
                features.add(String.valueOf(feature));
            }
            peers.add(new PeerServer(String.valueOf(entry.get(0)), String.valueOf(entry.get(1)), features));
        }
        return peers;
    }

    public static BigDecimal toDecimal(final @Nullable Object data, final String method) {
        if (data instanceof BigDecimal decimal) {
            return decimal;
        }
        if (data instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        throw unexpected(method, data);
    }

    public static String toText(final @Nullable Object data, final String method) {
        if (data instanceof String text) {
            return text;
        }
        throw unexpected(method, data);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(final @Nullable Object data, final String method) {
        if (data instanceof Map<?, ?>) {
            return (Map<String, Object>) data;
        }
        throw unexpected(method, data);
    }

    @SuppressWarnings("unchecked")
    public static List<Object> asList(final @Nullable Object data, final String method) {
        if (data instanceof List<?>) {
            return (List<Object>) data;
        }
        throw unexpected(method, data);
    }

    private static long asLong(final @Nullable Object value, final String field) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw new ElectraException("Expected a number for '" + field + "' but got: " + value);
    }

    private static String asString(final @Nullable Object value, final String field) {
        if (value instanceof String text) {
            return text;
        }
        throw new ElectraException("Expected a string for '" + field + "' but got: " + value);
    }

    private static ElectraException unexpected(final String method, final @Nullable Object data) {
        return new ElectraException("Unexpected result for " + method + ": " + data);
    }
}
