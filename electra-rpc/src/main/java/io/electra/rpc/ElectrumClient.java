// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import io.electra.core.error.FailoverExhaustedException;
import io.electra.core.error.NoServersAvailableException;
import io.electra.core.error.PushProtocolViolationException;
import io.electra.core.error.RpcException;
import io.electra.core.model.AddressBalance;
import io.electra.core.model.BlockHeader;
import io.electra.core.model.HistoryEntry;
import io.electra.core.model.MerkleProof;
import io.electra.core.model.PeerServer;
import io.electra.core.model.ServerVersion;
import io.electra.core.model.UnspentOutput;
import org.jspecify.annotations.Nullable;

/**
 * Client for the ElectrumX protocol with automatic server failover.
 *
 * <p>
 * Calls block until every result has arrived. When the current server fails
 * or is too slow, the client moves to another random server from its catalog
 * and repeats the call there; callers only see a
 * {@link FailoverExhaustedException} once too many servers have failed.
 *
 * <p>
 * Address-oriented calls take a map from scripthash to the caller's own
 * identifier for it (usually the address string) and report that identifier
 * back in their results.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try (ElectrumClient client = ElectrumClient.connect(ServerCatalog.bundled(ServerCatalog.BITCOIN))) {
 *     Map<String, String> wallet = Map.of(Scripthash.fromScriptHex(script).value(), address);
 *     List<AddressBalance> balances = client.getBalances(wallet);
 *     client.subscribeToScripthashes(wallet, (addr, status) -> refresh(addr));
 * }
 * }</pre>
 *
 * <p>
 * Once a server sends an error on a subscription the client is unusable and
 * every call throws the recorded {@link PushProtocolViolationException}.
 */
public interface ElectrumClient extends AutoCloseable {

    /**
     * Connects to a random server of {@code catalog}.
     *
     * @throws FailoverExhaustedException  if no server accepted the connection and handshake
     * @throws NoServersAvailableException if the catalog has no server for the transport mode
     */
    static ElectrumClient connect(final ServerCatalog catalog, final ElectrumClientConfig config) {
        return DefaultElectrumClient.connect(catalog.toRegistry(config.useSsl()), config);
    }

    static ElectrumClient connect(final ServerCatalog catalog) {
        return connect(catalog, ElectrumClientConfig.defaults());
    }

    // ---- server ----

    /**
     * Software and protocol version agreed with the current server during
     * the handshake. The protocol permits only one negotiation per connection,
     * so this does not contact the server again.
     */
    ServerVersion serverVersion();

    String serverBanner();

    String serverDonationAddress();

    Map<String, Object> serverFeatures();

    List<PeerServer> serverPeers();

    @Nullable ServerDescriptor currentServer();

    // ---- fees ----

    /**
     * Fee rate in BTC/kB for confirmation within {@code targetBlocks}, or
     * {@code -1} when the server cannot estimate.
     */
    BigDecimal estimateFee(int targetBlocks);

    /**
     * {@link #estimateFee} cached for {@link FeeCache#DEFAULT_TTL}.
     */
    BigDecimal estimateFeeCached(int targetBlocks);

    BigDecimal estimateFeeCached(int targetBlocks, Duration ttl);

    /**
     * Minimum fee rate in BTC/kB the server's daemon relays.
     */
    BigDecimal relayFee();

    // ---- transactions and blocks ----

    /**
     * Broadcasts a raw transaction.
     *
     * @return the transaction id
     * @throws RpcException if the daemon rejects it
     */
    String broadcastTransaction(String rawTransactionHex);

    List<String> getTransactions(List<String> txHashes);

    List<BlockHeader> blockHeaders(List<Long> heights);

    /**
     * Merkle proofs for confirmed transactions, typically taken from
     * {@link #getHistory}.
     */
    List<MerkleProof> getMerkle(List<HistoryEntry> transactions);

    // ---- addresses ----

    List<AddressBalance> getBalances(Map<String, String> scripthashToAddress);

    List<UnspentOutput> getUnspent(Map<String, String> scripthashToAddress);

    List<HistoryEntry> getMempool(Map<String, String> scripthashToAddress);

    List<HistoryEntry> getHistory(Map<String, String> scripthashToAddress);

    // ---- subscriptions ----

    /**
     * Subscribes to status changes of the given scripthashes. The listener is
     * called on the subscription executor with the caller's identifier.
     *
     * @return ids of the subscribe requests
     */
    List<Long> subscribeToScripthashes(Map<String, String> scripthashToAddress, ScripthashStatusListener listener);

    /**
     * Subscribes to new chain tips.
     *
     * @return id of the subscribe request
     */
    long subscribeToBlockHeaders(Consumer<BlockHeader> listener);

    // ---- raw access ----

    /**
     * Sends requests as one batch; results keep the order of {@code requests}
     * and carry server errors instead of throwing them.
     */
    List<RpcResult> sendAndAwaitAll(List<RpcRequest> requests);

    /**
     * Sends one request and returns its result data.
     *
     * @throws RpcException if the server answered with an error
     */
    @Nullable Object runCommand(RpcRequest request);

    @Override
    void close();
}
