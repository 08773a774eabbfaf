// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;
import java.util.function.Consumer;

import io.electra.core.error.ElectraException;
import io.electra.core.error.PushProtocolViolationException;
import io.electra.core.error.TransportException;
import io.electra.core.model.AddressBalance;
import io.electra.core.model.BlockHeader;
import io.electra.core.model.HistoryEntry;
import io.electra.core.model.MerkleProof;
import io.electra.core.model.PeerServer;
import io.electra.core.model.ServerVersion;
import io.electra.core.model.UnspentOutput;
import io.electra.rpc.internal.ResultMapper;
import io.electra.rpc.transport.ConnectionFactory;
import io.electra.rpc.transport.NettyConnectionFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ElectrumClient}: a {@link FailoverController} owning the
 * session, a {@link RequestBatcher} for calls, a {@link SubscriptionRegistry}
 * for pushes and a {@link FeeCache}.
 */
public final class DefaultElectrumClient implements ElectrumClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultElectrumClient.class);

    static final String SERVER_BANNER = "server.banner";
    static final String SERVER_DONATION_ADDRESS = "server.donation_address";
    static final String SERVER_FEATURES = "server.features";
    static final String SERVER_PEERS = "server.peers.subscribe";
    static final String ESTIMATE_FEE = "blockchain.estimatefee";
    static final String RELAY_FEE = "blockchain.relayfee";
    static final String BROADCAST = "blockchain.transaction.broadcast";
    static final String GET_TRANSACTION = "blockchain.transaction.get";
    static final String GET_MERKLE = "blockchain.transaction.get_merkle";
    static final String BLOCK_HEADER = "blockchain.block.header";
    static final String GET_BALANCE = "blockchain.scripthash.get_balance";
    static final String LIST_UNSPENT = "blockchain.scripthash.listunspent";
    static final String GET_MEMPOOL = "blockchain.scripthash.get_mempool";
    static final String GET_HISTORY = "blockchain.scripthash.get_history";

    private final ElectrumClientConfig config;
    private final ConnectionFactory connectionFactory;
    private final @Nullable AutoCloseable ownedTransport;
    private final @Nullable ExecutorService ownedSubscriptionExecutor;
    private final SubscriptionRegistry subscriptions;
    private final FailoverController controller;
    private final RequestBatcher batcher;
    private final FeeCache feeCache;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile @Nullable PushProtocolViolationException fatalError;

    DefaultElectrumClient(
            final ServerRegistry registry,
            final ElectrumClientConfig config,
            final ConnectionFactory connectionFactory,
            final @Nullable AutoCloseable ownedTransport,
            final Clock clock) {
        this.config = config;
        this.connectionFactory = connectionFactory;
        this.ownedTransport = ownedTransport;

        final Executor executor;
        if (config.subscriptionExecutor() != null) {
            executor = config.subscriptionExecutor();
            this.ownedSubscriptionExecutor = null;
        } else {
            this.ownedSubscriptionExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "electra-subscriptions");
                t.setDaemon(true);
                return t;
            });
            executor = ownedSubscriptionExecutor;
        }

        this.subscriptions = new SubscriptionRegistry(executor);
        this.controller = new FailoverController(registry, this::openSession, config.maxServers(), config.metrics());
        this.controller.addSessionListener(subscriptions::resubscribe);
        this.batcher = new RequestBatcher(controller, config.requestTimeout());
        this.feeCache = new FeeCache(this::estimateFee, clock);
    }

    /**
     * Creates a client on a Netty transport and connects it.
     */
    public static DefaultElectrumClient connect(final ServerRegistry registry, final ElectrumClientConfig config) {
        final NettyConnectionFactory transport = new NettyConnectionFactory(
                config.ioThreads(), config.eventLoopGroup(), config.connectTimeout(), config.trustAllCertificates());
        final DefaultElectrumClient client =
                new DefaultElectrumClient(registry, config, transport, transport, Clock.systemUTC());
        try {
            client.start();
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
        return client;
    }

    void start() {
        controller.session();
    }

    private Session openSession(final ServerDescriptor server) {
        final Session session = new Session(server, subscriptions::dispatch, this::onSessionFailure, config.metrics());
        try {
            session.connect(connectionFactory, config.useSsl());
            session.handshake(
                    config.clientName(),
                    config.minProtocolVersion(),
                    config.maxProtocolVersion(),
                    config.requestTimeout());
            return session;
        } catch (TransportException e) {
            session.close();
            throw e;
        }
    }

    private void onSessionFailure(final ElectraException cause) {
        if (cause instanceof PushProtocolViolationException violation) {
            log.error("Client is no longer usable: {}", violation.getMessage());
            fatalError = violation;
        } else {
            log.debug("Session failed, next call fails over: {}", cause.getMessage());
        }
    }

    private void ensureUsable() {
        if (closed.get()) {
            throw new IllegalStateException("Client is closed");
        }
        final PushProtocolViolationException fatal = fatalError;
        if (fatal != null) {
            throw fatal;
        }
    }

    // ---- server ----

    @Override
    public ServerVersion serverVersion() {
        ensureUsable();
        final ServerVersion version = controller.session().serverVersion();
        if (version == null) {
            throw new IllegalStateException("Session has not completed its handshake");
        }
        return version;
    }

    @Override
    public String serverBanner() {
        return ResultMapper.toText(runCommand(RpcRequest.of(SERVER_BANNER)), SERVER_BANNER);
    }

    @Override
    public String serverDonationAddress() {
        return ResultMapper.toText(runCommand(RpcRequest.of(SERVER_DONATION_ADDRESS)), SERVER_DONATION_ADDRESS);
    }

    @Override
    public Map<String, Object> serverFeatures() {
        return ResultMapper.asMap(runCommand(RpcRequest.of(SERVER_FEATURES)), SERVER_FEATURES);
    }

    @Override
    public List<PeerServer> serverPeers() {
        return ResultMapper.toPeers(runCommand(RpcRequest.of(SERVER_PEERS)));
    }

    @Override
    public @Nullable ServerDescriptor currentServer() {
        return controller.currentServer();
    }

    // ---- fees ----

    @Override
    public BigDecimal estimateFee(final int targetBlocks) {
        return ResultMapper.toDecimal(runCommand(RpcRequest.of(ESTIMATE_FEE, targetBlocks)), ESTIMATE_FEE);
    }

    @Override
    public BigDecimal estimateFeeCached(final int targetBlocks) {
        return estimateFeeCached(targetBlocks, FeeCache.DEFAULT_TTL);
    }

    @Override
    public BigDecimal estimateFeeCached(final int targetBlocks, final Duration ttl) {
        ensureUsable();
        return feeCache.estimateFeeCached(targetBlocks, ttl);
    }

    @Override
    public BigDecimal relayFee() {
        return ResultMapper.toDecimal(runCommand(RpcRequest.of(RELAY_FEE)), RELAY_FEE);
    }

    // ---- transactions and blocks ----

    @Override
    public String broadcastTransaction(final String rawTransactionHex) {
        Objects.requireNonNull(rawTransactionHex, "rawTransactionHex");
        return ResultMapper.toText(runCommand(RpcRequest.of(BROADCAST, rawTransactionHex)), BROADCAST);
    }

    @Override
    public List<String> getTransactions(final List<String> txHashes) {
        final List<RpcRequest> requests = new ArrayList<>(txHashes.size());
        for (String txHash : txHashes) {
            requests.add(RpcRequest.of(GET_TRANSACTION, txHash));
        }
        final List<String> transactions = new ArrayList<>(txHashes.size());
        for (RpcResult result : sendAndAwaitAll(requests)) {
            transactions.add(ResultMapper.toText(result.dataOrThrow(), GET_TRANSACTION));
        }
        return transactions;
    }

    @Override
    public List<BlockHeader> blockHeaders(final List<Long> heights) {
        final List<RpcRequest> requests = new ArrayList<>(heights.size());
        for (Long height : heights) {
            requests.add(RpcRequest.of(BLOCK_HEADER, height));
        }
        final List<BlockHeader> headers = new ArrayList<>(heights.size());
        for (RpcResult result : sendAndAwaitAll(requests)) {
            final long height = ((Number) result.firstParam()).longValue();
            headers.add(new BlockHeader(height, ResultMapper.toText(result.dataOrThrow(), BLOCK_HEADER)));
        }
        return headers;
    }

    @Override
    public List<MerkleProof> getMerkle(final List<HistoryEntry> transactions) {
        final List<RpcRequest> requests = new ArrayList<>(transactions.size());
        for (HistoryEntry tx : transactions) {
            requests.add(RpcRequest.of(GET_MERKLE, tx.txHash(), tx.height()));
        }
        final List<MerkleProof> proofs = new ArrayList<>(transactions.size());
        for (RpcResult result : sendAndAwaitAll(requests)) {
            proofs.add(ResultMapper.toMerkleProof(String.valueOf(result.firstParam()), result.dataOrThrow()));
        }
        return proofs;
    }

    // ---- addresses ----

    @Override
    public List<AddressBalance> getBalances(final Map<String, String> scripthashToAddress) {
        return perScripthash(GET_BALANCE, scripthashToAddress,
                (address, data) -> List.of(ResultMapper.toBalance(address, data)));
    }

    @Override
    public List<UnspentOutput> getUnspent(final Map<String, String> scripthashToAddress) {
        return perScripthash(LIST_UNSPENT, scripthashToAddress, ResultMapper::toUnspent);
    }

    @Override
    public List<HistoryEntry> getMempool(final Map<String, String> scripthashToAddress) {
        return perScripthash(GET_MEMPOOL, scripthashToAddress,
                (address, data) -> ResultMapper.toHistory(address, data, GET_MEMPOOL));
    }

    @Override
    public List<HistoryEntry> getHistory(final Map<String, String> scripthashToAddress) {
        return perScripthash(GET_HISTORY, scripthashToAddress,
                (address, data) -> ResultMapper.toHistory(address, data, GET_HISTORY));
    }

    /**
     * Calls {@code method} once per scripthash in one batch and maps every
     * result back to its address through the scripthash it was sent with.
     */
    private <T> List<T> perScripthash(
            final String method,
            final Map<String, String> scripthashToAddress,
            final BiFunction<String, Object, List<T>> mapper) {
        final List<RpcRequest> requests = new ArrayList<>(scripthashToAddress.size());
        for (String scripthash : scripthashToAddress.keySet()) {
            requests.add(RpcRequest.of(method, scripthash));
        }
        final List<T> items = new ArrayList<>();
        for (RpcResult result : sendAndAwaitAll(requests)) {
            final Object data = result.dataOrThrow();
            final String address = scripthashToAddress.get(String.valueOf(result.firstParam()));
            items.addAll(mapper.apply(address, data));
        }
        return items;
    }

    // ---- subscriptions ----

    @Override
    public List<Long> subscribeToScripthashes(
            final Map<String, String> scripthashToAddress,
            final ScripthashStatusListener listener) {
        ensureUsable();
        final Session session = controller.session();
        subscriptions.registerScripthashes(scripthashToAddress, listener);
        try {
            return subscriptions.sendScripthashSubscribes(session, scripthashToAddress.keySet());
        } catch (TransportException e) {
            // the replacement session re-issues every registered subscription
            controller.failover(session, e);
            return subscriptions.lastRequestIds(scripthashToAddress.keySet());
        }
    }

    @Override
    public long subscribeToBlockHeaders(final Consumer<BlockHeader> listener) {
        ensureUsable();
        final Session session = controller.session();
        subscriptions.addHeaderListener(listener);
        try {
            return subscriptions.sendHeadersSubscribe(session, listener);
        } catch (TransportException e) {
            try {
                controller.failover(session, e);
            } catch (RuntimeException failoverError) {
                subscriptions.removeHeaderListener(listener);
                throw failoverError;
            }
            return subscriptions.lastHeadersRequestId();
        }
    }

    // ---- raw access ----

    @Override
    public List<RpcResult> sendAndAwaitAll(final List<RpcRequest> requests) {
        ensureUsable();
        return batcher.sendAndAwaitAll(requests);
    }

    @Override
    public @Nullable Object runCommand(final RpcRequest request) {
        ensureUsable();
        return batcher.runCommand(request);
    }

    SubscriptionRegistry subscriptions() {
        return subscriptions;
    }

    FailoverController controller() {
        return controller;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        controller.close();

        // User-provided executors are not closed; the caller manages their lifecycle.
        if (ownedSubscriptionExecutor != null) {
            ownedSubscriptionExecutor.shutdown();
            try {
                if (!ownedSubscriptionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedSubscriptionExecutor.shutdownNow();
                    log.warn("Subscription executor did not terminate gracefully");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ownedSubscriptionExecutor.shutdownNow();
                log.warn("Interrupted while shutting down subscription executor", e);
            }
        }

        if (ownedTransport != null) {
            try {
                ownedTransport.close();
            } catch (Exception e) {
                log.warn("Error closing transport", e);
            }
        }
    }
}
