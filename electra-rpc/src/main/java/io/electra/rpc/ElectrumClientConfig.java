// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.time.Duration;
import java.util.concurrent.Executor;

import io.netty.channel.EventLoopGroup;
import org.jspecify.annotations.Nullable;

/**
 * Configuration for {@link ElectrumClient}.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * ElectrumClientConfig config = ElectrumClientConfig.builder()
 *         .requestTimeout(Duration.ofSeconds(30))
 *         .maxServers(3)
 *         .clientName("my-wallet")
 *         .build();
 *
 * ElectrumClient client = ElectrumClient.connect(ServerCatalog.bundled(ServerCatalog.BITCOIN), config);
 * }</pre>
 *
 * @param useSsl               connect over TLS (the catalog's {@code "s"} ports) instead of
 *                             plaintext TCP ({@code "t"} ports)
 * @param requestTimeout       time a whole batch may take before its server is abandoned
 * @param connectTimeout       TCP connect and TLS handshake timeout
 * @param maxServers           distinct servers tried in one failover sequence before giving up
 * @param clientName           name sent in the {@code server.version} handshake
 * @param minProtocolVersion   lowest acceptable protocol version
 * @param maxProtocolVersion   highest acceptable protocol version
 * @param ioThreads            Netty I/O threads; ignored when {@code eventLoopGroup} is set
 * @param eventLoopGroup       shared Netty group, owned by the caller
 * @param trustAllCertificates accept self-signed server certificates
 * @param subscriptionExecutor runs subscription listeners, owned by the caller; a
 *                             single daemon thread is used when absent
 * @param metrics              metrics sink
 */
public record ElectrumClientConfig(
        boolean useSsl,
        Duration requestTimeout,
        Duration connectTimeout,
        int maxServers,
        String clientName,
        String minProtocolVersion,
        String maxProtocolVersion,
        int ioThreads,
        @Nullable EventLoopGroup eventLoopGroup,
        boolean trustAllCertificates,
        @Nullable Executor subscriptionExecutor,
        ElectraMetrics metrics) {

    // Defaults
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(15);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final int DEFAULT_MAX_SERVERS = 5;
    private static final String DEFAULT_CLIENT_NAME = "electra";
    static final String DEFAULT_PROTOCOL_VERSION = "1.4";
    private static final int DEFAULT_IO_THREADS = 1;

    /**
     * Compact constructor with validation and defaults.
     */
    public ElectrumClientConfig {
        if (requestTimeout == null)
            requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        if (connectTimeout == null)
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        if (maxServers <= 0)
            maxServers = DEFAULT_MAX_SERVERS;
        if (clientName == null || clientName.isBlank())
            clientName = DEFAULT_CLIENT_NAME;
        if (minProtocolVersion == null)
            minProtocolVersion = DEFAULT_PROTOCOL_VERSION;
        if (maxProtocolVersion == null)
            maxProtocolVersion = DEFAULT_PROTOCOL_VERSION;
        if (ioThreads <= 0)
            ioThreads = DEFAULT_IO_THREADS;
        if (metrics == null)
            metrics = ElectraMetrics.noop();

        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive, got: " + requestTimeout);
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive, got: " + connectTimeout);
        }
        if (compareVersions(minProtocolVersion, maxProtocolVersion) > 0) {
            throw new IllegalArgumentException(
                    "minProtocolVersion (" + minProtocolVersion + ") must be <= maxProtocolVersion ("
                            + maxProtocolVersion + ")");
        }
    }

    /**
     * Compares dotted version strings numerically, so {@code 1.10 > 1.4}.
     */
    static int compareVersions(final String a, final String b) {
        final String[] left = a.split("\\.");
        final String[] right = b.split("\\.");
        for (int i = 0; i < Math.max(left.length, right.length); i++) {
            final int l = i < left.length ? parsePart(left[i], a) : 0;
            final int r = i < right.length ? parsePart(right[i], b) : 0;
            if (l != r) {
                return Integer.compare(l, r);
            }
        }
        return 0;
    }

    private static int parsePart(final String part, final String version) {
        try {
            return Integer.parseInt(part);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid protocol version: " + version, e);
        }
    }

    /**
     * Creates a configuration with all defaults.
     */
    public static ElectrumClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ElectrumClientConfig}.
     */
    public static final class Builder {
        private boolean useSsl = true;
        private Duration requestTimeout = null;
        private Duration connectTimeout = null;
        private int maxServers = 0;
        private String clientName = null;
        private String minProtocolVersion = null;
        private String maxProtocolVersion = null;
        private int ioThreads = 0;
        private EventLoopGroup eventLoopGroup = null;
        private boolean trustAllCertificates = false;
        private Executor subscriptionExecutor = null;
        private ElectraMetrics metrics = null;

        private Builder() {
        }

        /**
         * Selects TLS or plaintext TCP. Default: TLS.
         */
        public Builder useSsl(boolean useSsl) {
            this.useSsl = useSsl;
            return this;
        }

        /**
         * Sets the batch timeout. Default: 15 seconds.
         */
        public Builder requestTimeout(Duration timeout) {
            this.requestTimeout = timeout;
            return this;
        }

        /**
         * Sets the connection timeout. Default: 10 seconds.
         */
        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        /**
         * Sets how many distinct servers one failover sequence may try. Default: 5.
         */
        public Builder maxServers(int maxServers) {
            this.maxServers = maxServers;
            return this;
        }

        /**
         * Sets the client name sent in the handshake. Default: {@code electra}.
         */
        public Builder clientName(String clientName) {
            this.clientName = clientName;
            return this;
        }

        /**
         * Sets the acceptable protocol range. Default: 1.4 to 1.4.
         */
        public Builder protocolVersion(String min, String max) {
            this.minProtocolVersion = min;
            this.maxProtocolVersion = max;
            return this;
        }

        /**
         * Sets the number of Netty I/O threads. Default: 1.
         * Ignored if eventLoopGroup is provided.
         */
        public Builder ioThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        /**
         * Shares an existing Netty EventLoopGroup.
         * The caller is responsible for shutting down this group.
         */
        public Builder eventLoopGroup(EventLoopGroup group) {
            this.eventLoopGroup = group;
            return this;
        }

        /**
         * Accepts any server certificate. Default: false.
         */
        public Builder trustAllCertificates(boolean trustAll) {
            this.trustAllCertificates = trustAll;
            return this;
        }

        /**
         * Runs subscription listeners on the given executor.
         * The caller is responsible for shutting it down.
         */
        public Builder subscriptionExecutor(Executor executor) {
            this.subscriptionExecutor = executor;
            return this;
        }

        public Builder metrics(ElectraMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public ElectrumClientConfig build() {
            return new ElectrumClientConfig(
                    useSsl,
                    requestTimeout,
                    connectTimeout,
                    maxServers,
                    clientName,
                    minProtocolVersion,
                    maxProtocolVersion,
                    ioThreads,
                    eventLoopGroup,
                    trustAllCertificates,
                    subscriptionExecutor,
                    metrics);
        }
    }
}
