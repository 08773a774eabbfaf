// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc.transport;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import javax.net.ssl.SSLException;

import io.electra.core.error.TransportException;
import io.electra.rpc.ServerDescriptor;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens line-framed TCP or TLS connections on a shared Netty event loop.
 *
 * <p>
 * Every connection gets the pipeline
 * {@code [SslHandler] -> LineBasedFrameDecoder -> StringDecoder/StringEncoder -> FrameHandler}.
 * The event loop group is created here unless one is supplied, in which case
 * the caller owns its lifecycle.
 */
public final class NettyConnectionFactory implements ConnectionFactory, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NettyConnectionFactory.class);

    /** Longest line accepted from a server; large raw transactions fit comfortably. */
    static final int MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private final EventLoopGroup group;
    private final boolean ownsEventLoopGroup;
    private final Duration connectTimeout;
    private final SslContext sslContext;

    /**
     * @param ioThreads           I/O threads for an internally created group
     * @param eventLoopGroup      group to share, or {@code null} to create one
     * @param connectTimeout      TCP connect and TLS handshake timeout
     * @param trustAllCertificates accept any server certificate; ElectrumX servers
     *                             commonly use self-signed ones
     */
    public NettyConnectionFactory(
            final int ioThreads,
            final @Nullable EventLoopGroup eventLoopGroup,
            final Duration connectTimeout,
            final boolean trustAllCertificates) {
        if (eventLoopGroup != null) {
            this.group = eventLoopGroup;
            this.ownsEventLoopGroup = false;
        } else {
            ThreadFactory threadFactory = r -> {
                Thread t = new Thread(r, "electra-netty-io");
                t.setDaemon(true);
                return t;
            };
            this.group = new NioEventLoopGroup(ioThreads, threadFactory);
            this.ownsEventLoopGroup = true;
        }
        this.connectTimeout = connectTimeout;
        this.sslContext = buildSslContext(trustAllCertificates);
    }

    private static SslContext buildSslContext(final boolean trustAllCertificates) {
        try {
            SslContextBuilder builder = SslContextBuilder.forClient();
            if (trustAllCertificates) {
                builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
            }
            return builder.build();
        } catch (SSLException e) {
            throw new IllegalStateException("Cannot initialize TLS client context", e);
        }
    }

    @Override
    public Connection open(final ServerDescriptor server, final boolean useSsl, final FrameListener listener) {
        final Integer port = server.port(useSsl);
        if (port == null) {
            throw new TransportException(server + " has no " + (useSsl ? "TLS" : "TCP") + " port");
        }
        final FrameHandler handler = new FrameHandler(server, listener);

        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (useSsl) {
                            SslHandler sslHandler = sslContext.newHandler(ch.alloc(), server.host(), port);
                            sslHandler.setHandshakeTimeoutMillis(connectTimeout.toMillis());
                            p.addLast(sslHandler);
                        }
                        p.addLast(new LineBasedFrameDecoder(MAX_FRAME_LENGTH));
                        p.addLast(new StringDecoder(StandardCharsets.UTF_8));
                        p.addLast(new StringEncoder(StandardCharsets.UTF_8));
                        p.addLast(handler);
                    }
                });

        ChannelFuture connectFuture = null;
        try {
            connectFuture = b.connect(server.host(), port).sync();
            Channel channel = connectFuture.channel();
            SslHandler sslHandler = channel.pipeline().get(SslHandler.class);
            if (sslHandler != null) {
                sslHandler.handshakeFuture().sync();
            }
            log.debug("Connected to {}:{} ({})", server.host(), port, useSsl ? "tls" : "tcp");
            return new NettyConnection(server, channel, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(handler, connectFuture);
            throw new TransportException("Interrupted while connecting to " + server.host() + ":" + port, e);
        } catch (Exception e) {
            closeQuietly(handler, connectFuture);
            throw new TransportException("Failed to connect to " + server.host() + ":" + port + ": " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(final FrameHandler handler, final @Nullable ChannelFuture connectFuture) {
        handler.detach();
        if (connectFuture != null && connectFuture.channel().isOpen()) {
            connectFuture.channel().close();
        }
    }

    @Override
    public void close() {
        if (!ownsEventLoopGroup) {
            return;
        }
        try {
            group.shutdownGracefully(0, 5, TimeUnit.SECONDS).sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down EventLoopGroup", e);
        } catch (Exception e) {
            log.warn("Error shutting down EventLoopGroup", e);
        }
    }
}
