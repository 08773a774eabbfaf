// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc.transport;

import java.util.concurrent.atomic.AtomicBoolean;

import io.electra.core.error.TransportException;
import io.electra.rpc.ServerDescriptor;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

/**
 * {@link Connection} backed by a Netty channel.
 */
final class NettyConnection implements Connection {

    private final ServerDescriptor server;
    private final Channel channel;
    private final FrameHandler handler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    NettyConnection(final ServerDescriptor server, final Channel channel, final FrameHandler handler) {
        this.server = server;
        this.channel = channel;
        this.handler = handler;
    }

    @Override
    public void send(final String frame) {
        if (closed.get() || !channel.isActive()) {
            throw new TransportException("Connection to " + server + " is not open");
        }
        channel.writeAndFlush(frame + "\n").addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && channel.isActive();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        handler.detach();
        if (channel.eventLoop().inEventLoop()) {
            channel.close();
        } else {
            channel.close().syncUninterruptibly();
        }
    }

    @Override
    public String toString() {
        return "NettyConnection{" + server + ", " + channel.remoteAddress() + "}";
    }
}
