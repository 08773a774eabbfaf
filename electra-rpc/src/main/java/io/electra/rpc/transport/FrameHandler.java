// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc.transport;

import java.util.concurrent.atomic.AtomicBoolean;

import io.electra.rpc.ServerDescriptor;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last pipeline stage: hands decoded lines to the {@link FrameListener} and
 * reports the end of the channel exactly once.
 */
final class FrameHandler extends SimpleChannelInboundHandler<String> {

    private static final Logger log = LoggerFactory.getLogger(FrameHandler.class);

    private final ServerDescriptor server;
    private final FrameListener listener;
    private final AtomicBoolean detached = new AtomicBoolean(false);
    private volatile @Nullable Throwable failure;

    FrameHandler(final ServerDescriptor server, final FrameListener listener) {
        this.server = server;
        this.listener = listener;
    }

    /**
     * Stops reporting to the listener; used when the client closes the channel itself.
     */
    void detach() {
        detached.set(true);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final String frame) {
        if (detached.get() || frame.isBlank()) {
            return;
        }
        listener.onFrame(frame);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (detached.compareAndSet(false, true)) {
            log.warn("Connection to {} lost", server);
            listener.onClosed(failure);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.warn("Channel exception on connection to {}: {}", server, cause.toString());
        failure = cause;
        ctx.close();
    }
}
