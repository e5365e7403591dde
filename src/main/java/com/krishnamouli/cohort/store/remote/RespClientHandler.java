package com.krishnamouli.cohort.store.remote;

import com.krishnamouli.cohort.store.StoreUnavailableException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Matches replies to commands. The protocol answers in request order, so
 * pending futures are completed strictly FIFO.
 */
class RespClientHandler extends SimpleChannelInboundHandler<Object> {
    private static final Logger logger = LoggerFactory.getLogger(RespClientHandler.class);

    private final Queue<CompletableFuture<Object>> pending = new ConcurrentLinkedQueue<>();

    void enqueue(CompletableFuture<Object> reply) {
        pending.add(reply);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        CompletableFuture<Object> reply = pending.poll();
        if (reply == null) {
            logger.warn("Unsolicited reply from assignment store: {}", msg);
            return;
        }
        reply.complete(msg);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        failAll(new StoreUnavailableException("Connection to assignment store closed"));
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.warn("Assignment store connection failed: {}", cause.toString());
        failAll(new StoreUnavailableException("Assignment store connection failed", cause));
        ctx.close();
    }

    private void failAll(StoreUnavailableException cause) {
        CompletableFuture<Object> reply;
        while ((reply = pending.poll()) != null) {
            reply.completeExceptionally(cause);
        }
    }
}
