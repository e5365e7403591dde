package com.krishnamouli.cohort.network.resp;

import com.krishnamouli.cohort.config.CohortDefaults;
import com.krishnamouli.cohort.core.SegmentedTtlMap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Netty server speaking the Redis protocol over a shared TTL map. Engine
 * instances on other hosts point their remote assignment store at it so a
 * subject keeps its variant whichever instance serves the request.
 */
public class RespStoreServer {
    private static final Logger logger = LoggerFactory.getLogger(RespStoreServer.class);

    private final int port;
    private final int workerThreads;
    private final SegmentedTtlMap<byte[]> store;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    /**
     * @param port port to bind; 0 picks a free one (see {@link #getBoundPort()})
     */
    public RespStoreServer(int port, int workerThreads, SegmentedTtlMap<byte[]> store) {
        this.port = port;
        this.workerThreads = workerThreads;
        this.store = store;
    }

    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(workerThreads);

        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_BACKLOG, CohortDefaults.TCP_BACKLOG_SIZE)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline pipeline = ch.pipeline();
                            pipeline.addLast(new RESPDecoder());
                            pipeline.addLast(new RESPEncoder());
                            pipeline.addLast(new StoreCommandHandler(store));
                        }
                    });

            ChannelFuture future = bootstrap.bind(port).sync();
            serverChannel = future.channel();

            logger.info("Assignment store server started on port {}", getBoundPort());

        } catch (InterruptedException e) {
            logger.error("Failed to start assignment store server", e);
            shutdown();
            throw e;
        }
    }

    public int getBoundPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void shutdown() {
        logger.info("Shutting down assignment store server...");

        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly();
        }

        if (workerGroup != null) {
            workerGroup.shutdownGracefully().awaitUninterruptibly();
        }

        if (bossGroup != null) {
            bossGroup.shutdownGracefully().awaitUninterruptibly();
        }

        logger.info("Assignment store server shutdown complete");
    }

    public void awaitTermination() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }
}
