package com.krishnamouli.cohort.network.http;

import com.krishnamouli.cohort.config.CohortConfig;
import com.krishnamouli.cohort.config.CohortDefaults;
import com.krishnamouli.cohort.engine.AssignmentEngine;
import com.krishnamouli.cohort.events.EventRecorder;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * HTTP server for the assignment and tracking API.
 */
public class HTTPServer {
    private static final Logger logger = LoggerFactory.getLogger(HTTPServer.class);

    private final CohortConfig config;
    private final AssignmentEngine engine;
    private final EventRecorder recorder;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel serverChannel;

    public HTTPServer(CohortConfig config, AssignmentEngine engine, EventRecorder recorder) {
        this.config = config;
        this.engine = engine;
        this.recorder = recorder;
    }

    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        // Remote store calls block; keep them off the I/O threads
        handlerGroup = new DefaultEventExecutorGroup(config.getWorkerThreads());

        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_BACKLOG, CohortDefaults.TCP_BACKLOG_SIZE)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline pipeline = ch.pipeline();
                            pipeline.addLast(new HttpServerCodec());
                            // Max request size to prevent DoS
                            pipeline.addLast(new HttpObjectAggregator(CohortDefaults.HTTP_MAX_CONTENT_LENGTH));
                            pipeline.addLast(handlerGroup, new HTTPApiHandler(engine, recorder));
                        }
                    });

            ChannelFuture future = bootstrap.bind(config.getHttpPort()).sync();
            serverChannel = future.channel();

            logger.info("HTTP API server started on port {}", getBoundPort());
            logger.info("Endpoints: POST /assign, /assignment, /track; GET /assignment, /results, /config, "
                    + "/experiments, /health, /metrics, /stats");

        } catch (InterruptedException e) {
            logger.error("Failed to start HTTP server", e);
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
        logger.info("Shutting down HTTP server...");

        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly();
        }

        if (workerGroup != null) {
            workerGroup.shutdownGracefully().awaitUninterruptibly();
        }

        if (bossGroup != null) {
            bossGroup.shutdownGracefully().awaitUninterruptibly();
        }

        if (handlerGroup != null) {
            handlerGroup.shutdownGracefully().awaitUninterruptibly();
        }

        logger.info("HTTP server shutdown complete");
    }

    public void awaitTermination() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }
}
