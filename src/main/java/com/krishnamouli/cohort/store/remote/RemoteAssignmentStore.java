package com.krishnamouli.cohort.store.remote;

import com.krishnamouli.cohort.network.resp.RESPDecoder;
import com.krishnamouli.cohort.network.resp.RESPEncoder;
import com.krishnamouli.cohort.store.Assignment;
import com.krishnamouli.cohort.store.AssignmentCodec;
import com.krishnamouli.cohort.store.AssignmentStore;
import com.krishnamouli.cohort.store.StoreUnavailableException;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sticky store shared by every engine instance, kept in a Redis-compatible
 * server. Records are the JSON assignment documents under
 * {@code cookiePrefix + experimentId + "_" + subjectId} with the server-side
 * TTL set to the assignment's remaining lifetime.
 *
 * <p>
 * Every command is bounded by the configured timeout and fails with
 * {@link StoreUnavailableException}. The connection is opened lazily and
 * re-opened on the next command after a failure.
 */
public class RemoteAssignmentStore implements AssignmentStore {
    private static final Logger logger = LoggerFactory.getLogger(RemoteAssignmentStore.class);

    private final String host;
    private final int port;
    private final String prefix;
    private final long timeoutMillis;
    private final Clock clock;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final Object connectionLock = new Object();
    private volatile Channel channel;
    private volatile boolean closed;

    public RemoteAssignmentStore(String host, int port, String cookiePrefix, Duration timeout) {
        this(host, port, cookiePrefix, timeout, Clock.systemUTC());
    }

    public RemoteAssignmentStore(String host, int port, String cookiePrefix, Duration timeout, Clock clock) {
        this.host = host;
        this.port = port;
        this.prefix = cookiePrefix;
        this.timeoutMillis = Math.max(1, timeout.toMillis());
        this.clock = clock;
        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeoutMillis))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new RESPDecoder());
                        ch.pipeline().addLast(new RESPEncoder());
                        ch.pipeline().addLast(new RespClientHandler());
                    }
                });
        logger.info("Remote assignment store configured for {}:{} (timeout {}ms)", host, port, timeoutMillis);
    }

    @Override
    public Optional<Assignment> get(String experimentId, String subjectId) {
        Object reply = execute("GET", key(experimentId, subjectId));
        if (!(reply instanceof byte[])) {
            return Optional.empty();
        }
        Optional<Assignment> assignment = AssignmentCodec.decode(new String((byte[]) reply, StandardCharsets.UTF_8));
        if (assignment.isEmpty() || assignment.get().isExpired(clock.instant())) {
            return Optional.empty();
        }
        return assignment;
    }

    @Override
    public void put(String experimentId, String subjectId, Assignment assignment) {
        write(key(experimentId, subjectId), assignment, false);
    }

    /**
     * Relies on {@code SET ... NX} so concurrent first requests on different
     * instances converge on one stored variant.
     */
    @Override
    public void set(String experimentId, String subjectId, String variantId, Duration ttl) {
        write(key(experimentId, subjectId), Assignment.of(variantId, clock.instant(), ttl), true);
    }

    @Override
    public boolean remove(String experimentId, String subjectId) {
        Object reply = execute("DEL", key(experimentId, subjectId));
        return reply instanceof Long && (Long) reply > 0;
    }

    @Override
    public void close() {
        closed = true;
        synchronized (connectionLock) {
            if (channel != null) {
                channel.close().awaitUninterruptibly();
                channel = null;
            }
        }
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
        logger.info("Remote assignment store closed");
    }

    private void write(String key, Assignment assignment, boolean onlyIfAbsent) {
        Instant now = clock.instant();
        if (assignment.isExpired(now)) {
            execute("DEL", key);
            return;
        }

        List<String> command = new ArrayList<>(6);
        command.add("SET");
        command.add(key);
        command.add(AssignmentCodec.encode(assignment));
        if (assignment.getExpiresAt() != null) {
            command.add("PX");
            command.add(String.valueOf(Math.max(1, assignment.remaining(now).toMillis())));
        }
        if (onlyIfAbsent) {
            command.add("NX");
        }
        execute(command.toArray(new String[0]));
    }

    private String key(String experimentId, String subjectId) {
        return AssignmentStore.key(prefix, experimentId, subjectId);
    }

    /**
     * Sends one command and waits for its reply.
     *
     * @throws StoreUnavailableException on connect failure, timeout or an
     *                                   error reply
     */
    Object execute(String... args) {
        List<Object> command = new ArrayList<>(args.length);
        for (String arg : args) {
            command.add(arg.getBytes(StandardCharsets.UTF_8));
        }

        Channel ch = connect();
        RespClientHandler replies = ch.pipeline().get(RespClientHandler.class);
        if (replies == null) {
            throw new StoreUnavailableException("Assignment store connection is closing");
        }
        CompletableFuture<Object> reply = new CompletableFuture<>();

        // Enqueue and write together so reply order matches queue order
        synchronized (replies) {
            replies.enqueue(reply);
            ch.writeAndFlush(command).addListener((ChannelFutureListener) f -> {
                if (!f.isSuccess()) {
                    reply.completeExceptionally(
                            new StoreUnavailableException("Failed to send " + args[0], f.cause()));
                }
            });
        }

        Object result;
        try {
            result = reply.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // A late reply would be matched to the next command; start over
            ch.close();
            throw new StoreUnavailableException(args[0] + " timed out after " + timeoutMillis + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted waiting for " + args[0], e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StoreUnavailableException) {
                throw (StoreUnavailableException) cause;
            }
            throw new StoreUnavailableException(args[0] + " failed", cause);
        }

        if (result instanceof RESPEncoder.RESPError) {
            throw new StoreUnavailableException("Assignment store rejected " + args[0] + ": " + result);
        }
        return result;
    }

    private Channel connect() {
        Channel current = channel;
        if (current != null && current.isActive()) {
            return current;
        }
        synchronized (connectionLock) {
            if (closed) {
                throw new StoreUnavailableException("Remote assignment store is closed");
            }
            if (channel != null && channel.isActive()) {
                return channel;
            }
            ChannelFuture future = bootstrap.connect(host, port);
            if (!future.awaitUninterruptibly(timeoutMillis) || !future.isSuccess()) {
                future.cancel(false);
                future.channel().close();
                throw new StoreUnavailableException(
                        "Cannot connect to assignment store at " + host + ":" + port, future.cause());
            }
            channel = future.channel();
            logger.info("Connected to assignment store at {}:{}", host, port);
            return channel;
        }
    }
}
