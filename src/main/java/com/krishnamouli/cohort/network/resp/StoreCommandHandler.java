package com.krishnamouli.cohort.network.resp;

import com.krishnamouli.cohort.core.SegmentedTtlMap;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Executes the Redis command subset the remote assignment store relies on
 * against a shared TTL map.
 */
public class StoreCommandHandler extends SimpleChannelInboundHandler<List<Object>> {
    private static final Logger logger = LoggerFactory.getLogger(StoreCommandHandler.class);

    private final SegmentedTtlMap<byte[]> store;

    public StoreCommandHandler(SegmentedTtlMap<byte[]> store) {
        this.store = store;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, List<Object> msg) {
        if (msg.isEmpty() || !(msg.get(0) instanceof byte[])) {
            ctx.writeAndFlush(new RESPEncoder.RESPError("ERR empty command"));
            return;
        }

        String command = arg(msg, 0).toUpperCase(Locale.ROOT);

        Object response;
        try {
            response = executeCommand(command, msg);
        } catch (NumberFormatException e) {
            response = new RESPEncoder.RESPError("ERR value is not an integer or out of range");
        } catch (ClassCastException e) {
            response = new RESPEncoder.RESPError("ERR arguments must be bulk strings");
        }
        ctx.writeAndFlush(response);
    }

    private Object executeCommand(String command, List<Object> args) {
        switch (command) {
            case "PING":
                return args.size() > 1 ? args.get(1) : "PONG";
            case "GET":
                return handleGet(args);
            case "SET":
                return handleSet(args);
            case "DEL":
                return handleDel(args);
            case "EXISTS":
                return handleExists(args);
            case "PEXPIRE":
                return handleExpire(args, 1);
            case "EXPIRE":
                return handleExpire(args, 1000);
            case "PTTL":
                return handleTtl(args, 1);
            case "TTL":
                return handleTtl(args, 1000);
            case "DBSIZE":
                return (long) store.size();
            case "FLUSHALL":
                store.clear();
                return "OK";
            case "INFO":
                return handleInfo();
            default:
                return new RESPEncoder.RESPError("ERR unknown command '" + command.toLowerCase(Locale.ROOT) + "'");
        }
    }

    private Object handleGet(List<Object> args) {
        if (args.size() != 2) {
            return wrongArity("get");
        }
        byte[] value = store.get(arg(args, 1));
        return value != null ? value : RESPEncoder.Nil.INSTANCE;
    }

    /**
     * SET key value [EX seconds | PX millis] [NX | XX]
     */
    private Object handleSet(List<Object> args) {
        if (args.size() < 3) {
            return wrongArity("set");
        }

        String key = arg(args, 1);
        byte[] value = (byte[]) args.get(2);
        long ttlMillis = 0;
        boolean onlyIfAbsent = false;
        boolean onlyIfPresent = false;

        for (int i = 3; i < args.size(); i++) {
            String option = arg(args, i).toUpperCase(Locale.ROOT);
            switch (option) {
                case "EX":
                case "PX":
                    if (i + 1 >= args.size()) {
                        return new RESPEncoder.RESPError("ERR syntax error");
                    }
                    long amount = Long.parseLong(arg(args, ++i));
                    if (amount <= 0) {
                        return new RESPEncoder.RESPError("ERR invalid expire time in 'set' command");
                    }
                    ttlMillis = "EX".equals(option) ? amount * 1000 : amount;
                    break;
                case "NX":
                    onlyIfAbsent = true;
                    break;
                case "XX":
                    onlyIfPresent = true;
                    break;
                default:
                    return new RESPEncoder.RESPError("ERR syntax error");
            }
        }

        if (onlyIfAbsent && onlyIfPresent) {
            return new RESPEncoder.RESPError("ERR syntax error");
        }
        if (onlyIfAbsent) {
            return store.putIfAbsent(key, value, ttlMillis) == null ? "OK" : RESPEncoder.Nil.INSTANCE;
        }
        if (onlyIfPresent && store.get(key) == null) {
            return RESPEncoder.Nil.INSTANCE;
        }
        store.put(key, value, ttlMillis);
        return "OK";
    }

    private Object handleDel(List<Object> args) {
        if (args.size() < 2) {
            return wrongArity("del");
        }
        long deleted = 0;
        for (int i = 1; i < args.size(); i++) {
            if (store.delete(arg(args, i))) {
                deleted++;
            }
        }
        return deleted;
    }

    private Object handleExists(List<Object> args) {
        if (args.size() < 2) {
            return wrongArity("exists");
        }
        long present = 0;
        for (int i = 1; i < args.size(); i++) {
            if (store.get(arg(args, i)) != null) {
                present++;
            }
        }
        return present;
    }

    private Object handleExpire(List<Object> args, long unitMillis) {
        if (args.size() != 3) {
            return wrongArity("expire");
        }
        long amount = Long.parseLong(arg(args, 2));
        String key = arg(args, 1);
        if (amount <= 0) {
            return store.delete(key) ? 1L : 0L;
        }
        return store.expire(key, amount * unitMillis) ? 1L : 0L;
    }

    private Object handleTtl(List<Object> args, long unitMillis) {
        if (args.size() != 2) {
            return wrongArity("ttl");
        }
        long ttl = store.ttlMillis(arg(args, 1));
        if (ttl < 0) {
            return ttl; // -2 missing, -1 no expiry
        }
        return unitMillis == 1 ? ttl : (ttl + unitMillis - 1) / unitMillis;
    }

    private Object handleInfo() {
        SegmentedTtlMap.Stats stats = store.getStats();
        String info = String.format(
                "# Assignment Store\r\n" +
                        "keys:%d\r\n" +
                        "hits:%d\r\n" +
                        "misses:%d\r\n" +
                        "hit_rate:%.2f\r\n" +
                        "evictions:%d\r\n",
                stats.size, stats.hits, stats.misses, stats.getHitRate() * 100, stats.evictions);
        return info.getBytes(StandardCharsets.UTF_8);
    }

    private static RESPEncoder.RESPError wrongArity(String command) {
        return new RESPEncoder.RESPError("ERR wrong number of arguments for '" + command + "' command");
    }

    private static String arg(List<Object> args, int index) {
        return new String((byte[]) args.get(index), StandardCharsets.UTF_8);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("Exception in store command handler", cause);
        ctx.close();
    }
}
