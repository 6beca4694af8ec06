package com.mcache.bloom.redis;

import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.ReturnType;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import com.mcache.bloom.FilterParameters;
import com.mcache.bloom.HashQuad;
import com.mcache.config.script.BloomScripts;
import com.mcache.exception.DataTypeException;
import com.mcache.exception.NoBackendException;

import lombok.extern.slf4j.Slf4j;

/**
 * 基于原始 RedisConnection 的 Redis 位存储
 * 每次调用从 connectionSupplier 取一个连接，用完关闭，例如 {@code factory::getConnection}
 * 先 EVALSHA，服务端没有缓存脚本时回退到 EVAL；返回值是通用对象，需要做类型检查
 */
@Slf4j
public class ConnectionRedisBitMap extends AbstractRedisBitMap {

    private final Supplier<RedisConnection> connectionSupplier;

    public ConnectionRedisBitMap(FilterParameters params, String key, Supplier<RedisConnection> connectionSupplier) {
        this(params, key, connectionSupplier, BloomScripts.shared());
    }

    public ConnectionRedisBitMap(FilterParameters params, String key, Supplier<RedisConnection> connectionSupplier,
            BloomScripts scripts) {
        super(params, key, scripts);
        this.connectionSupplier = connectionSupplier;
    }

    @Override
    public void setAll(HashQuad h) {
        run(scripts.setAll(), h);
    }

    @Override
    public boolean testAll(HashQuad h) {
        return toPresent(toLong(run(scripts.testAll(), h)));
    }

    @Override
    public boolean testAddAll(HashQuad h) {
        return toPresent(toLong(run(scripts.testAddAll(), h)));
    }

    @Override
    public void clearAll() {
        try (RedisConnection connection = connection()) {
            Long deleted = connection.keyCommands().del(bytes(key));
            log.debug("clear bloom key: {}, deleted: {}", key, deleted);
        }
    }

    private Object run(DefaultRedisScript<Long> script, HashQuad h) {
        byte[][] keysAndArgs = keysAndArgs(h);
        try (RedisConnection connection = connection()) {
            try {
                return connection.scriptingCommands().evalSha(script.getSha1(), ReturnType.INTEGER, 1, keysAndArgs);
            } catch (RuntimeException e) {
                if (!isNoScript(e)) {
                    throw e;
                }
                log.debug("script {} not cached on server, falling back to EVAL", script.getSha1());
                return connection.scriptingCommands().eval(bytes(script.getScriptAsString()), ReturnType.INTEGER, 1,
                        keysAndArgs);
            }
        }
    }

    private RedisConnection connection() {
        RedisConnection connection = connectionSupplier == null ? null : connectionSupplier.get();
        if (connection == null) {
            throw new NoBackendException("no redis connection for bloom key: " + key);
        }
        return connection;
    }

    private byte[][] keysAndArgs(HashQuad h) {
        String[] args = args(h);
        byte[][] keysAndArgs = new byte[args.length + 1][];
        keysAndArgs[0] = bytes(key);
        for (int i = 0; i < args.length; i++) {
            keysAndArgs[i + 1] = bytes(args[i]);
        }
        return keysAndArgs;
    }

    /**
     * 只接受整数回复，布尔、大整数或其他表示一律视为类型错误
     */
    static Long toLong(Object reply) {
        if (reply instanceof Long) {
            return (Long) reply;
        }
        throw DataTypeException.of("Long", reply);
    }

    static boolean isNoScript(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && message.contains("NOSCRIPT")) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
