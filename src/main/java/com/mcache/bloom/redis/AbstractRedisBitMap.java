package com.mcache.bloom.redis;

import java.util.Collections;
import java.util.List;

import com.mcache.bloom.BitMap;
import com.mcache.bloom.FilterParameters;
import com.mcache.bloom.HashQuad;
import com.mcache.config.script.BloomScripts;
import com.mcache.exception.DataTypeException;

/**
 * Redis 位存储的公共部分：参数、脚本和返回值判断
 * k次循环整体放在一个Lua脚本里执行，Redis串行执行脚本，同一个key上的读写不会交错
 * 多个进程使用同一个key即共享同一个过滤器
 */
public abstract class AbstractRedisBitMap implements BitMap {

    /**
     * Redis 位图偏移量上限 2^32
     */
    public static final long MAX_BITS = 1L << 32;

    protected final long m;
    protected final int k;
    protected final String key;
    protected final BloomScripts scripts;

    protected AbstractRedisBitMap(FilterParameters params, String key, BloomScripts scripts) {
        FilterParameters p = params.floored();
        if (p.getM() > MAX_BITS) {
            throw new IllegalArgumentException("redis bitmap supports at most " + MAX_BITS + " bits, got " + p.getM());
        }
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("bloom key must not be empty");
        }
        this.m = p.getM();
        this.k = p.getK();
        this.key = key;
        this.scripts = scripts;
    }

    @Override
    public long m() {
        return m;
    }

    @Override
    public int k() {
        return k;
    }

    public String key() {
        return key;
    }

    protected List<String> keys() {
        return Collections.singletonList(key);
    }

    /**
     * 脚本参数：k, m, h0..h3
     */
    protected String[] args(HashQuad h) {
        return new String[] {
                String.valueOf(k), String.valueOf(m),
                h.hex(0), h.hex(1), h.hex(2), h.hex(3)
        };
    }

    /**
     * 脚本返回 1 表示全部置位，0 表示至少有一位未置位
     */
    protected static boolean toPresent(Long ret) {
        if (ret == null) {
            throw DataTypeException.of("Long", null);
        }
        return ret == 1L;
    }
}
