package com.mcache.bloom;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import com.google.common.base.Strings;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * 一个key的4个64位基础哈希值，按无符号数解释
 * 只计算一次，之后通过双重哈希推导出任意第i个位置，不需要对key重复哈希
 */
public final class HashQuad {

    private static final HashFunction MURMUR = Hashing.murmur3_128();

    private final long[] h;

    private HashQuad(long h0, long h1, long h2, long h3) {
        this.h = new long[] { h0, h1, h2, h3 };
    }

    /**
     * murmur3 128位输出拆成两个64位：h0、h1 对 key 计算，h2、h3 对 key 末尾追加一个字节 1 后计算
     * 两次计算的输入不同，不能只换种子，否则 h1 和 h3 的低位相关，位置分布不均匀
     */
    public static HashQuad of(byte[] data) {
        ByteBuffer low = ByteBuffer.wrap(MURMUR.hashBytes(data).asBytes()).order(ByteOrder.LITTLE_ENDIAN);
        ByteBuffer high = ByteBuffer.wrap(MURMUR.newHasher().putBytes(data).putByte((byte) 1).hash().asBytes())
                .order(ByteOrder.LITTLE_ENDIAN);
        return new HashQuad(low.getLong(), low.getLong(), high.getLong(), high.getLong());
    }

    public static HashQuad of(long h0, long h1, long h2, long h3) {
        return new HashQuad(h0, h1, h2, h3);
    }

    long get(int j) {
        return h[j];
    }

    /**
     * 增强双重哈希：h[i%2] + i * h[2 + ((i + i%2) % 4) / 2]，溢出按 2^64 回绕
     */
    public long location(int i) {
        long ii = i;
        return h[i % 2] + ii * h[2 + ((i + (i % 2)) % 4) / 2];
    }

    /**
     * 第i个位置落在 m 位数组中的下标，无符号取模
     * Lua脚本中的计算必须与这里逐位一致
     */
    public long index(int i, long m) {
        return Long.remainderUnsigned(location(i), m);
    }

    /**
     * 16位十六进制，作为Lua脚本参数，脚本内再拆成4个16位分段
     */
    public String hex(int j) {
        return Strings.padStart(Long.toHexString(h[j]), 16, '0');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HashQuad)) {
            return false;
        }
        return Arrays.equals(h, ((HashQuad) o).h);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(h);
    }

    @Override
    public String toString() {
        return "HashQuad[" + hex(0) + ", " + hex(1) + ", " + hex(2) + ", " + hex(3) + "]";
    }
}
