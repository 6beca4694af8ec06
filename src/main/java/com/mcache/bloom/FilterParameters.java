package com.mcache.bloom;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 布隆过滤器参数：m 位数组大小，k 哈希函数个数
 * 构造后不可变
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FilterParameters {

    private static final double LN2 = Math.log(2);

    private final long m;
    private final int k;

    private FilterParameters(long m, int k) {
        this.m = m;
        this.k = k;
    }

    /**
     * m 和 k 都至少为1，避免零长度的位数组
     */
    public static FilterParameters of(long m, int k) {
        return new FilterParameters(Math.max(1L, m), Math.max(1, k));
    }

    /**
     * 根据预期元素数量 n 和误判率 p 估算最优的 m、k
     * m = ceil(-n * ln(p) / (ln2)^2)，k = ceil(ln2 * m / n)
     * 这里不做下限处理，异常输入可能返回0，由 {@link #of(long, int)} 兜底
     */
    public static FilterParameters estimate(long n, double p) {
        long m = (long) Math.ceil(-1 * (double) n * Math.log(p) / (LN2 * LN2));
        int k = (int) Math.ceil(LN2 * (double) m / (double) n);
        return new FilterParameters(m, k);
    }

    public FilterParameters floored() {
        return of(m, k);
    }
}
