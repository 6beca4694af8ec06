package com.mcache.bloom;

/**
 * 布隆过滤器的位存储统一接口
 * 每个方法都针对同一个key的k个位置，作为一个不可分割的整体执行
 */
public interface BitMap {

    /**
     * 位数组大小
     */
    long m();

    /**
     * 哈希函数个数
     */
    int k();

    /**
     * 将k个位置全部置1，幂等
     */
    void setAll(HashQuad h);

    /**
     * k个位置全部为1时返回true，不修改任何状态
     */
    boolean testAll(HashQuad h);

    /**
     * 原子地判断k个位置是否已全部为1，并无条件把它们置1
     * 返回置位之前的判断结果
     */
    boolean testAddAll(HashQuad h);

    /**
     * 清空整个位数组
     */
    void clearAll();
}
