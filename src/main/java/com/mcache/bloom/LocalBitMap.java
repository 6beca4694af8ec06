package com.mcache.bloom;

import java.util.BitSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 进程内位存储，BitSet + 互斥锁
 * 特点：内存型，速度快，只在当前进程内可见，应用重启后数据丢失
 */
public class LocalBitMap implements BitMap {

    private final ReentrantLock lock = new ReentrantLock();
    private final long m;
    private final int k;
    private final BitSet bits;

    public LocalBitMap(FilterParameters params) {
        FilterParameters p = params.floored();
        if (p.getM() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("local bitmap supports at most " + Integer.MAX_VALUE + " bits, got " + p.getM());
        }
        this.m = p.getM();
        this.k = p.getK();
        this.bits = new BitSet((int) m);
    }

    @Override
    public long m() {
        return m;
    }

    @Override
    public int k() {
        return k;
    }

    @Override
    public void setAll(HashQuad h) {
        lock.lock();
        try {
            for (int i = 0; i < k; i++) {
                bits.set((int) h.index(i, m));
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean testAll(HashQuad h) {
        lock.lock();
        try {
            for (int i = 0; i < k; i++) {
                if (!bits.get((int) h.index(i, m))) {
                    return false;
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean testAddAll(HashQuad h) {
        boolean present = true;
        lock.lock();
        try {
            for (int i = 0; i < k; i++) {
                int loc = (int) h.index(i, m);
                if (!bits.get(loc)) {
                    present = false;
                }
                bits.set(loc);
            }
        } finally {
            lock.unlock();
        }
        return present;
    }

    @Override
    public void clearAll() {
        lock.lock();
        try {
            bits.clear();
        } finally {
            lock.unlock();
        }
    }
}
