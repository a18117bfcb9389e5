package com.demo.degree.service;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped mutual exclusion keyed by string. Two operations on the same key never overlap;
 * unrelated keys may share a stripe, which only costs contention.
 */
public class KeyedLocks {

    private final ReentrantLock[] stripes;

    public KeyedLocks(int stripeCount) {
        if (stripeCount < 1) throw new IllegalArgumentException("stripeCount must be >= 1");
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) stripes[i] = new ReentrantLock();
    }

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = stripeFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock stripeFor(String key) {
        int h = key.hashCode();
        h ^= (h >>> 16);
        return stripes[Math.floorMod(h, stripes.length)];
    }
}
