package com.linkvault.sync.concurrent;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed pool of locks shared by hash. Keys that collide serialize with each other, which is harmless for the short
 * per-user and per-connection critical sections it guards, and memory stays constant however many keys are seen.
 */
public final class StripedLocks {

    private final ReentrantLock[] stripes;

    public StripedLocks(int minimumStripes) {
        if (minimumStripes <= 0) {
            throw new IllegalArgumentException("stripe count must be positive");
        }
        int size = Integer.highestOneBit(minimumStripes);
        if (size < minimumStripes) {
            size <<= 1;
        }
        this.stripes = new ReentrantLock[size];
        for (int i = 0; i < size; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public ReentrantLock lockFor(Object key) {
        int hash = key.hashCode();
        hash ^= hash >>> 16;
        return stripes[hash & (stripes.length - 1)];
    }

    public <T> T withLock(Object key, Supplier<T> action) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return stripes.length;
    }
}
