package com.memory.graph.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process identity lock backed by a fixed array of {@link ReentrantLock} stripes.
 * Suitable for single-JVM deployments.
 *
 * <p>Keys are hashed onto stripes, so unrelated keys may occasionally share a stripe; this only
 * serializes their commits. {@link #lockAll(Collection)} acquires stripes in ascending index
 * order, which rules out lock-order deadlocks between concurrent plans.</p>
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ReentrantLock[] stripes;
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
        this.stripes = new ReentrantLock[config.stripes()];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @Override
    public void lock(String key) {
        acquire(stripeIndex(key), key);
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = stripes[stripeIndex(key)];
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("Lock released: {}", key);
        }
    }

    @Override
    public LockHandle lockAll(Collection<String> keys) {
        TreeSet<Integer> indexes = new TreeSet<>();
        for (String key : keys) {
            indexes.add(stripeIndex(key));
        }
        Deque<ReentrantLock> held = new ArrayDeque<>();
        try {
            for (int index : indexes) {
                acquire(index, "stripe-" + index);
                held.push(stripes[index]);
            }
        } catch (LockAcquisitionException e) {
            releaseAll(held);
            throw e;
        }
        log.debug("Locks acquired: keys={} stripes={}", keys.size(), indexes.size());
        return () -> releaseAll(held);
    }

    private void acquire(int index, String description) {
        ReentrantLock lock = stripes[index];
        try {
            if (!lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock for '" + description + "' within " + config.timeoutMs() + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for: " + description, e);
        }
    }

    private static void releaseAll(Deque<ReentrantLock> held) {
        while (!held.isEmpty()) {
            ReentrantLock lock = held.pop();
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    private int stripeIndex(String key) {
        return Math.floorMod(key.hashCode(), stripes.length);
    }
}
