package com.memory.graph.lock;

import java.util.Collection;

/**
 * Lock over entity identity keys ({@code KIND:normalized name}), held while a mutation plan is
 * computed and applied so that concurrent extractions of overlapping entities cannot both plan
 * a create for the same identity.
 */
public interface DistributedLock {

    /**
     * Acquires the lock for a single key.
     *
     * @throws LockAcquisitionException if the lock cannot be acquired within the configured timeout
     */
    void lock(String key);

    /**
     * Releases a lock held by the current thread. Does nothing if the thread does not hold it.
     */
    void unlock(String key);

    /**
     * Acquires the locks for all keys in a deadlock-free order.
     * Either every lock is acquired or none is held when the method throws.
     *
     * @return a handle that releases every acquired lock on close
     * @throws LockAcquisitionException if any lock cannot be acquired
     */
    LockHandle lockAll(Collection<String> keys);

    /**
     * Releases the locks taken by {@link #lockAll(Collection)}.
     */
    interface LockHandle extends AutoCloseable {
        @Override
        void close();
    }
}
