package com.memory.graph.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LocalDistributedLock Tests")
class LocalDistributedLockTest {

    @Nested
    @DisplayName("Single keys")
    class SingleKeys {

        @Test
        @DisplayName("Should acquire and release lock")
        void acquireRelease() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertDoesNotThrow(() -> lock.lock("PERSON:alice"));
            assertDoesNotThrow(() -> lock.unlock("PERSON:alice"));
        }

        @Test
        @DisplayName("Unlocking a key the thread does not hold is ignored")
        void unlockNotHeld() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertDoesNotThrow(() -> lock.unlock("PERSON:nobody"));
        }

        @Test
        @DisplayName("Should time out when another thread holds the key")
        void timeout() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(100, 16));
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                executor.submit(() -> {
                    lock.lock("LOCATION:paris");
                    held.countDown();
                    release.await();
                    lock.unlock("LOCATION:paris");
                    return null;
                });
                assertTrue(held.await(5, TimeUnit.SECONDS));

                LockAcquisitionException e = assertThrows(LockAcquisitionException.class,
                        () -> lock.lock("LOCATION:paris"));
                assertTrue(e.getMessage().contains("100ms"));
            } finally {
                release.countDown();
                executor.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("lockAll")
    class LockAll {

        @Test
        @DisplayName("Closing the handle releases every stripe")
        void handleReleases() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(100, 4));
            List<String> keys = List.of("PERSON:alice", "PERSON:bob", "LOCATION:paris");

            try (DistributedLock.LockHandle ignored = lock.lockAll(keys)) {
                ExecutorService executor = Executors.newSingleThreadExecutor();
                try {
                    Future<?> blocked = executor.submit(() -> lock.lockAll(keys).close());
                    Exception e = assertThrows(Exception.class, () -> blocked.get(5, TimeUnit.SECONDS));
                    assertInstanceOf(LockAcquisitionException.class, e.getCause());
                } finally {
                    executor.shutdown();
                }
            }

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                assertDoesNotThrow(() -> executor.submit(() -> lock.lockAll(keys).close()).get(5, TimeUnit.SECONDS));
            } finally {
                executor.shutdown();
            }
        }

        @Test
        @DisplayName("Overlapping key sets in any order never deadlock")
        void noDeadlock() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(5000, 8));
            List<String> forward = List.of("PERSON:alice", "PERSON:bob", "LOCATION:paris", "EVENT:party");
            List<String> backward = List.of("EVENT:party", "LOCATION:paris", "PERSON:bob", "PERSON:alice");
            AtomicInteger completed = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                for (int i = 0; i < 200; i++) {
                    List<String> keys = i % 2 == 0 ? forward : backward;
                    executor.submit(() -> {
                        try (DistributedLock.LockHandle ignored = lock.lockAll(keys)) {
                            completed.incrementAndGet();
                        }
                    });
                }
            } finally {
                executor.shutdown();
            }
            assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
            assertEquals(200, completed.get());
        }

        @Test
        @DisplayName("An empty key set acquires nothing")
        void emptyKeys() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertDoesNotThrow(() -> lock.lockAll(List.of()).close());
        }
    }

    @Test
    @DisplayName("Config rejects non-positive values")
    void configValidation() {
        assertThrows(IllegalArgumentException.class, () -> new LockConfig(0, 4));
        assertThrows(IllegalArgumentException.class, () -> new LockConfig(100, 0));
    }
}
