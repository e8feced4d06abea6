package io.commandgate.storage;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class ExecutionLocksTest {

    @Test
    void sameKeyIsSerializedAndLocksAreDroppedAfterUse() throws Exception {
        ExecutionLocks locks = new ExecutionLocks();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < 60; i++) {
                futures.add(pool.submit(() -> locks.withLock("exec-1", () -> {
                    int now = inside.incrementAndGet();
                    maxInside.accumulateAndGet(now, Math::max);
                    Thread.onSpinWait();
                    inside.decrementAndGet();
                    return now;
                })));
            }
            for (Future<Integer> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        Assertions.assertEquals(1, maxInside.get());
        Assertions.assertEquals(0, locks.activeKeys());
    }

    @Test
    void differentKeysDoNotBlockEachOther() throws Exception {
        ExecutionLocks locks = new ExecutionLocks();
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> locks.withLock("exec-a", () -> {
            holding.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        holder.start();
        try {
            Assertions.assertTrue(holding.await(10, TimeUnit.SECONDS));
            Assertions.assertEquals("done", locks.withLock("exec-b", () -> "done"));
            Assertions.assertEquals(1, locks.activeKeys());
        } finally {
            release.countDown();
            holder.join(10_000L);
        }
        Assertions.assertEquals(0, locks.activeKeys());
    }

    @Test
    void lockIsReleasedWhenActionThrows() {
        ExecutionLocks locks = new ExecutionLocks();
        Assertions.assertThrows(IllegalStateException.class, () -> locks.withLock("exec-1", () -> {
            throw new IllegalStateException("boom");
        }));
        Assertions.assertEquals(0, locks.activeKeys());
        Assertions.assertEquals(1, locks.withLock("exec-1", () -> 1));
    }
}
