package com.largomodo.imagebatch.core;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConcurrencyGate slot bounding, pausing and cancellation-aware waiting.
 */
class ConcurrencyGateTest {

    @Test
    void testRejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new ConcurrencyGate(0));
    }

    @Test
    void testNeverHandsOutMoreThanLimit() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(2);
        CancellationToken token = new CancellationToken();
        AtomicInteger holders = new AtomicInteger();
        AtomicInteger maxHolders = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            CountDownLatch done = new CountDownLatch(12);
            for (int i = 0; i < 12; i++) {
                pool.submit(() -> {
                    try {
                        assertTrue(gate.acquire(token));
                        maxHolders.accumulateAndGet(holders.incrementAndGet(), Math::max);
                        Thread.sleep(20);
                        holders.decrementAndGet();
                        gate.release();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                    return null;
                });
            }
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertTrue(maxHolders.get() <= 2, "Observed " + maxHolders.get() + " concurrent holders");
        assertEquals(0, gate.inUse());
    }

    @Test
    void testPausedGateBlocksUntilResumed() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(1);
        CancellationToken token = new CancellationToken();
        gate.pause();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> waiter = pool.submit(() -> gate.acquire(token));
            Thread.sleep(150);
            assertFalse(waiter.isDone(), "Acquire must block while paused");

            gate.resume();
            assertTrue(waiter.get(2, TimeUnit.SECONDS));
            assertEquals(1, gate.inUse());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testCancellationReleasesWaiter() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(1);
        CancellationToken token = new CancellationToken();
        assertTrue(gate.acquire(token));
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> waiter = pool.submit(() -> gate.acquire(token));
            Thread.sleep(100);
            token.cancel();

            assertFalse(waiter.get(2, TimeUnit.SECONDS), "Cancelled waiter must give up");
            assertEquals(1, gate.inUse(), "Cancelled waiter must not hold a slot");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testAcquireOnCancelledTokenFailsImmediately() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(3);
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertFalse(gate.acquire(token));
        assertEquals(0, gate.inUse());
    }
}
