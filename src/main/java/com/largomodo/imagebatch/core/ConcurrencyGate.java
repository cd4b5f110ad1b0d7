package com.largomodo.imagebatch.core;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-operation launch gate: at most {@code limit} sub-tasks hold a slot at once,
 * and no slot is handed out while the operation is paused.
 * <p>
 * Each operation owns its own gate, so the bound is per operation rather than
 * process-wide. Waiting is cancellation-aware: blocked callers poll the token and
 * give up as soon as cancellation is requested. Pausing never preempts slot
 * holders, it only stops new acquisitions.
 */
public final class ConcurrencyGate {

    // Upper bound on how long a waiter can miss a cancellation signal
    private static final long POLL_INTERVAL_MS = 50;

    private final int limit;
    private final Semaphore slots;
    private final ReentrantLock pauseLock = new ReentrantLock();
    private final Condition resumed = pauseLock.newCondition();
    private boolean paused;

    public ConcurrencyGate(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Concurrency limit must be at least 1, got: " + limit);
        }
        this.limit = limit;
        this.slots = new Semaphore(limit, true);
    }

    /**
     * Block until a slot is free and the gate is open.
     *
     * @param token cancellation observed while waiting
     * @return true if a slot was acquired (caller must {@link #release()} it), false if cancelled
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean acquire(CancellationToken token) throws InterruptedException {
        while (true) {
            if (!awaitOpen(token)) {
                return false;
            }
            if (!slots.tryAcquire(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                if (token.isCancelled()) {
                    return false;
                }
                continue;
            }
            if (token.isCancelled()) {
                slots.release();
                return false;
            }
            // Paused between the open check and the acquisition: hand the slot back and wait again
            if (isPaused()) {
                slots.release();
                continue;
            }
            return true;
        }
    }

    public void release() {
        slots.release();
    }

    public void pause() {
        pauseLock.lock();
        try {
            paused = true;
        } finally {
            pauseLock.unlock();
        }
    }

    public void resume() {
        pauseLock.lock();
        try {
            paused = false;
            resumed.signalAll();
        } finally {
            pauseLock.unlock();
        }
    }

    public boolean isPaused() {
        pauseLock.lock();
        try {
            return paused;
        } finally {
            pauseLock.unlock();
        }
    }

    /**
     * Slots currently held by running sub-tasks.
     */
    public int inUse() {
        return limit - slots.availablePermits();
    }

    private boolean awaitOpen(CancellationToken token) throws InterruptedException {
        pauseLock.lock();
        try {
            while (paused) {
                if (token.isCancelled()) {
                    return false;
                }
                resumed.await(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            }
            return !token.isCancelled();
        } finally {
            pauseLock.unlock();
        }
    }
}
