package com.largomodo.imagebatch.core;

import com.largomodo.imagebatch.core.domain.BatchOperation;
import com.largomodo.imagebatch.core.domain.OperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * In-memory state of one active operation: the live record, its cancellation
 * token, its concurrency gate and the future completed when it finishes.
 * <p>
 * Single writer: every mutation of the live record goes through
 * {@link #update(Consumer)}, which holds the run lock while mutating and while
 * writing the snapshot. Snapshot writes for one operation are therefore totally
 * ordered and an earlier write can never overwrite a later one.
 * <p>
 * Persistence is best effort. A failed snapshot write is logged and the live
 * record stays authoritative until the next successful write.
 */
public final class OperationRun {

    private static final Logger log = LoggerFactory.getLogger(OperationRun.class);

    private final BatchOperation record;
    private final OperationStore store;
    private final ReentrantLock lock = new ReentrantLock();
    private final CancellationToken token = new CancellationToken();
    private final ConcurrencyGate gate;
    private final CompletableFuture<BatchOperation> completion = new CompletableFuture<>();

    // Guarded by lock
    private boolean finished;
    private String abortReason;

    public OperationRun(BatchOperation record, OperationStore store) {
        this.record = record;
        this.store = store;
        this.gate = new ConcurrencyGate(record.getMaxParallelOperations());
    }

    public String id() {
        return record.getId();
    }

    public CancellationToken token() {
        return token;
    }

    public ConcurrencyGate gate() {
        return gate;
    }

    /**
     * Completed with the final snapshot once the operation reached a terminal status.
     */
    public CompletableFuture<BatchOperation> completion() {
        return completion;
    }

    /**
     * Apply a mutation and persist the result.
     *
     * @return snapshot taken after the mutation
     */
    public BatchOperation update(Consumer<BatchOperation> mutation) {
        lock.lock();
        try {
            mutation.accept(record);
            persist();
            return record.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically move from {@code expected} to {@code next}.
     *
     * @return false (and no change) if the current status is not {@code expected}
     */
    public boolean transition(OperationStatus expected, OperationStatus next, String statusMessage) {
        lock.lock();
        try {
            if (record.getStatus() != expected) {
                return false;
            }
            record.setStatus(next);
            record.setStatusMessage(statusMessage);
            persist();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public BatchOperation snapshot() {
        lock.lock();
        try {
            return record.copy();
        } finally {
            lock.unlock();
        }
    }

    public OperationStatus status() {
        lock.lock();
        try {
            return record.getStatus();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop further launches because an image failed with continue-on-error disabled.
     * Only the first reason is kept.
     */
    public void abort(String reason) {
        lock.lock();
        try {
            if (abortReason == null) {
                abortReason = reason;
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isAborted() {
        lock.lock();
        try {
            return abortReason != null;
        } finally {
            lock.unlock();
        }
    }

    public String abortReason() {
        lock.lock();
        try {
            return abortReason;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply the terminal mutation exactly once. Later outcome reports (abandoned
     * images finishing after shutdown) are ignored via {@link #updateIfRunning}.
     *
     * @return final snapshot
     */
    BatchOperation finish(Consumer<BatchOperation> finalMutation) {
        lock.lock();
        try {
            if (finished) {
                throw new IllegalStateException("Operation " + id() + " already finished");
            }
            finalMutation.accept(record);
            finished = true;
            persist();
            return record.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #update(Consumer)} but a no-op once the run has finished.
     *
     * @return snapshot after the mutation, or null if the run already finished
     */
    BatchOperation updateIfRunning(Consumer<BatchOperation> mutation) {
        lock.lock();
        try {
            if (finished) {
                return null;
            }
            mutation.accept(record);
            persist();
            return record.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply the mutation unless the operation is PAUSED, checked under the same lock
     * that {@code pause} uses for its status transition.
     *
     * @return snapshot after the mutation, or null if the operation is paused
     */
    BatchOperation updateUnlessPaused(Consumer<BatchOperation> mutation) {
        lock.lock();
        try {
            if (record.getStatus() == OperationStatus.PAUSED) {
                return null;
            }
            mutation.accept(record);
            persist();
            return record.copy();
        } finally {
            lock.unlock();
        }
    }

    // Caller holds lock
    private void persist() {
        try {
            store.save(record);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to persist snapshot of operation {}: {}", record.getId(), e.getMessage());
        }
    }
}
