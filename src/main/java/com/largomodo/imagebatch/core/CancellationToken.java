package com.largomodo.imagebatch.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared between an operation driver, its
 * sub-task workers and the per-image executors.
 * <p>
 * Cancellation is one-way and idempotent. Child tokens are cancelled with their
 * parent but can also be cancelled on their own (per-image timeout) without
 * affecting the parent.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile Runnable detachFromParent = () -> { };

    /**
     * Request cancellation. Listeners run on the calling thread, once.
     * A listener that throws is logged and does not stop the others.
     *
     * @return true if this call performed the transition
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener failed", e);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws CancellationException if cancellation has been requested
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Operation cancelled");
        }
    }

    /**
     * Register a callback fired on cancellation. Runs immediately if already cancelled.
     * A registration racing with {@link #cancel()} may fire twice, so listeners must be idempotent.
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }

    /**
     * Unregister a callback added with {@link #onCancel(Runnable)}.
     *
     * @return true if the listener was still registered
     */
    public boolean removeListener(Runnable listener) {
        return listeners.remove(listener);
    }

    /**
     * Create a token that is cancelled whenever this one is.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        Runnable link = child::cancel;
        child.detachFromParent = () -> removeListener(link);
        onCancel(link);
        return child;
    }

    /**
     * Stop following the parent token. No-op for a root token.
     */
    public void detach() {
        detachFromParent.run();
    }
}
