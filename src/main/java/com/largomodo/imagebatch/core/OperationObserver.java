package com.largomodo.imagebatch.core;

import com.largomodo.imagebatch.core.domain.BatchOperation;
import com.largomodo.imagebatch.core.domain.TargetImage;

/**
 * Observer interface for batch operation lifecycle events.
 * <p>
 * Implementations can monitor execution by receiving callbacks at key points:
 * image start, image finish and operation finish. All methods have default
 * no-op implementations, allowing consumers to override only the events they
 * care about.
 * <p>
 * Callbacks arrive on worker threads, concurrently for images of the same
 * operation. Arguments are snapshots and may be retained.
 * <p>
 * Example usage:
 * <pre>{@code
 * OperationObserver observer = new OperationObserver() {
 *     @Override
 *     public void onImageFinished(BatchOperation operation, TargetImage image) {
 *         System.out.println(image.getImagePath() + ": " + image.getStatus());
 *     }
 * };
 * }</pre>
 *
 * @see BatchOperationEngine
 */
public interface OperationObserver {

    OperationObserver NONE = new OperationObserver() {
    };

    /**
     * Called when an image has been marked RUNNING.
     *
     * @param operation the owning operation
     * @param image     the image about to be processed
     */
    default void onImageStarted(BatchOperation operation, TargetImage image) {}

    /**
     * Called when an image reached a terminal status.
     *
     * @param operation the owning operation, with refreshed progress
     * @param image     the finished image
     */
    default void onImageFinished(BatchOperation operation, TargetImage image) {}

    /**
     * Called once after the operation reached its terminal status and left the active registry.
     *
     * @param operation final state of the operation
     */
    default void onOperationFinished(BatchOperation operation) {}
}
