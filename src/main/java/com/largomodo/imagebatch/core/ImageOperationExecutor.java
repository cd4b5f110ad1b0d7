package com.largomodo.imagebatch.core;

/**
 * Performs the actual per-image work of a batch operation (apply template,
 * debloat, inject drivers, convert, ...).
 * <p>
 * Implementations should check {@code token} between expensive steps and return
 * promptly once it is cancelled. Throwing is equivalent to returning a failed
 * result; the engine records either on the image and carries on with siblings.
 */
@FunctionalInterface
public interface ImageOperationExecutor {

    /**
     * @param request image and opaque operation payload
     * @param token   cancelled when the operation is cancelled or the per-image timeout fires
     * @return outcome for this image
     * @throws Exception on failure; recorded against the image
     */
    ImageOperationResult execute(ImageOperationRequest request, CancellationToken token) throws Exception;
}
