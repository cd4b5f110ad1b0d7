package com.largomodo.imagebatch.core;

/**
 * Outcome reported by an executor for one image.
 *
 * @param success        whether the image was processed
 * @param errorMessage   failure description, null on success
 * @param bytesProcessed bytes read or written, 0 when not meaningful
 */
public record ImageOperationResult(boolean success, String errorMessage, long bytesProcessed) {

    public static ImageOperationResult succeeded() {
        return new ImageOperationResult(true, null, 0);
    }

    public static ImageOperationResult succeeded(long bytesProcessed) {
        return new ImageOperationResult(true, null, bytesProcessed);
    }

    public static ImageOperationResult failed(String errorMessage) {
        return new ImageOperationResult(false, errorMessage, 0);
    }
}
