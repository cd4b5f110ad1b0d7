package com.largomodo.imagebatch.core;

/**
 * Base type for requests the engine rejects.
 * <p>
 * Unchecked so callers validate at the boundary (CLI, API layer) instead of
 * every intermediate call site.
 */
public class BatchOperationException extends RuntimeException {

    public BatchOperationException(String message) {
        super(message);
    }

    public BatchOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
