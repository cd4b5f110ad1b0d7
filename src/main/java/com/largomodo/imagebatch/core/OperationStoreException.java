package com.largomodo.imagebatch.core;

import java.io.IOException;

/**
 * Store I/O failure on a path where the caller must know (create, delete, load).
 * <p>
 * Snapshot writes during execution are best effort and never raise this.
 */
public class OperationStoreException extends BatchOperationException {

    public OperationStoreException(String message, IOException cause) {
        super(message + ": " + cause.getMessage(), cause);
    }
}
