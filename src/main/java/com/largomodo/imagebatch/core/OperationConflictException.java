package com.largomodo.imagebatch.core;

/**
 * Request conflicts with in-flight work, e.g. deleting an active operation.
 */
public class OperationConflictException extends BatchOperationException {

    public OperationConflictException(String message) {
        super(message);
    }
}
