package com.largomodo.imagebatch.core;

/**
 * No operation with the requested id exists in the registry or the store.
 */
public class OperationNotFoundException extends BatchOperationException {

    private final String operationId;

    public OperationNotFoundException(String operationId) {
        super("Batch operation '" + operationId + "' not found");
        this.operationId = operationId;
    }

    public String getOperationId() {
        return operationId;
    }
}
