package com.largomodo.imagebatch.core;

import com.largomodo.imagebatch.core.domain.OperationStatus;

/**
 * Requested transition is not valid from the operation's current status.
 * Operation state is unchanged when this is thrown.
 */
public class InvalidOperationStateException extends BatchOperationException {

    private final OperationStatus currentStatus;

    public InvalidOperationStateException(String operationId, OperationStatus currentStatus, String action) {
        super("Batch operation '" + operationId + "' is in " + currentStatus + " state and cannot be " + action);
        this.currentStatus = currentStatus;
    }

    public OperationStatus getCurrentStatus() {
        return currentStatus;
    }
}
