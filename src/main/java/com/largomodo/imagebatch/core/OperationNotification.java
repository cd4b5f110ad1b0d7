package com.largomodo.imagebatch.core;

import com.largomodo.imagebatch.core.domain.OperationStatus;
import com.largomodo.imagebatch.core.domain.OperationSummary;

/**
 * Payload sent to the notification dispatcher when an operation reaches a terminal status.
 */
public record OperationNotification(EventType eventType,
                                    String operationId,
                                    String operationName,
                                    OperationStatus status,
                                    OperationSummary summary,
                                    String errorMessage) {

    public enum EventType {
        BATCH_OPERATION_COMPLETED,
        BATCH_OPERATION_FAILED
    }
}
