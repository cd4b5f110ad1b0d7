package com.largomodo.imagebatch.core.domain;

import java.util.Map;

/**
 * Aggregate figures over a set of stored operations.
 *
 * @param totalOperations      operations considered
 * @param completedOperations  operations in COMPLETED
 * @param failedOperations     operations in FAILED
 * @param runningOperations    operations in RUNNING
 * @param totalImagesProcessed successful plus failed images across all operations
 * @param successRate          completed operations as a percentage of all operations
 * @param averageDurationMs    mean duration of operations that have a completion time
 * @param operationsByType     histogram by operation type
 * @param operationsByStatus   histogram by status
 */
public record OperationStatistics(int totalOperations,
                                  int completedOperations,
                                  int failedOperations,
                                  int runningOperations,
                                  int totalImagesProcessed,
                                  double successRate,
                                  double averageDurationMs,
                                  Map<OperationType, Integer> operationsByType,
                                  Map<OperationStatus, Integer> operationsByStatus) {

    public OperationStatistics {
        operationsByType = Map.copyOf(operationsByType);
        operationsByStatus = Map.copyOf(operationsByStatus);
    }
}
