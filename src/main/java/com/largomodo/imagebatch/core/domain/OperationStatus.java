package com.largomodo.imagebatch.core.domain;

/**
 * Operation-level lifecycle state.
 * <p>
 * {@code PENDING -> QUEUED -> RUNNING <-> PAUSED -> {COMPLETED, COMPLETED_WITH_ERRORS, FAILED, CANCELLED}}
 */
public enum OperationStatus {
    PENDING,
    QUEUED,
    RUNNING,
    PAUSED,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return switch (this) {
            case COMPLETED, COMPLETED_WITH_ERRORS, FAILED, CANCELLED -> true;
            case PENDING, QUEUED, RUNNING, PAUSED -> false;
        };
    }

    /**
     * States in which an operation is held in the engine's {@code ActiveRegistry}.
     */
    public boolean isActive() {
        return this == QUEUED || this == RUNNING || this == PAUSED;
    }
}
