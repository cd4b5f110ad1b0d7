package com.largomodo.imagebatch.core.domain;

/**
 * Lifecycle state of a single target image within an operation.
 */
public enum ImageStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
