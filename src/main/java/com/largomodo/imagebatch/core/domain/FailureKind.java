package com.largomodo.imagebatch.core.domain;

/**
 * Why a target image ended up FAILED.
 */
public enum FailureKind {
    /** Executor returned an unsuccessful result. */
    OPERATION_FAILED,
    /** Executor threw. */
    EXCEPTION,
    /** Executor did not finish within the per-image timeout. */
    TIMEOUT
}
