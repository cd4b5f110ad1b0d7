package com.largomodo.imagebatch.core;

/**
 * Audit trail grouping. Batch lifecycle entries are {@link #SYSTEM} events.
 */
public enum AuditCategory {
    SYSTEM
}
