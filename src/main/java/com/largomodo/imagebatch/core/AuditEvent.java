package com.largomodo.imagebatch.core;

import java.util.Map;

/**
 * One audit trail entry.
 *
 * @param category    audit grouping
 * @param action      verb, e.g. {@code StartBatchOperation}
 * @param resourceId  operation id the entry refers to
 * @param description human readable summary (error message for failures)
 * @param durationMs  elapsed time where meaningful, else 0
 * @param success     whether the audited action succeeded
 * @param metadata    extra key/value context
 */
public record AuditEvent(AuditCategory category,
                         String action,
                         String resourceId,
                         String description,
                         long durationMs,
                         boolean success,
                         Map<String, Object> metadata) {

    public AuditEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static AuditEvent success(String action, String resourceId, String description) {
        return new AuditEvent(AuditCategory.SYSTEM, action, resourceId, description, 0, true, Map.of());
    }
}
