package com.largomodo.imagebatch.core;

/**
 * Destination for audit entries emitted at operation create/start/cancel/delete/complete.
 * <p>
 * Fire-and-observe: the engine logs and discards any exception thrown here so a
 * broken audit trail never changes an operation's outcome.
 */
@FunctionalInterface
public interface AuditSink {

    void record(AuditEvent event);
}
