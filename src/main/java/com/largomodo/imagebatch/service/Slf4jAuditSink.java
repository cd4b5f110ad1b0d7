package com.largomodo.imagebatch.service;

import com.largomodo.imagebatch.core.AuditEvent;
import com.largomodo.imagebatch.core.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events to the {@code imagebatch.audit} logger, which logback.xml
 * routes to its own file.
 */
public class Slf4jAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "imagebatch.audit";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void record(AuditEvent event) {
        if (event.success()) {
            audit.info("{} {} category={} durationMs={} {} {}", event.action(), event.resourceId(),
                    event.category(), event.durationMs(), event.metadata(), event.description());
        } else {
            audit.warn("{} {} FAILED category={} durationMs={} {} {}", event.action(), event.resourceId(),
                    event.category(), event.durationMs(), event.metadata(), event.description());
        }
    }
}
