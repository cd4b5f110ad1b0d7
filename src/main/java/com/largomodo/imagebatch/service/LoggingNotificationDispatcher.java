package com.largomodo.imagebatch.service;

import com.largomodo.imagebatch.core.NotificationDispatcher;
import com.largomodo.imagebatch.core.OperationNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notification channel for the command line: announces finished operations in the log.
 */
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationDispatcher.class);

    @Override
    public void dispatch(OperationNotification notification) {
        if (notification.eventType() == OperationNotification.EventType.BATCH_OPERATION_FAILED) {
            log.warn("Batch operation '{}' failed: {}", notification.operationName(), notification.errorMessage());
        } else {
            log.info("Batch operation '{}' finished {}: {}/{} images successful",
                    notification.operationName(), notification.status(),
                    notification.summary().getSuccessfulImages(), notification.summary().getTotalImages());
        }
    }
}
