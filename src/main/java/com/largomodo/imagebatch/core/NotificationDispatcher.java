package com.largomodo.imagebatch.core;

/**
 * Optional, best-effort notification channel for finished operations.
 * <p>
 * Invoked on a dedicated notifier thread so slow channels never delay the
 * operation driver. Exceptions are logged and dropped.
 */
@FunctionalInterface
public interface NotificationDispatcher {

    NotificationDispatcher NONE = notification -> {
    };

    void dispatch(OperationNotification notification);
}
