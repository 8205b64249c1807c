package com.skillswap.billing.notification;

import com.skillswap.billing.event.BillingEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards committed billing events to the notification dispatcher.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationEventListener {

    private final NotificationDispatcher notificationDispatcher;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onBillingEvent(BillingEvent event) {
        try {
            notificationDispatcher.notify(event.userId(), event.type(), event.payload());
        } catch (RuntimeException e) {
            // state change is already committed
            log.warn("Notification dispatch failed: userId={}, type={}", event.userId(), event.type(), e);
        }
    }
}
