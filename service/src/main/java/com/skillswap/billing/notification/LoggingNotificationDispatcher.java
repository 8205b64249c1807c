package com.skillswap.billing.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Writes notifications to the log. Used when no delivery service is configured.
 */
@Component
@ConditionalOnProperty(value = "billing.notification.dispatcher", havingValue = "logging", matchIfMissing = true)
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public void notify(Long userId, String eventType, Map<String, Object> payload) {
        log.info("Notification: userId={}, type={}, payload={}", userId, eventType, payload);
    }
}
