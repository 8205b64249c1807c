package com.skillswap.billing.notification;

import java.util.Map;

/**
 * Boundary to the notification delivery service (email, SMS, push, in-app).
 *
 * <p>Best-effort and fire-and-forget: implementations must not throw and must not block the
 * caller on delivery.
 */
public interface NotificationDispatcher {

    void notify(Long userId, String eventType, Map<String, Object> payload);
}
