package com.skillswap.billing.notification;

import com.skillswap.billing.config.BillingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Sends notifications to the delivery service over HTTP without waiting for the result.
 */
@Component
@ConditionalOnProperty(value = "billing.notification.dispatcher", havingValue = "http")
@Slf4j
public class HttpNotificationDispatcher implements NotificationDispatcher {

    private final WebClient webClient;
    private final Duration timeout;

    public HttpNotificationDispatcher(@Qualifier("notificationWebClient") WebClient webClient,
                                      BillingProperties properties) {
        this.webClient = webClient;
        this.timeout = properties.notification().timeout();
    }

    @Override
    public void notify(Long userId, String eventType, Map<String, Object> payload) {
        Map<String, Object> body = Map.of(
                "userId", userId,
                "type", eventType,
                "payload", payload == null ? Map.of() : payload);

        try {
            webClient.post()
                    .uri("/notifications")
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .subscribe(
                            response -> log.debug("Notification delivered: userId={}, type={}", userId, eventType),
                            error -> log.warn("Notification delivery failed: userId={}, type={}, error={}",
                                    userId, eventType, error.toString()));
        } catch (RuntimeException e) {
            log.warn("Notification could not be sent: userId={}, type={}, error={}", userId, eventType, e.toString());
        }
    }
}
