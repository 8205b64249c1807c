package com.skillswap.billing.event;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Domain event emitted by the billing core. Subscribers (real-time channel, notification
 * dispatcher) receive it after the emitting transaction commits.
 *
 * @param type       event name, see {@link BillingEventType}
 * @param userId     user the event concerns
 * @param payload    event data, serialized as JSON by subscribers
 * @param occurredAt when the change happened
 */
public record BillingEvent(
        String type,
        Long userId,
        Map<String, Object> payload,
        LocalDateTime occurredAt
) {}
