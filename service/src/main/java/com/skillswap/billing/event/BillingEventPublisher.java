package com.skillswap.billing.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes {@link BillingEvent}s on the Spring event bus.
 *
 * <p>Listeners are transactional: inside a transaction the event is held until commit and
 * dropped on rollback, so subscribers never see a change that did not persist.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BillingEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public void publish(String type, Long userId, Map<String, Object> payload) {
        Map<String, Object> data = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        BillingEvent event = new BillingEvent(type, userId, data, LocalDateTime.now(clock));
        log.debug("Publishing billing event: type={}, userId={}", type, userId);
        applicationEventPublisher.publishEvent(event);
    }
}
