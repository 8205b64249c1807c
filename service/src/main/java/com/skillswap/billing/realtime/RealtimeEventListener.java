package com.skillswap.billing.realtime;

import com.skillswap.billing.event.BillingEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Pushes committed billing events to the user's open realtime streams.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RealtimeEventListener {

    private final RealtimeEventBroker broker;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onBillingEvent(BillingEvent event) {
        try {
            int delivered = broker.publish(event);
            log.debug("Realtime event pushed: userId={}, type={}, streams={}", event.userId(), event.type(), delivered);
        } catch (RuntimeException e) {
            log.warn("Realtime push failed: userId={}, type={}", event.userId(), event.type(), e);
        }
    }
}
