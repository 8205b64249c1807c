package com.skillswap.billing.scheduler;

import com.skillswap.billing.api.response.SweepResponse;
import com.skillswap.billing.service.SubscriptionLifecycleManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled subscription sweeps.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   subscriptions:
 *     enabled: true
 *     expiry-cron: "0 0 2 * * *"         # daily 02:00
 *     renewal-cron: "0 0 3 * * *"        # daily 03:00
 *     reminders-cron: "0 0 10 * * MON"   # Mondays 10:00
 * </pre>
 *
 * <p>A failed run is logged; the next run picks up whatever is still due.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.subscriptions.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class SubscriptionScheduler {

    private final SubscriptionLifecycleManager lifecycleManager;

    @Scheduled(cron = "${scheduler.subscriptions.expiry-cron:0 0 2 * * *}", zone = "UTC")
    public void expireOverdueSubscriptions() {
        log.info("Starting scheduled job: expire overdue subscriptions");
        try {
            report(lifecycleManager.expireOverdueSubscriptions());
        } catch (Exception e) {
            log.error("Failed to expire overdue subscriptions: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${scheduler.subscriptions.renewal-cron:0 0 3 * * *}", zone = "UTC")
    public void renewExpiringSubscriptions() {
        log.info("Starting scheduled job: renew expiring subscriptions");
        try {
            report(lifecycleManager.renewExpiringSubscriptions());
        } catch (Exception e) {
            log.error("Failed to renew expiring subscriptions: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${scheduler.subscriptions.reminders-cron:0 0 10 * * MON}", zone = "UTC")
    public void sendExpiryReminders() {
        log.info("Starting scheduled job: subscription expiry reminders");
        try {
            report(lifecycleManager.sendExpiryReminders());
        } catch (Exception e) {
            log.error("Failed to send subscription expiry reminders: {}", e.getMessage(), e);
        }
    }

    private static void report(SweepResponse sweep) {
        if (sweep.failed() > 0) {
            log.warn("Job {} finished with failures: processed={}, succeeded={}, failedUserIds={}",
                    sweep.job(), sweep.processed(), sweep.succeeded(), sweep.failedUserIds());
        } else if (sweep.processed() > 0) {
            log.info("Job {} finished: processed={}, succeeded={}", sweep.job(), sweep.processed(), sweep.succeeded());
        } else {
            log.debug("Job {} found nothing to do", sweep.job());
        }
    }
}
