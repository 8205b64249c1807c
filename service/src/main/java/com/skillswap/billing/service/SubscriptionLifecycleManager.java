package com.skillswap.billing.service;

import com.skillswap.billing.api.model.BillingJob;
import com.skillswap.billing.api.model.SubscriptionStatus;
import com.skillswap.billing.api.response.SweepResponse;
import com.skillswap.billing.config.BillingProperties;
import com.skillswap.billing.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.function.Function;

/**
 * Time-driven subscription sweeps: expiry, renewal and reminders.
 *
 * <p>Each sweep loads candidate user IDs first, then processes every user in its own database
 * transaction. A failure of one user is logged and counted; the sweep carries on.
 * In the returned {@link SweepResponse}, users that no longer qualified once locked count as
 * processed but neither succeeded nor failed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionLifecycleManager {

    private final UserAccountRepository userAccountRepository;
    private final SubscriptionExpiryService expiryService;
    private final SubscriptionRenewalService renewalService;
    private final BillingProperties properties;
    private final Clock clock;

    public SweepResponse run(BillingJob job) {
        return switch (job) {
            case SUBSCRIPTION_EXPIRY -> expireOverdueSubscriptions();
            case SUBSCRIPTION_RENEWAL -> renewExpiringSubscriptions();
            case SUBSCRIPTION_REMINDERS -> sendExpiryReminders();
        };
    }

    public SweepResponse expireOverdueSubscriptions() {
        List<Long> candidates = userAccountRepository.findExpiredSubscriptionIds(
                EnumSet.of(SubscriptionStatus.ACTIVE, SubscriptionStatus.PAST_DUE), LocalDateTime.now(clock));
        return sweep(BillingJob.SUBSCRIPTION_EXPIRY, candidates,
                userId -> expiryService.expireIfOverdue(userId) ? StepResult.SUCCEEDED : StepResult.SKIPPED);
    }

    public SweepResponse renewExpiringSubscriptions() {
        LocalDateTime horizon = LocalDateTime.now(clock).plus(properties.subscription().renewalLookahead());
        List<Long> candidates = userAccountRepository.findRenewalCandidateIds(horizon);
        return sweep(BillingJob.SUBSCRIPTION_RENEWAL, candidates, userId -> {
            RenewalOutcome outcome = renewalService.attemptRenewal(userId);
            return switch (outcome) {
                case RENEWED -> StepResult.SUCCEEDED;
                case SKIPPED -> StepResult.SKIPPED;
                default -> StepResult.FAILED;
            };
        });
    }

    public SweepResponse sendExpiryReminders() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Long> candidates = userAccountRepository.findReminderCandidateIds(
                now, now.plus(properties.subscription().reminderLookahead()));
        return sweep(BillingJob.SUBSCRIPTION_REMINDERS, candidates,
                userId -> expiryService.remindIfExpiringSoon(userId) ? StepResult.SUCCEEDED : StepResult.SKIPPED);
    }

    private SweepResponse sweep(BillingJob job, List<Long> candidates, Function<Long, StepResult> step) {
        log.info("Starting {} sweep: candidates={}", job.getPathName(), candidates.size());
        int succeeded = 0;
        List<Long> failed = new ArrayList<>();

        for (Long userId : candidates) {
            try {
                StepResult result = step.apply(userId);
                if (result == StepResult.SUCCEEDED) {
                    succeeded++;
                } else if (result == StepResult.FAILED) {
                    failed.add(userId);
                }
            } catch (RuntimeException e) {
                log.error("{} failed for userId={}", job.getPathName(), userId, e);
                failed.add(userId);
            }
        }

        log.info("Finished {} sweep: processed={}, succeeded={}, failed={}",
                job.getPathName(), candidates.size(), succeeded, failed.size());
        return new SweepResponse(job.getPathName(), candidates.size(), succeeded, failed.size(), failed);
    }

    private enum StepResult {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }
}
