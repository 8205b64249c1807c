package com.skillswap.billing.api.response;

import com.skillswap.billing.api.model.SubscriptionStatus;

import java.time.LocalDateTime;

/**
 * Current subscription of the authenticated user.
 *
 * @param pro                      Whether Pro features are unlocked
 * @param status                   Subscription status
 * @param plan                     Current plan, {@code null} if the user never subscribed
 * @param startDate                Start of the current period
 * @param endDate                  End of the current period
 * @param daysRemaining            Whole days until {@code endDate}, rounded up, never negative
 * @param autoRenewal              Whether the renewal sweep will charge the user
 * @param cancelAtPeriodEnd        Whether the user cancelled; access ends at {@code endDate}
 * @param lastPaymentFailureReason Reason of the last failed charge, if any
 */
public record MySubscriptionResponse(
        boolean pro,
        SubscriptionStatus status,
        PlanResponse plan,
        LocalDateTime startDate,
        LocalDateTime endDate,
        long daysRemaining,
        boolean autoRenewal,
        boolean cancelAtPeriodEnd,
        String lastPaymentFailureReason
) {}
