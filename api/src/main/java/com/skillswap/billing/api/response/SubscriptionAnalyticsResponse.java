package com.skillswap.billing.api.response;

import java.util.Map;

/**
 * Admin overview of subscriptions.
 *
 * @param proUsers          Users with Pro access right now
 * @param usersByStatus     User count per subscription status
 * @param revenueByCurrency Sum of successful subscription payments per currency
 */
public record SubscriptionAnalyticsResponse(
        long proUsers,
        Map<String, Long> usersByStatus,
        Map<String, Long> revenueByCurrency
) {}
