package com.skillswap.billing.api.model;

import java.time.LocalDateTime;

/**
 * Billing period of a subscription plan.
 *
 * <p>Periods are calendar based: adding one month to 2024-01-31 yields 2024-02-29,
 * not a fixed number of days.
 */
public enum PlanDuration {
    MONTHLY,
    QUARTERLY,
    YEARLY;

    /**
     * Adds one billing period to the given instant.
     *
     * @param from start of the period
     * @return end of the period
     */
    public LocalDateTime addTo(LocalDateTime from) {
        return switch (this) {
            case MONTHLY -> from.plusMonths(1);
            case QUARTERLY -> from.plusMonths(3);
            case YEARLY -> from.plusYears(1);
        };
    }
}
