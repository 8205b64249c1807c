package com.skillswap.billing.api.request;

import jakarta.validation.constraints.Min;

/**
 * Usage limits of a plan. {@code -1} means unlimited for the numeric limits.
 */
public record PlanLimitsRequest(
        @Min(value = -1, message = "coursesPerMonth must be -1 (unlimited) or greater")
        int coursesPerMonth,

        @Min(value = -1, message = "tutoringSessions must be -1 (unlimited) or greater")
        int tutoringSessions,

        boolean premiumContent,

        boolean aiAssistant,

        boolean prioritySupport
) {
}
