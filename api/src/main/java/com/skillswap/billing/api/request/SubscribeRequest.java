package com.skillswap.billing.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request to start a subscription to a plan.
 *
 * @param planId      Plan to subscribe to (must be active)
 * @param redirectUrl Where the payment provider sends the user after checkout (optional)
 */
public record SubscribeRequest(
        @NotNull(message = "Plan ID is required")
        @Positive(message = "Plan ID must be positive")
        Long planId,

        String redirectUrl
) {
}
