package com.skillswap.billing.api.request;

import com.skillswap.billing.api.model.PlanDuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Admin request for updating a plan. {@code null} fields are left unchanged.
 *
 * <p>Transactions already recorded against the plan keep their own snapshot of name,
 * price and duration.
 */
public record UpdatePlanRequest(
        @Size(max = 100, message = "Plan name must not exceed 100 characters")
        String name,

        @Size(max = 500, message = "Description must not exceed 500 characters")
        String description,

        @PositiveOrZero(message = "Price must not be negative")
        Long price,

        @Pattern(regexp = "NGN|USD|EUR|GBP", message = "Currency must be one of NGN, USD, EUR, GBP")
        String currency,

        PlanDuration duration,

        List<@Valid PlanFeatureRequest> features,

        @Valid
        PlanLimitsRequest limits,

        Boolean active,

        Integer sortOrder
) {
}
