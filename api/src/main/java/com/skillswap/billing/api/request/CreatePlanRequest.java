package com.skillswap.billing.api.request;

import com.skillswap.billing.api.model.PlanDuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Admin request for creating a subscription plan.
 *
 * @param name        Unique plan name
 * @param description Marketing description
 * @param price       Price in minor currency units (0 for a free plan)
 * @param currency    ISO 4217 code (NGN, USD, EUR, GBP)
 * @param duration    Billing period
 * @param features    Feature list shown to users
 * @param limits      Usage limits
 * @param sortOrder   Display order (ascending)
 */
public record CreatePlanRequest(
        @NotBlank(message = "Plan name is required")
        @Size(max = 100, message = "Plan name must not exceed 100 characters")
        String name,

        @Size(max = 500, message = "Description must not exceed 500 characters")
        String description,

        @NotNull(message = "Price is required")
        @PositiveOrZero(message = "Price must not be negative")
        Long price,

        @NotBlank(message = "Currency is required")
        @Pattern(regexp = "NGN|USD|EUR|GBP", message = "Currency must be one of NGN, USD, EUR, GBP")
        String currency,

        @NotNull(message = "Duration is required")
        PlanDuration duration,

        List<@Valid PlanFeatureRequest> features,

        @Valid
        PlanLimitsRequest limits,

        Integer sortOrder
) {
}
