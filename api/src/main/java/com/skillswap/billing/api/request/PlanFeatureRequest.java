package com.skillswap.billing.api.request;

import jakarta.validation.constraints.NotBlank;

public record PlanFeatureRequest(
        @NotBlank(message = "Feature name is required")
        String name,

        String description,

        boolean included
) {
}
