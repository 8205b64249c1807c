package com.skillswap.billing.api.request;

import jakarta.validation.constraints.NotNull;

public record AutoRenewalRequest(
        @NotNull(message = "enabled flag is required")
        Boolean enabled
) {
}
