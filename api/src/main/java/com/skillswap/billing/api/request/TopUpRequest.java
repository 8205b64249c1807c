package com.skillswap.billing.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for topping up the wallet from an external payment.
 *
 * @param amount      Amount in minor currency units
 * @param currency    ISO 4217 code (NGN, USD, GHS, KES)
 * @param redirectUrl Where the payment provider sends the user after checkout (optional)
 */
public record TopUpRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        @NotBlank(message = "Currency is required")
        String currency,

        String redirectUrl
) {
}
