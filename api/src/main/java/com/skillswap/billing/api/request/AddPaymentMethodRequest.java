package com.skillswap.billing.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Registers a reusable card authorization for renewals.
 *
 * @param provider           Payment provider name (e.g. flutterwave)
 * @param authorizationToken Provider token used to charge the card without user interaction
 * @param brand              Card brand for display
 * @param last4              Last four digits for display
 * @param primary            Whether this becomes the designated method for renewals
 */
public record AddPaymentMethodRequest(
        @NotBlank(message = "Provider is required")
        String provider,

        @NotBlank(message = "Authorization token is required")
        String authorizationToken,

        String brand,

        @Pattern(regexp = "\\d{4}", message = "last4 must be four digits")
        String last4,

        boolean primary
) {
}
