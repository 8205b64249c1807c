package com.skillswap.billing.api.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Client-driven verification of a payment when the webhook has not arrived yet.
 *
 * @param txRef         Our payment reference returned by subscribe/top-up
 * @param transactionId Provider transaction ID returned to the client after checkout
 */
public record VerifyPaymentRequest(
        @NotBlank(message = "txRef is required")
        String txRef,

        @NotBlank(message = "Transaction ID is required")
        String transactionId
) {
}
