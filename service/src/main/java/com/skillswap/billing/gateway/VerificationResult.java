package com.skillswap.billing.gateway;

import java.math.BigDecimal;

/**
 * Provider view of a transaction.
 *
 * @param status        provider status ({@code successful}, {@code failed}, {@code cancelled}, {@code pending})
 * @param amount        amount in provider units
 * @param currency      ISO 4217 code
 * @param txRef         our reference as echoed by the provider
 * @param transactionId provider transaction ID
 * @param message       provider narration, if any
 */
public record VerificationResult(
        String status,
        BigDecimal amount,
        String currency,
        String txRef,
        String transactionId,
        String message
) {
    public boolean isSuccessful() {
        return "successful".equalsIgnoreCase(status);
    }

    public boolean isFailed() {
        return "failed".equalsIgnoreCase(status) || "cancelled".equalsIgnoreCase(status);
    }
}
