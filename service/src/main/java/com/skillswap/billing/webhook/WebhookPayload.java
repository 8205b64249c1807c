package com.skillswap.billing.webhook;

import java.math.BigDecimal;

/**
 * Fields of a provider event used by the reconciler.
 *
 * @param event                 event name, e.g. {@code charge.completed}
 * @param txRef                 our payment reference ({@code data.tx_ref})
 * @param status                provider status ({@code successful}, {@code failed}, {@code cancelled}, {@code pending})
 * @param amount                amount in provider units, may be {@code null}
 * @param currency              ISO 4217 code, may be {@code null}
 * @param providerTransactionId provider transaction ID ({@code data.id}), may be {@code null}
 * @param narration             provider reason for a failure, may be {@code null}
 */
public record WebhookPayload(
        String event,
        String txRef,
        String status,
        BigDecimal amount,
        String currency,
        String providerTransactionId,
        String narration
) {
    public static final String CHARGE_COMPLETED = "charge.completed";

    public boolean isChargeCompleted() {
        return CHARGE_COMPLETED.equalsIgnoreCase(event);
    }

    public boolean isSuccessful() {
        return "successful".equalsIgnoreCase(status);
    }

    public boolean isFailed() {
        return "failed".equalsIgnoreCase(status);
    }

    public boolean isCancelled() {
        return "cancelled".equalsIgnoreCase(status);
    }
}
