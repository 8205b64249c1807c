package com.skillswap.billing.service;

import com.skillswap.billing.api.model.TransactionStatus;

/**
 * Provider statement that a payment failed or was cancelled.
 *
 * @param status FAILED or CANCELLED
 * @param reason provider's stated reason
 */
public record PaymentFailure(
        String txRef,
        String providerTransactionId,
        TransactionStatus status,
        String reason
) {}
