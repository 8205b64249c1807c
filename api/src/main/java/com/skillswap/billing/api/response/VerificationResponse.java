package com.skillswap.billing.api.response;

import com.skillswap.billing.api.model.TransactionStatus;

/**
 * Result of a client-driven payment verification.
 *
 * @param txRef            Payment reference
 * @param status           Transaction status after verification
 * @param alreadyProcessed {@code true} when the payment had been confirmed before this call
 * @param message          Human-readable outcome
 */
public record VerificationResponse(
        String txRef,
        TransactionStatus status,
        boolean alreadyProcessed,
        String message
) {}
