package com.skillswap.billing.api.response;

/**
 * Result of a wallet deduction.
 *
 * @param txRef              Reference of the deduction transaction
 * @param amount             Amount deducted
 * @param newBalance         Buyer balance after the deduction
 * @param courseId           Course enrolled, if any
 * @param instructorCredited {@code true} when the instructor was credited, {@code false} when the
 *                           credit failed and was flagged for reconciliation, {@code null} when no
 *                           instructor was involved
 */
public record DeductionResponse(
        String txRef,
        Long amount,
        Long newBalance,
        Long courseId,
        Boolean instructorCredited
) {}
