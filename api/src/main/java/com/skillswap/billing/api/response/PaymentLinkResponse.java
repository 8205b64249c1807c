package com.skillswap.billing.api.response;

import com.skillswap.billing.api.model.TransactionStatus;

/**
 * Response for operations that send the user to the payment provider.
 *
 * @param txRef       Our payment reference, used later for verification
 * @param paymentLink Hosted checkout URL; {@code null} when no payment was needed (free plan)
 * @param amount      Amount to be charged in minor units
 * @param currency    ISO 4217 code
 * @param status      Status of the transaction created for this payment
 */
public record PaymentLinkResponse(
        String txRef,
        String paymentLink,
        Long amount,
        String currency,
        TransactionStatus status
) {}
