package com.skillswap.billing.service;

import java.math.BigDecimal;

/**
 * Provider statement that a payment succeeded.
 *
 * @param txRef                 our payment reference
 * @param providerTransactionId provider transaction ID
 * @param amount                amount in provider units
 * @param currency              ISO 4217 code
 */
public record PaymentConfirmation(
        String txRef,
        String providerTransactionId,
        BigDecimal amount,
        String currency
) {}
