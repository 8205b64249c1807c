package com.skillswap.billing.gateway;

import java.math.BigDecimal;

/**
 * @param amount amount in provider units (see {@link ProviderAmountConverter})
 */
public record PaymentInitRequest(
        String txRef,
        BigDecimal amount,
        String currency,
        String customerEmail,
        String customerName,
        String redirectUrl,
        String description
) {}
