package com.skillswap.billing.gateway;

import java.math.BigDecimal;

/**
 * @param amount amount in provider units (see {@link ProviderAmountConverter})
 */
public record ChargeRequest(
        String txRef,
        BigDecimal amount,
        String currency,
        String authorizationToken,
        String customerEmail,
        String narration
) {}
