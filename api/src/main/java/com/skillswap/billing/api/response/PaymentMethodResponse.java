package com.skillswap.billing.api.response;

import java.time.LocalDateTime;

/**
 * Payment method as shown to its owner. The authorization token is never returned.
 */
public record PaymentMethodResponse(
        Long id,
        String provider,
        String brand,
        String last4,
        boolean primary,
        LocalDateTime createdAt
) {}
