package com.skillswap.billing.api.response;

/**
 * Wallet balance snapshot, all amounts in minor currency units.
 */
public record BalanceResponse(
        Long userId,
        Long balance,
        Long totalEarnings,
        Long totalSpent
) {}
