package com.skillswap.billing.api.response;

import java.util.List;

/**
 * Aggregated view of a user's transactions.
 */
public record TransactionSummaryResponse(
        Long userId,
        long totalTransactions,
        List<Bucket> byType,
        List<Bucket> byStatus
) {
    /**
     * Count and amount total for one type or status.
     */
    public record Bucket(String key, long count, long totalAmount) {}
}
