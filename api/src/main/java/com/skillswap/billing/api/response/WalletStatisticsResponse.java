package com.skillswap.billing.api.response;

import java.util.List;

/**
 * Admin overview of all wallets and the ledger.
 *
 * <p>Wallet sums are in minor units of the wallet currency. Transaction buckets are split by
 * currency because top-ups may be paid in several.
 *
 * @param totalUsers            Billing accounts
 * @param usersWithBalance      Accounts with a positive balance
 * @param totalBalance          Sum of all balances
 * @param totalEarnings         Sum of lifetime credits
 * @param totalSpent            Sum of lifetime deductions
 * @param transactionsByStatus  Count and amount per status and currency
 * @param transactionsByType    Count and amount per type and currency
 */
public record WalletStatisticsResponse(
        long totalUsers,
        long usersWithBalance,
        long totalBalance,
        long totalEarnings,
        long totalSpent,
        List<Bucket> transactionsByStatus,
        List<Bucket> transactionsByType
) {
    public record Bucket(String key, String currency, long count, long totalAmount) {}
}
