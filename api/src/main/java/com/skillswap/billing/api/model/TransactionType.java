package com.skillswap.billing.api.model;

/**
 * Kind of ledger entry recorded for a user.
 */
public enum TransactionType {
    TOPUP,
    DEDUCTION,
    EARNINGS,
    REFUND,
    WITHDRAWAL,
    SUBSCRIPTION,
    COURSE_ENROLLMENT
}
