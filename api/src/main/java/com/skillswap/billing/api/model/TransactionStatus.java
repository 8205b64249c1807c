package com.skillswap.billing.api.model;

/**
 * Status of a ledger transaction.
 *
 * <p>{@code PENDING} is the only non-terminal state. A transaction moves exactly once to
 * {@code SUCCESSFUL}, {@code FAILED} or {@code CANCELLED} and never changes afterwards.
 */
public enum TransactionStatus {
    PENDING,
    SUCCESSFUL,
    FAILED,
    CANCELLED
}
