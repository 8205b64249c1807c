package com.skillswap.billing.error;

import lombok.Getter;

/**
 * Wallet balance is lower than the requested deduction. Carries both amounts so the caller can
 * react without another round-trip.
 */
@Getter
public class InsufficientFundsException extends RuntimeException {

    private final long requiredAmount;
    private final long currentBalance;

    public InsufficientFundsException(long requiredAmount, long currentBalance) {
        super(String.format("Insufficient balance: required %d, available %d", requiredAmount, currentBalance));
        this.requiredAmount = requiredAmount;
        this.currentBalance = currentBalance;
    }
}
