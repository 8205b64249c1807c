package com.skillswap.billing.service;

/**
 * Committed wallet deduction.
 *
 * @param txRef      reference of the DEDUCTION transaction
 * @param amount     amount deducted
 * @param newBalance balance after the deduction
 */
public record WalletDebit(String txRef, long amount, long newBalance) {}
