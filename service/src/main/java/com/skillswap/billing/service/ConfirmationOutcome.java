package com.skillswap.billing.service;

public enum ConfirmationOutcome {
    /** The transaction was resolved by this call. */
    APPLIED,
    /** The transaction had been resolved before; nothing changed. */
    ALREADY_PROCESSED
}
