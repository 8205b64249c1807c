package com.skillswap.billing.service;

public enum RenewalOutcome {
    RENEWED,
    /** The provider declined the charge. */
    DECLINED,
    /** No payment method or no renewable plan. */
    PAST_DUE,
    /** The user no longer qualified for renewal when locked. */
    SKIPPED,
    /** Unexpected failure; the subscription was moved to PAST_DUE. */
    ERROR
}
