package com.skillswap.billing.api.model;

public enum ReconciliationIssueKind {
    WEBHOOK_RETRIES_EXHAUSTED,
    AMOUNT_MISMATCH,
    UNKNOWN_REFERENCE,
    MISSING_REFERENCE,
    STATE_CONFLICT,
    INSTRUCTOR_CREDIT_FAILED,
    /** The provider charged a renewal but the charge could not be applied to the subscription. */
    CHARGE_UNCONFIRMED
}
