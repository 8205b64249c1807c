package com.skillswap.billing.api.model;

/**
 * Result of processing one inbound payment provider notification.
 */
public enum WebhookOutcome {
    /** State change applied. */
    APPLIED,
    /** Transaction was already resolved; nothing changed. */
    ALREADY_PROCESSED,
    /** Event type carries no business meaning for billing. */
    IGNORED,
    /** Provider reported a failed or cancelled charge; transaction resolved accordingly. */
    FAILED_RECORDED,
    /** Retries exhausted; transaction flagged for manual reconciliation. */
    FLAGGED_FOR_RECONCILIATION,
    /** Signature check failed. */
    REJECTED_SIGNATURE,
    /** Payload malformed or failed an integrity check. */
    REJECTED_INVALID,
    /** Retries exhausted and the flag could not be stored; the provider should re-deliver. */
    PROCESSING_ERROR
}
