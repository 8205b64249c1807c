package com.skillswap.billing.error;

import com.skillswap.billing.api.model.ReconciliationIssueKind;
import lombok.Getter;

/**
 * A payment confirmation contradicts what was recorded: unknown reference, amount or currency
 * mismatch, or a second confirmation for an already resolved transaction with different data.
 * <p>
 * Never retried. The transaction is left untouched and the condition is recorded for manual
 * review.
 * </p>
 */
@Getter
public class PaymentIntegrityException extends RuntimeException {

    private final ReconciliationIssueKind kind;
    private final String txRef;

    public PaymentIntegrityException(ReconciliationIssueKind kind, String txRef, String message) {
        super(message);
        this.kind = kind;
        this.txRef = txRef;
    }
}
