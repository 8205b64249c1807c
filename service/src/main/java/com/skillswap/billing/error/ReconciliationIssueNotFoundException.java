package com.skillswap.billing.error;

public class ReconciliationIssueNotFoundException extends RuntimeException {
    public ReconciliationIssueNotFoundException(String message) {
        super(message);
    }
}
