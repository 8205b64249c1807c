package com.skillswap.billing.api.model;

public enum SubscriptionStatus {
    INACTIVE,
    ACTIVE,
    PAST_DUE,
    CANCELLED,
    EXPIRED
}
