package com.skillswap.billing.event;

public final class BillingEventType {

    public static final String SUBSCRIPTION_ACTIVATED = "subscription.activated";
    public static final String SUBSCRIPTION_RENEWED = "subscription.renewed";
    public static final String SUBSCRIPTION_RENEWAL_FAILED = "subscription.renewal_failed";
    public static final String SUBSCRIPTION_PAST_DUE = "subscription.past_due";
    public static final String SUBSCRIPTION_EXPIRED = "subscription.expired";
    public static final String SUBSCRIPTION_EXPIRING_SOON = "subscription.expiring_soon";
    public static final String SUBSCRIPTION_CANCELLED = "subscription.cancelled";
    public static final String PAYMENT_SUCCEEDED = "payment.succeeded";
    public static final String PAYMENT_FAILED = "payment.failed";
    public static final String COURSE_ENROLLED = "course.enrolled";
    public static final String WALLET_CREDITED = "wallet.credited";
    public static final String WALLET_DEDUCTED = "wallet.deducted";

    private BillingEventType() {
    }
}
