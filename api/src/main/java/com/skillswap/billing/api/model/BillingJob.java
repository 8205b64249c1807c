package com.skillswap.billing.api.model;

import java.util.Arrays;

/**
 * Scheduled billing jobs that an administrator may trigger manually.
 */
public enum BillingJob {
    SUBSCRIPTION_EXPIRY("subscription-expiry"),
    SUBSCRIPTION_RENEWAL("subscription-renewal"),
    SUBSCRIPTION_REMINDERS("subscription-reminders");

    private final String pathName;

    BillingJob(String pathName) {
        this.pathName = pathName;
    }

    public String getPathName() {
        return pathName;
    }

    public static BillingJob fromPathName(String pathName) {
        return Arrays.stream(values())
                .filter(job -> job.pathName.equalsIgnoreCase(pathName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job: " + pathName));
    }
}
