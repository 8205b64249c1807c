package com.skillswap.billing.error;

/**
 * Requested subscription operation conflicts with the user's current subscription state,
 * e.g. subscribing while a paid period is still running.
 */
public class SubscriptionStateException extends IllegalStateException {
    public SubscriptionStateException(String message) {
        super(message);
    }
}
