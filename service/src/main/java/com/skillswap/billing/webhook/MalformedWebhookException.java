package com.skillswap.billing.webhook;

/**
 * Webhook body is not valid JSON or lacks a required field. Never retried.
 */
public class MalformedWebhookException extends IllegalArgumentException {
    public MalformedWebhookException(String message) {
        super(message);
    }

    public MalformedWebhookException(String message, Throwable cause) {
        super(message, cause);
    }
}
