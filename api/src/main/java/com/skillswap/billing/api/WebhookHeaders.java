package com.skillswap.billing.api;

/**
 * HTTP headers used by payment provider callbacks.
 */
public final class WebhookHeaders {

    /**
     * Carries the shared secret hash or the HMAC-SHA256 hex digest of the raw body.
     */
    public static final String SIGNATURE = "verif-hash";

    private WebhookHeaders() {
    }
}
