package com.skillswap.billing.webhook;

import com.skillswap.billing.api.model.WebhookOutcome;
import com.skillswap.billing.api.response.WebhookAckResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Final answer to one webhook delivery.
 */
public record WebhookResult(WebhookOutcome outcome, HttpStatus status, String txRef, String message) {

    public static WebhookResult ok(WebhookOutcome outcome, String txRef, String message) {
        return new WebhookResult(outcome, HttpStatus.OK, txRef, message);
    }

    public ResponseEntity<WebhookAckResponse> toResponseEntity() {
        return ResponseEntity.status(status).body(new WebhookAckResponse(outcome, txRef, message));
    }
}
