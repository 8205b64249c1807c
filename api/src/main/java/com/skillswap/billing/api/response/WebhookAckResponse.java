package com.skillswap.billing.api.response;

import com.skillswap.billing.api.model.WebhookOutcome;

public record WebhookAckResponse(
        WebhookOutcome outcome,
        String txRef,
        String message
) {}
