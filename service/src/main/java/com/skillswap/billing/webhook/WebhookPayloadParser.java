package com.skillswap.billing.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;

/**
 * Reads a Flutterwave-style event:
 * <pre>
 * {"event": "charge.completed",
 *  "data": {"id": 285959875, "tx_ref": "SUB_...", "amount": 2500.00, "currency": "NGN",
 *           "status": "successful", "narration": "..."}}
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class WebhookPayloadParser {

    private final ObjectMapper objectMapper;

    /**
     * @throws MalformedWebhookException if the body is not JSON or lacks {@code event} or {@code data.tx_ref}
     */
    public WebhookPayload parse(byte[] rawBody) {
        if (rawBody == null || rawBody.length == 0) {
            throw new MalformedWebhookException("Empty webhook body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new MalformedWebhookException("Webhook body is not valid JSON", e);
        } catch (IOException e) {
            throw new MalformedWebhookException("Webhook body could not be read", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedWebhookException("Webhook body must be a JSON object");
        }

        String event = text(root, "event");
        if (event == null) {
            throw new MalformedWebhookException("Webhook event is missing");
        }
        JsonNode data = root.path("data");
        String txRef = text(data, "tx_ref");
        if (txRef == null) {
            throw new MalformedWebhookException("Webhook data.tx_ref is missing");
        }

        String narration = text(data, "narration");
        if (narration == null) {
            narration = text(data, "processor_response");
        }
        return new WebhookPayload(event, txRef, text(data, "status"), amount(data.path("amount")),
                text(data, "currency"), text(data, "id"), narration);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }

    private static BigDecimal amount(JsonNode node) {
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedWebhookException("Webhook data.amount is not a number: " + node.asText());
            }
        }
        return null;
    }
}
