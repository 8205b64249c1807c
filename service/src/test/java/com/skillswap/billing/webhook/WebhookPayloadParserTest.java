package com.skillswap.billing.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookPayloadParserTest {

    private final WebhookPayloadParser parser = new WebhookPayloadParser(new ObjectMapper());

    @Test
    void parse_WhenChargeCompleted_ShouldReadAllFields() {
        WebhookPayload payload = parser.parse(bytes("""
                {"event": "charge.completed",
                 "data": {"id": 285959875, "tx_ref": "SUB_1_2_abc", "amount": 2500.00, "currency": "NGN",
                          "status": "successful", "narration": "Pro Monthly"}}
                """));

        assertThat(payload.event()).isEqualTo("charge.completed");
        assertThat(payload.txRef()).isEqualTo("SUB_1_2_abc");
        assertThat(payload.providerTransactionId()).isEqualTo("285959875");
        assertThat(payload.amount()).isEqualByComparingTo(new BigDecimal("2500.00"));
        assertThat(payload.currency()).isEqualTo("NGN");
        assertThat(payload.isChargeCompleted()).isTrue();
        assertThat(payload.isSuccessful()).isTrue();
    }

    @Test
    void parse_WhenAmountIsTextAndNarrationMissing_ShouldUseProcessorResponse() {
        WebhookPayload payload = parser.parse(bytes("""
                {"event": "charge.completed",
                 "data": {"tx_ref": "TOPUP_9", "amount": "150.50", "status": "failed",
                          "processor_response": "Insufficient funds"}}
                """));

        assertThat(payload.amount()).isEqualByComparingTo(new BigDecimal("150.50"));
        assertThat(payload.narration()).isEqualTo("Insufficient funds");
        assertThat(payload.isFailed()).isTrue();
        assertThat(payload.providerTransactionId()).isNull();
    }

    @Test
    void parse_WhenBodyIsNotJson_ShouldThrowMalformed() {
        assertThatThrownBy(() -> parser.parse(bytes("not json")))
                .isInstanceOf(MalformedWebhookException.class);
        assertThatThrownBy(() -> parser.parse(new byte[0]))
                .isInstanceOf(MalformedWebhookException.class);
    }

    @Test
    void parse_WhenTxRefMissing_ShouldThrowMalformed() {
        assertThatThrownBy(() -> parser.parse(bytes("{\"event\": \"charge.completed\", \"data\": {\"status\": \"successful\"}}")))
                .isInstanceOf(MalformedWebhookException.class)
                .hasMessageContaining("tx_ref");
    }

    @Test
    void parse_WhenAmountIsGarbage_ShouldThrowMalformed() {
        assertThatThrownBy(() -> parser.parse(bytes("{\"event\": \"charge.completed\", \"data\": {\"tx_ref\": \"X\", \"amount\": \"ten\"}}")))
                .isInstanceOf(MalformedWebhookException.class);
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
