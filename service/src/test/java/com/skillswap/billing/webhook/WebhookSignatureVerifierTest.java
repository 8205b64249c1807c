package com.skillswap.billing.webhook;

import com.skillswap.billing.config.BillingProperties;
import com.skillswap.billing.support.TestProperties;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookSignatureVerifierTest {

    private static final byte[] BODY = "{\"event\":\"charge.completed\"}".getBytes(StandardCharsets.UTF_8);

    @Test
    void verify_WhenSecretHashMatches_ShouldAccept() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(TestProperties.defaults());

        assertThat(verifier.verify(BODY, TestProperties.WEBHOOK_SECRET)).isTrue();
        assertThat(verifier.verify(BODY, "  " + TestProperties.WEBHOOK_SECRET + " ")).isTrue();
    }

    @Test
    void verify_WhenSignatureMissingOrWrong_ShouldReject() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(TestProperties.defaults());

        assertThat(verifier.verify(BODY, null)).isFalse();
        assertThat(verifier.verify(BODY, "")).isFalse();
        assertThat(verifier.verify(BODY, "wrong-secret")).isFalse();
    }

    @Test
    void verify_WhenSecretNotConfigured_ShouldRejectEverything() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(
                TestProperties.withWebhook(BillingProperties.SignatureMode.SECRET_HASH, " ", 3));

        assertThat(verifier.verify(BODY, " ")).isFalse();
        assertThat(verifier.verify(BODY, "anything")).isFalse();
    }

    @Test
    void verify_WhenHmacMode_ShouldCheckDigestOfBody() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(
                TestProperties.withWebhook(BillingProperties.SignatureMode.HMAC_SHA256, "hmac-secret", 3));
        String signature = WebhookSignatureVerifier.hmacSha256Hex(BODY, "hmac-secret");

        assertThat(signature).hasSize(64);
        assertThat(verifier.verify(BODY, signature)).isTrue();
        assertThat(verifier.verify("{}".getBytes(StandardCharsets.UTF_8), signature)).isFalse();
        assertThat(verifier.verify(BODY, "hmac-secret")).isFalse();
    }
}
