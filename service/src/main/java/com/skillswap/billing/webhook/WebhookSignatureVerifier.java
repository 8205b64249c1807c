package com.skillswap.billing.webhook;

import com.skillswap.billing.config.BillingProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks the provider signature header against the raw request body.
 *
 * <p>Modes:
 * <ul>
 *   <li>{@code SECRET_HASH}: header equals the shared secret (Flutterwave {@code verif-hash})</li>
 *   <li>{@code HMAC_SHA256}: header is the lowercase hex HMAC-SHA256 of the body</li>
 * </ul>
 * A blank secret rejects every request.
 */
@Component
public class WebhookSignatureVerifier {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private final BillingProperties.SignatureMode mode;
    private final String secret;

    public WebhookSignatureVerifier(BillingProperties properties) {
        this.mode = properties.webhook().signatureMode();
        this.secret = properties.webhook().secret();
    }

    public boolean verify(byte[] rawBody, String signatureHeader) {
        if (secret == null || secret.isBlank() || signatureHeader == null || signatureHeader.isBlank()) {
            return false;
        }
        String expected = switch (mode) {
            case SECRET_HASH -> secret;
            case HMAC_SHA256 -> hmacSha256Hex(rawBody == null ? new byte[0] : rawBody, secret);
        };
        // constant-time compare
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signatureHeader.trim().getBytes(StandardCharsets.UTF_8));
    }

    public static String hmacSha256Hex(byte[] rawBody, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return HexFormat.of().formatHex(mac.doFinal(rawBody));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC calculation failed", e);
        }
    }
}
