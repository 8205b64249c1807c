package com.skillswap.billing.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Decoder for the HS256 access tokens issued by the auth service.
 */
@Configuration
@RequiredArgsConstructor
public class JwtConfig {

    private static final String DEV_SECRET = "dev-secret-change-me";

    private final Environment environment;

    @Bean
    public JwtDecoder jwtDecoder(BillingProperties properties) {
        SecretKeySpec key = new SecretKeySpec(deriveKey(properties.security().jwtSecret()), "HmacSHA256");
        return NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
    }

    /**
     * Derives a fixed 32-byte key from the configured secret, so any secret length works for HS256.
     */
    byte[] deriveKey(String secret) {
        String value = secret == null ? "" : secret.trim();
        if (value.isEmpty()) {
            if (environment.acceptsProfiles(Profiles.of("dev", "test"))) {
                value = DEV_SECRET;
            } else {
                throw new IllegalStateException("billing.security.jwt-secret is empty. Set BILLING_JWT_SECRET.");
            }
        }
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
