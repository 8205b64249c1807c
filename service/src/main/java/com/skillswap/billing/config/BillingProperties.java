package com.skillswap.billing.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Set;

/**
 * Typed view of the {@code billing.*} configuration tree.
 *
 * <p>Example:
 * <pre>
 * billing:
 *   webhook:
 *     signature-mode: SECRET_HASH        # or HMAC_SHA256
 *     secret: ${FLUTTERWAVE_WEBHOOK_SECRET}
 *     max-attempts: 4
 *     base-delay: 1s
 *     multiplier: 2.0
 *   gateway:
 *     provider: flutterwave              # or simulated
 *     timeout: 10s
 *   subscription:
 *     renewal-lookahead: 3d
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "billing")
public record BillingProperties(
        @Valid @DefaultValue Webhook webhook,
        @Valid @DefaultValue Gateway gateway,
        @Valid @DefaultValue Wallet wallet,
        @Valid @DefaultValue Subscription subscription,
        @Valid @DefaultValue Notification notification,
        @Valid @DefaultValue Security security
) {

    public enum SignatureMode {
        /** Header carries the shared secret itself (Flutterwave {@code verif-hash}). */
        SECRET_HASH,
        /** Header carries the hex HMAC-SHA256 of the raw body keyed with the secret. */
        HMAC_SHA256
    }

    /**
     * @param signatureMode how the signature header is checked
     * @param secret        shared secret; when blank every webhook is rejected
     * @param maxAttempts   total attempts including the first one
     * @param baseDelay     delay before the first retry
     * @param multiplier    backoff multiplier between retries
     * @param retryThreads  threads of the retry scheduler
     */
    public record Webhook(
            @DefaultValue("SECRET_HASH") SignatureMode signatureMode,
            String secret,
            @DefaultValue("4") @Min(1) int maxAttempts,
            @DefaultValue("1s") @NotNull Duration baseDelay,
            @DefaultValue("2.0") @DecimalMin("1.0") double multiplier,
            @DefaultValue("2") @Min(1) int retryThreads
    ) {}

    /**
     * @param provider           {@code flutterwave} or {@code simulated}
     * @param baseUrl            provider API root
     * @param secretKey          provider API secret
     * @param timeout            bound on every provider call
     * @param amountScale        decimal places between ledger minor units and provider amounts
     * @param chargeMaxAttempts  attempts for a renewal charge that timed out
     * @param defaultRedirectUrl checkout return URL when the client gives none
     */
    public record Gateway(
            @DefaultValue("simulated") @NotBlank String provider,
            @DefaultValue("https://api.flutterwave.com/v3") String baseUrl,
            String secretKey,
            @DefaultValue("10s") @NotNull Duration timeout,
            @DefaultValue("2") @Min(0) int amountScale,
            @DefaultValue("3") @Min(1) int chargeMaxAttempts,
            @DefaultValue("http://localhost:3000/payment/callback") String defaultRedirectUrl
    ) {}

    /**
     * @param currency        currency of internal token movements (deductions, earnings)
     * @param topUpCurrencies currencies accepted for top-ups
     */
    public record Wallet(
            @DefaultValue("NGN") String currency,
            @DefaultValue({"NGN", "USD", "GHS", "KES"}) Set<String> topUpCurrencies
    ) {}

    /**
     * @param renewalLookahead how long before the end date renewal is attempted
     * @param reminderLookahead how long before the end date the expiry reminder goes out
     * @param pendingCheckoutTimeout how long an unpaid subscription checkout blocks a new one
     */
    public record Subscription(
            @DefaultValue("3d") @NotNull Duration renewalLookahead,
            @DefaultValue("3d") @NotNull Duration reminderLookahead,
            @DefaultValue("30m") @NotNull Duration pendingCheckoutTimeout
    ) {}

    /**
     * @param dispatcher {@code logging} or {@code http}
     * @param url        endpoint of the notification delivery service
     * @param timeout    bound on one delivery call
     */
    public record Notification(
            @DefaultValue("logging") String dispatcher,
            String url,
            @DefaultValue("5s") Duration timeout
    ) {}

    /**
     * @param jwtSecret HS256 secret shared with the auth service
     */
    public record Security(
            String jwtSecret
    ) {}
}
