package com.skillswap.billing.config;

import com.skillswap.billing.error.PaymentGatewayException;
import com.skillswap.billing.error.PaymentIntegrityException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Retry policies.
 *
 * <p>Webhook processing: exponential backoff (base delay, multiplier) up to a fixed number of
 * attempts. Integrity and validation errors are final and never retried.
 *
 * <p>Renewal charges: retried only on retryable gateway failures (timeouts, 5xx). The charge
 * carries the same txRef on every attempt, which the provider deduplicates.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String WEBHOOK_RETRY = "webhookProcessing";
    public static final String GATEWAY_CHARGE_RETRY = "gatewayCharge";

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    @Bean
    public Retry webhookRetry(RetryRegistry registry, BillingProperties properties) {
        BillingProperties.Webhook webhook = properties.webhook();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(webhook.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(webhook.baseDelay(), webhook.multiplier()))
                .retryOnException(ResilienceConfig::isRetryableWebhookFailure)
                .build();

        Retry retry = registry.retry(WEBHOOK_RETRY, config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying webhook processing: attempt={}, wait={}, cause={}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                        event.getLastThrowable() == null ? null : event.getLastThrowable().toString()));
        log.info("Webhook retry policy: maxAttempts={}, baseDelay={}, multiplier={}",
                webhook.maxAttempts(), webhook.baseDelay(), webhook.multiplier());
        return retry;
    }

    @Bean
    public Retry gatewayChargeRetry(RetryRegistry registry, BillingProperties properties) {
        BillingProperties.Webhook webhook = properties.webhook();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(properties.gateway().chargeMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(webhook.baseDelay(), webhook.multiplier()))
                .retryOnException(e -> e instanceof PaymentGatewayException gatewayException && gatewayException.isRetryable())
                .build();
        return registry.retry(GATEWAY_CHARGE_RETRY, config);
    }

    static boolean isRetryableWebhookFailure(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        if (cause instanceof PaymentIntegrityException || cause instanceof IllegalArgumentException) {
            return false;
        }
        if (cause instanceof PaymentGatewayException gatewayException) {
            return gatewayException.isRetryable();
        }
        return true;
    }

    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
