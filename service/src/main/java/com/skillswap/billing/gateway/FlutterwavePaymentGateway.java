package com.skillswap.billing.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.skillswap.billing.config.BillingProperties;
import com.skillswap.billing.error.PaymentGatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Flutterwave v3 adapter.
 *
 * <p>Uses:
 * <ul>
 *   <li>{@code POST /payments} for hosted checkout links</li>
 *   <li>{@code POST /tokenized-charges} for renewals against a stored card token</li>
 *   <li>{@code GET /transactions/{id}/verify} for verification</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(value = "billing.gateway.provider", havingValue = "flutterwave")
@Slf4j
public class FlutterwavePaymentGateway implements PaymentGateway {

    private final WebClient webClient;
    private final Duration timeout;

    public FlutterwavePaymentGateway(@Qualifier("paymentGatewayWebClient") WebClient webClient,
                                     BillingProperties properties) {
        this.webClient = webClient;
        this.timeout = properties.gateway().timeout();
    }

    @Override
    public PaymentLink initializePayment(PaymentInitRequest request) {
        log.info("Requesting checkout link: txRef={}, amount={}, currency={}",
                request.txRef(), request.amount(), request.currency());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tx_ref", request.txRef());
        body.put("amount", request.amount());
        body.put("currency", request.currency());
        body.put("redirect_url", request.redirectUrl());
        body.put("customer", Map.of(
                "email", nullToEmpty(request.customerEmail()),
                "name", nullToEmpty(request.customerName())));
        body.put("customizations", Map.of(
                "title", "SkillSwap",
                "description", nullToEmpty(request.description())));

        JsonNode response = call("initializePayment", webClient.post().uri("/payments").bodyValue(body)
                .retrieve().bodyToMono(JsonNode.class));

        String link = response.path("data").path("link").asText(null);
        if (!"success".equals(response.path("status").asText()) || link == null) {
            throw new PaymentGatewayException("Provider did not return a payment link: "
                    + response.path("message").asText("unknown error"), false);
        }
        return new PaymentLink(link);
    }

    @Override
    public ChargeResult charge(ChargeRequest request) {
        log.info("Charging stored authorization: txRef={}, amount={}, currency={}",
                request.txRef(), request.amount(), request.currency());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("token", request.authorizationToken());
        body.put("currency", request.currency());
        body.put("amount", request.amount());
        body.put("email", request.customerEmail());
        body.put("tx_ref", request.txRef());
        body.put("narration", request.narration());

        JsonNode response;
        try {
            response = call("charge", webClient.post().uri("/tokenized-charges").bodyValue(body)
                    .retrieve().bodyToMono(JsonNode.class));
        } catch (PaymentGatewayException e) {
            if (e.isRetryable()) {
                throw e;
            }
            return ChargeResult.declined(e.getMessage());
        }

        JsonNode data = response.path("data");
        if ("success".equals(response.path("status").asText())
                && "successful".equalsIgnoreCase(data.path("status").asText())) {
            return ChargeResult.succeeded(data.path("id").asText());
        }
        String reason = data.path("processor_response").asText(
                response.path("message").asText("Payment failed"));
        return ChargeResult.declined(reason);
    }

    @Override
    public VerificationResult verify(String providerTransactionId) {
        log.info("Verifying provider transaction: transactionId={}", providerTransactionId);

        JsonNode response = call("verify", webClient.get()
                .uri("/transactions/{id}/verify", providerTransactionId)
                .retrieve().bodyToMono(JsonNode.class));

        JsonNode data = response.path("data");
        return new VerificationResult(
                data.path("status").asText("unknown"),
                data.hasNonNull("amount") ? data.path("amount").decimalValue() : null,
                data.path("currency").asText(null),
                data.path("tx_ref").asText(null),
                data.path("id").asText(providerTransactionId),
                data.path("processor_response").asText(response.path("message").asText(null)));
    }

    private JsonNode call(String operation, Mono<JsonNode> request) {
        try {
            JsonNode response = request.timeout(timeout).block();
            if (response == null) {
                throw new PaymentGatewayException("Empty response from provider on " + operation, true);
            }
            return response;
        } catch (WebClientResponseException e) {
            boolean retryable = e.getStatusCode().is5xxServerError();
            log.warn("Provider rejected {}: status={}, body={}", operation, e.getStatusCode(), e.getResponseBodyAsString());
            throw new PaymentGatewayException("Provider returned " + e.getStatusCode().value() + " on " + operation,
                    retryable, e);
        } catch (WebClientRequestException e) {
            log.warn("Provider unreachable on {}: {}", operation, e.getMessage());
            throw new PaymentGatewayException("Provider unreachable on " + operation, true, e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                log.warn("Provider call timed out: operation={}, timeout={}", operation, timeout);
                throw new PaymentGatewayException("Provider call timed out on " + operation, true, e);
            }
            throw e;
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
