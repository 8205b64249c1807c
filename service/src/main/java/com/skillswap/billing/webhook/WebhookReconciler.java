package com.skillswap.billing.webhook;

import com.skillswap.billing.api.model.ReconciliationIssueKind;
import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.model.WebhookOutcome;
import com.skillswap.billing.config.ResilienceConfig;
import com.skillswap.billing.error.PaymentIntegrityException;
import com.skillswap.billing.service.ConfirmationOutcome;
import com.skillswap.billing.service.PaymentConfirmation;
import com.skillswap.billing.service.PaymentConfirmationService;
import com.skillswap.billing.service.PaymentFailure;
import com.skillswap.billing.service.ReconciliationIssueService;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Turns provider webhooks into ledger state changes.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>signature check on the raw body (401)</li>
 *   <li>parse (400)</li>
 *   <li>only {@code charge.completed} with a final status is acted upon, everything else is acknowledged</li>
 *   <li>confirmation or failure recording, retried with exponential backoff on transient errors</li>
 * </ol>
 *
 * <p>Integrity errors are never retried: they are recorded for manual review and answered with
 * 400. When retries run out the transaction is flagged for reconciliation and the provider gets
 * 200; only when the flag itself cannot be stored does the provider get 500 and re-deliver.
 */
@Service
@Slf4j
public class WebhookReconciler {

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookPayloadParser payloadParser;
    private final PaymentConfirmationService confirmationService;
    private final ReconciliationIssueService reconciliationIssueService;
    private final WebhookRetryExecutor retryExecutor;
    private final Retry webhookRetry;

    public WebhookReconciler(WebhookSignatureVerifier signatureVerifier,
                             WebhookPayloadParser payloadParser,
                             PaymentConfirmationService confirmationService,
                             ReconciliationIssueService reconciliationIssueService,
                             WebhookRetryExecutor retryExecutor,
                             @Qualifier("webhookRetry") Retry webhookRetry) {
        this.signatureVerifier = signatureVerifier;
        this.payloadParser = payloadParser;
        this.confirmationService = confirmationService;
        this.reconciliationIssueService = reconciliationIssueService;
        this.retryExecutor = retryExecutor;
        this.webhookRetry = webhookRetry;
    }

    /**
     * Handles one delivery.
     *
     * @param rawBody       request body exactly as received
     * @param signature     signature header, may be {@code null}
     * @param remoteAddress caller address, for logging
     * @param userAgent     caller user agent, for logging
     * @return final result; completes after any retries
     */
    public CompletableFuture<WebhookResult> handle(byte[] rawBody, String signature, String remoteAddress,
                                                   String userAgent) {
        if (!signatureVerifier.verify(rawBody, signature)) {
            log.warn("Webhook rejected, invalid signature: remoteAddress={}, userAgent={}, signaturePresent={}",
                    remoteAddress, userAgent, signature != null);
            return CompletableFuture.completedFuture(new WebhookResult(WebhookOutcome.REJECTED_SIGNATURE,
                    HttpStatus.UNAUTHORIZED, null, "Invalid signature"));
        }

        WebhookPayload payload;
        try {
            payload = payloadParser.parse(rawBody);
        } catch (MalformedWebhookException e) {
            log.warn("Webhook rejected, malformed payload: remoteAddress={}, error={}", remoteAddress, e.getMessage());
            return CompletableFuture.completedFuture(new WebhookResult(WebhookOutcome.REJECTED_INVALID,
                    HttpStatus.BAD_REQUEST, null, e.getMessage()));
        }

        if (!payload.isChargeCompleted()) {
            log.info("Webhook ignored: event={}, txRef={}", payload.event(), payload.txRef());
            return CompletableFuture.completedFuture(WebhookResult.ok(WebhookOutcome.IGNORED, payload.txRef(),
                    "Event " + payload.event() + " ignored"));
        }
        if (!payload.isSuccessful() && !payload.isFailed() && !payload.isCancelled()) {
            log.info("Webhook ignored, non-final status: txRef={}, status={}", payload.txRef(), payload.status());
            return CompletableFuture.completedFuture(WebhookResult.ok(WebhookOutcome.IGNORED, payload.txRef(),
                    "Status " + payload.status() + " ignored"));
        }

        log.info("Webhook accepted: txRef={}, status={}, providerTransactionId={}, amount={}, currency={}",
                payload.txRef(), payload.status(), payload.providerTransactionId(), payload.amount(), payload.currency());

        Supplier<CompletionStage<WebhookResult>> attempt = () ->
                CompletableFuture.supplyAsync(() -> process(payload), retryExecutor.scheduler());

        return webhookRetry.executeCompletionStage(retryExecutor.scheduler(), attempt)
                .toCompletableFuture()
                .handle((result, error) -> error == null ? result : onFailure(payload, ResilienceConfig.unwrap(error)));
    }

    /**
     * One processing attempt, one database transaction.
     */
    WebhookResult process(WebhookPayload payload) {
        if (payload.isSuccessful()) {
            ConfirmationOutcome outcome = confirmationService.confirmSuccess(new PaymentConfirmation(
                    payload.txRef(), payload.providerTransactionId(), payload.amount(), payload.currency()));
            return outcome == ConfirmationOutcome.APPLIED
                    ? WebhookResult.ok(WebhookOutcome.APPLIED, payload.txRef(), "Payment applied")
                    : WebhookResult.ok(WebhookOutcome.ALREADY_PROCESSED, payload.txRef(), "Payment already processed");
        }

        TransactionStatus status = payload.isCancelled() ? TransactionStatus.CANCELLED : TransactionStatus.FAILED;
        ConfirmationOutcome outcome = confirmationService.recordFailure(new PaymentFailure(
                payload.txRef(), payload.providerTransactionId(), status, payload.narration()));
        return outcome == ConfirmationOutcome.APPLIED
                ? WebhookResult.ok(WebhookOutcome.FAILED_RECORDED, payload.txRef(), "Payment failure recorded")
                : WebhookResult.ok(WebhookOutcome.ALREADY_PROCESSED, payload.txRef(), "Payment already resolved");
    }

    private WebhookResult onFailure(WebhookPayload payload, Throwable cause) {
        String txRef = payload.txRef();

        if (cause instanceof PaymentIntegrityException integrity) {
            try {
                reconciliationIssueService.record(integrity.getKind(), txRef, null, integrity.getMessage());
            } catch (RuntimeException e) {
                log.error("Could not record integrity issue: txRef={}, kind={}", txRef, integrity.getKind(), e);
            }
            return new WebhookResult(WebhookOutcome.REJECTED_INVALID, HttpStatus.BAD_REQUEST, txRef, integrity.getMessage());
        }
        if (cause instanceof IllegalArgumentException) {
            log.warn("Webhook rejected: txRef={}, error={}", txRef, cause.getMessage());
            return new WebhookResult(WebhookOutcome.REJECTED_INVALID, HttpStatus.BAD_REQUEST, txRef, cause.getMessage());
        }

        log.error("Webhook processing failed after {} attempts: txRef={}",
                webhookRetry.getRetryConfig().getMaxAttempts(), txRef, cause);
        try {
            reconciliationIssueService.record(ReconciliationIssueKind.WEBHOOK_RETRIES_EXHAUSTED, txRef, null,
                    String.format("Webhook %s/%s for %s failed after %d attempts: %s",
                            payload.event(), payload.status(), txRef,
                            webhookRetry.getRetryConfig().getMaxAttempts(), cause));
        } catch (RuntimeException e) {
            log.error("Could not flag transaction for reconciliation: txRef={}", txRef, e);
            return new WebhookResult(WebhookOutcome.PROCESSING_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, txRef,
                    "Processing failed, please retry");
        }
        return WebhookResult.ok(WebhookOutcome.FLAGGED_FOR_RECONCILIATION, txRef,
                "Processing failed, flagged for manual reconciliation");
    }
}
