package com.skillswap.billing.controller;

import com.skillswap.billing.api.SubscriptionApi;
import com.skillswap.billing.api.request.AutoRenewalRequest;
import com.skillswap.billing.api.request.SubscribeRequest;
import com.skillswap.billing.api.request.VerifyPaymentRequest;
import com.skillswap.billing.api.response.MySubscriptionResponse;
import com.skillswap.billing.api.response.PaymentLinkResponse;
import com.skillswap.billing.api.response.VerificationResponse;
import com.skillswap.billing.api.response.WebhookAckResponse;
import com.skillswap.billing.security.CurrentUserProvider;
import com.skillswap.billing.service.SubscriptionService;
import com.skillswap.billing.webhook.WebhookReconciler;
import com.skillswap.billing.webhook.WebhookResult;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * REST controller for the subscription lifecycle of the authenticated user and the provider
 * webhook.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class SubscriptionController implements SubscriptionApi {

    private final SubscriptionService subscriptionService;
    private final WebhookReconciler webhookReconciler;
    private final CurrentUserProvider currentUserProvider;
    private final HttpServletRequest httpRequest;

    @Override
    public ResponseEntity<PaymentLinkResponse> subscribe(SubscribeRequest request) {
        Long userId = currentUserProvider.currentUserId();
        log.info("Subscribe requested: userId={}, planId={}", userId, request.planId());

        PaymentLinkResponse response = subscriptionService.subscribe(userId, request.planId(), request.redirectUrl());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<VerificationResponse> verify(VerifyPaymentRequest request) {
        Long userId = currentUserProvider.currentUserId();
        log.info("Subscription verification requested: userId={}, txRef={}", userId, request.txRef());
        return ResponseEntity.ok(subscriptionService.verify(userId, request.txRef(), request.transactionId()));
    }

    @Override
    public ResponseEntity<MySubscriptionResponse> mySubscription() {
        return ResponseEntity.ok(subscriptionService.mySubscription(currentUserProvider.currentUserId()));
    }

    @Override
    public ResponseEntity<MySubscriptionResponse> cancel() {
        Long userId = currentUserProvider.currentUserId();
        log.info("Subscription cancellation requested: userId={}", userId);
        return ResponseEntity.ok(subscriptionService.cancel(userId));
    }

    @Override
    public ResponseEntity<MySubscriptionResponse> setAutoRenewal(AutoRenewalRequest request) {
        Long userId = currentUserProvider.currentUserId();
        return ResponseEntity.ok(subscriptionService.setAutoRenewal(userId, request.enabled()));
    }

    @Override
    public CompletableFuture<ResponseEntity<WebhookAckResponse>> handleWebhook(String signature, byte[] payload) {
        return webhookReconciler.handle(payload, signature, httpRequest.getRemoteAddr(),
                        httpRequest.getHeader(HttpHeaders.USER_AGENT))
                .thenApply(WebhookResult::toResponseEntity);
    }
}
