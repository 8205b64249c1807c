package com.skillswap.billing.controller;

import com.skillswap.billing.api.PaymentApi;
import com.skillswap.billing.api.request.CourseCheckoutRequest;
import com.skillswap.billing.api.response.PaymentLinkResponse;
import com.skillswap.billing.api.response.WebhookAckResponse;
import com.skillswap.billing.security.CurrentUserProvider;
import com.skillswap.billing.service.CourseCheckoutService;
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

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class PaymentController implements PaymentApi {

    private final CourseCheckoutService courseCheckoutService;
    private final WebhookReconciler webhookReconciler;
    private final CurrentUserProvider currentUserProvider;
    private final HttpServletRequest httpRequest;

    @Override
    public ResponseEntity<PaymentLinkResponse> courseCheckout(CourseCheckoutRequest request) {
        Long userId = currentUserProvider.currentUserId();
        log.info("Course checkout requested: userId={}, courseId={}, amount={}, currency={}",
                userId, request.courseId(), request.amount(), request.currency());

        PaymentLinkResponse response = courseCheckoutService.checkout(userId, request.courseId(), request.amount(),
                request.currency(), request.redirectUrl());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public CompletableFuture<ResponseEntity<WebhookAckResponse>> handleWebhook(String signature, byte[] payload) {
        return webhookReconciler.handle(payload, signature, httpRequest.getRemoteAddr(),
                        httpRequest.getHeader(HttpHeaders.USER_AGENT))
                .thenApply(WebhookResult::toResponseEntity);
    }
}
