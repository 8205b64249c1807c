package com.skillswap.billing.api;

import com.skillswap.billing.api.request.CourseCheckoutRequest;
import com.skillswap.billing.api.response.PaymentLinkResponse;
import com.skillswap.billing.api.response.WebhookAckResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.concurrent.CompletableFuture;

/**
 * Payment API for course purchases and the provider callback.
 */
@RequestMapping("/api/v1/payments")
public interface PaymentApi {

    /**
     * Starts a provider payment for a course. The course is added to the user once the
     * payment is confirmed.
     *
     * @param request course, price and currency
     * @return payment link and txRef
     */
    @PostMapping("/course-checkout")
    ResponseEntity<PaymentLinkResponse> courseCheckout(@RequestBody @Valid CourseCheckoutRequest request);

    /**
     * Same as {@link SubscriptionApi#handleWebhook(String, byte[])}; providers configured with
     * the payments URL land here.
     */
    @PostMapping("/webhook")
    CompletableFuture<ResponseEntity<WebhookAckResponse>> handleWebhook(
            @RequestHeader(value = WebhookHeaders.SIGNATURE, required = false) String signature,
            @RequestBody(required = false) byte[] payload);
}
