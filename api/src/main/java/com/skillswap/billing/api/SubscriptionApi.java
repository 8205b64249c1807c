package com.skillswap.billing.api;

import com.skillswap.billing.api.request.AutoRenewalRequest;
import com.skillswap.billing.api.request.SubscribeRequest;
import com.skillswap.billing.api.request.VerifyPaymentRequest;
import com.skillswap.billing.api.response.MySubscriptionResponse;
import com.skillswap.billing.api.response.PaymentLinkResponse;
import com.skillswap.billing.api.response.VerificationResponse;
import com.skillswap.billing.api.response.WebhookAckResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.CompletableFuture;

/**
 * Subscription API.
 *
 * <p>All endpoints except {@code /webhook} act on the authenticated user. The webhook is
 * authenticated by the provider signature header instead of a bearer token.
 *
 * <p>This interface is implemented by SubscriptionController in the service module.
 */
@RequestMapping("/api/v1/subscriptions")
public interface SubscriptionApi {

    /**
     * Starts a subscription: creates a pending payment with a plan snapshot and returns the
     * provider checkout link. Free plans are activated immediately.
     *
     * @param request plan to subscribe to
     * @return payment link and txRef
     */
    @PostMapping("/subscribe")
    ResponseEntity<PaymentLinkResponse> subscribe(@RequestBody @Valid SubscribeRequest request);

    /**
     * Verifies a subscription payment with the provider when the webhook is late.
     *
     * @param request txRef and provider transaction ID
     * @return verification outcome
     */
    @PostMapping("/verify")
    ResponseEntity<VerificationResponse> verify(@RequestBody @Valid VerifyPaymentRequest request);

    @GetMapping("/my-subscription")
    ResponseEntity<MySubscriptionResponse> mySubscription();

    /**
     * Cancels at period end. Access remains until the current end date and auto renewal stops.
     *
     * @return updated subscription
     */
    @PostMapping("/cancel")
    ResponseEntity<MySubscriptionResponse> cancel();

    @PutMapping("/auto-renewal")
    ResponseEntity<MySubscriptionResponse> setAutoRenewal(@RequestBody @Valid AutoRenewalRequest request);

    /**
     * Payment provider callback. The body is taken as raw bytes so the signature is checked
     * against exactly what the provider sent.
     *
     * @param signature value of the {@value WebhookHeaders#SIGNATURE} header
     * @param payload   raw request body
     * @return acknowledgement; completes after any retries have finished
     */
    @PostMapping("/webhook")
    CompletableFuture<ResponseEntity<WebhookAckResponse>> handleWebhook(
            @RequestHeader(value = WebhookHeaders.SIGNATURE, required = false) String signature,
            @RequestBody(required = false) byte[] payload);
}
