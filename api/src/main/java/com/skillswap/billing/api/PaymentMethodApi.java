package com.skillswap.billing.api;

import com.skillswap.billing.api.request.AddPaymentMethodRequest;
import com.skillswap.billing.api.response.PaymentMethodResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Payment methods used for automatic renewals.
 */
@RequestMapping("/api/v1/payment-methods")
public interface PaymentMethodApi {

    @GetMapping
    ResponseEntity<List<PaymentMethodResponse>> listPaymentMethods();

    @PostMapping
    ResponseEntity<PaymentMethodResponse> addPaymentMethod(@RequestBody @Valid AddPaymentMethodRequest request);

    @DeleteMapping("/{paymentMethodId}")
    ResponseEntity<Void> removePaymentMethod(@PathVariable("paymentMethodId") Long paymentMethodId);
}
