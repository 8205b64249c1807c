package com.skillswap.billing.controller;

import com.skillswap.billing.api.PaymentMethodApi;
import com.skillswap.billing.api.request.AddPaymentMethodRequest;
import com.skillswap.billing.api.response.PaymentMethodResponse;
import com.skillswap.billing.security.CurrentUserProvider;
import com.skillswap.billing.service.PaymentMethodService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
public class PaymentMethodController implements PaymentMethodApi {

    private final PaymentMethodService paymentMethodService;
    private final CurrentUserProvider currentUserProvider;

    @Override
    public ResponseEntity<List<PaymentMethodResponse>> listPaymentMethods() {
        return ResponseEntity.ok(paymentMethodService.list(currentUserProvider.currentUserId()));
    }

    @Override
    public ResponseEntity<PaymentMethodResponse> addPaymentMethod(AddPaymentMethodRequest request) {
        PaymentMethodResponse response = paymentMethodService.add(currentUserProvider.currentUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<Void> removePaymentMethod(Long paymentMethodId) {
        paymentMethodService.remove(currentUserProvider.currentUserId(), paymentMethodId);
        return ResponseEntity.noContent().build();
    }
}
