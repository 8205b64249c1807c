package com.skillswap.billing.service;

import com.skillswap.billing.api.request.AddPaymentMethodRequest;
import com.skillswap.billing.api.response.PaymentMethodResponse;
import com.skillswap.billing.error.PaymentMethodNotFoundException;
import com.skillswap.billing.mapper.PaymentMethodMapper;
import com.skillswap.billing.model.PaymentMethod;
import com.skillswap.billing.repository.PaymentMethodRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Stored card authorizations used by the renewal sweep. At most one method per user is primary;
 * the first method added becomes primary.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentMethodService {

    private final PaymentMethodRepository paymentMethodRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<PaymentMethodResponse> list(Long userId) {
        return PaymentMethodMapper.INSTANCE.toResponseList(
                paymentMethodRepository.findByUserIdOrderByPrimaryMethodDescCreatedAtAsc(userId));
    }

    @Transactional
    public PaymentMethodResponse add(Long userId, AddPaymentMethodRequest request) {
        boolean first = paymentMethodRepository.findFirstByUserIdOrderByPrimaryMethodDescCreatedAtAsc(userId).isEmpty();
        boolean primary = request.primary() || first;
        if (primary && !first) {
            paymentMethodRepository.clearPrimary(userId);
        }

        PaymentMethod method = new PaymentMethod();
        method.setUserId(userId);
        method.setProvider(request.provider());
        method.setAuthorizationToken(request.authorizationToken());
        method.setBrand(request.brand());
        method.setLast4(request.last4());
        method.setPrimaryMethod(primary);
        method.setCreatedAt(LocalDateTime.now(clock));
        PaymentMethod saved = paymentMethodRepository.save(method);

        log.info("Payment method added: userId={}, paymentMethodId={}, primary={}", userId, saved.getId(), primary);
        return PaymentMethodMapper.INSTANCE.toResponse(saved);
    }

    /**
     * @throws PaymentMethodNotFoundException if the method does not exist or belongs to another user
     */
    @Transactional
    public void remove(Long userId, Long paymentMethodId) {
        PaymentMethod method = paymentMethodRepository.findByIdAndUserId(paymentMethodId, userId)
                .orElseThrow(() -> new PaymentMethodNotFoundException(
                        "Payment method with ID " + paymentMethodId + " not found"));
        paymentMethodRepository.delete(method);
        log.info("Payment method removed: userId={}, paymentMethodId={}", userId, paymentMethodId);
    }

    /**
     * The method renewals charge: the primary one, else the oldest one.
     */
    @Transactional(readOnly = true)
    public Optional<PaymentMethod> findRenewalMethod(Long userId) {
        return paymentMethodRepository.findFirstByUserIdOrderByPrimaryMethodDescCreatedAtAsc(userId);
    }
}
