package com.skillswap.billing.service;

import com.skillswap.billing.api.response.PaymentLinkResponse;
import com.skillswap.billing.config.BillingProperties;
import com.skillswap.billing.error.PaymentGatewayException;
import com.skillswap.billing.gateway.PaymentGateway;
import com.skillswap.billing.gateway.PaymentInitRequest;
import com.skillswap.billing.gateway.PaymentLink;
import com.skillswap.billing.gateway.ProviderAmountConverter;
import com.skillswap.billing.model.Transaction;
import com.skillswap.billing.model.UserAccount;
import com.skillswap.billing.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Starts provider payments: a PENDING transaction first, then the hosted checkout link.
 *
 * <p>The gateway is called outside any database transaction. If the link cannot be created the
 * pending transaction is deleted, since the user never saw its txRef.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentInitiationService {

    private final TransactionRepository transactionRepository;
    private final PaymentGateway paymentGateway;
    private final ProviderAmountConverter amountConverter;
    private final BillingProperties properties;

    /**
     * Saves a PENDING transaction and requests its checkout link.
     *
     * @param pending     unsaved transaction in PENDING status
     * @param user        payer
     * @param redirectUrl return URL after checkout, or {@code null} for the configured default
     * @return link response
     * @throws PaymentGatewayException if the provider could not create the checkout
     */
    public PaymentLinkResponse initiate(Transaction pending, UserAccount user, String redirectUrl) {
        Transaction saved = transactionRepository.save(pending);
        log.info("Pending payment created: txRef={}, type={}, userId={}, amount={}, currency={}",
                saved.getTxRef(), saved.getType(), saved.getUserId(), saved.getAmount(), saved.getCurrency());
        return requestPaymentLink(saved, user, redirectUrl);
    }

    /**
     * Requests the checkout link for an already saved PENDING transaction.
     *
     * @throws PaymentGatewayException if the provider could not create the checkout; the pending
     *                                 transaction has been deleted by then
     */
    public PaymentLinkResponse requestPaymentLink(Transaction pending, UserAccount user, String redirectUrl) {
        PaymentInitRequest request = new PaymentInitRequest(
                pending.getTxRef(),
                amountConverter.toProvider(pending.getAmount()),
                pending.getCurrency(),
                user.getEmail(),
                user.getFullName(),
                redirectUrl == null || redirectUrl.isBlank() ? properties.gateway().defaultRedirectUrl() : redirectUrl,
                pending.getDescription());

        PaymentLink link;
        try {
            link = paymentGateway.initializePayment(request);
        } catch (PaymentGatewayException e) {
            discard(pending, e);
            throw e;
        } catch (RuntimeException e) {
            discard(pending, e);
            throw new PaymentGatewayException("Payment initialization failed: " + e.getMessage(), false, e);
        }

        log.info("Payment link issued: txRef={}, userId={}", pending.getTxRef(), pending.getUserId());
        return new PaymentLinkResponse(pending.getTxRef(), link.link(), pending.getAmount(),
                pending.getCurrency(), pending.getStatus());
    }

    private void discard(Transaction pending, RuntimeException cause) {
        log.warn("Payment initialization failed, discarding pending transaction: txRef={}, userId={}, cause={}",
                pending.getTxRef(), pending.getUserId(), cause.getMessage());
        transactionRepository.deleteById(pending.getId());
    }
}
