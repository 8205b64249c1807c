package com.skillswap.billing.service;

import com.skillswap.billing.api.model.ReconciliationIssueKind;
import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.error.PaymentGatewayException;
import com.skillswap.billing.error.PaymentIntegrityException;
import com.skillswap.billing.gateway.ChargeRequest;
import com.skillswap.billing.gateway.ChargeResult;
import com.skillswap.billing.gateway.PaymentGateway;
import com.skillswap.billing.gateway.ProviderAmountConverter;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Renews one subscription.
 *
 * <p>Steps:
 * <ol>
 *   <li>locked preparation: eligibility re-check, payment method and plan lookup, PENDING
 *       renewal transaction</li>
 *   <li>provider charge outside any database transaction, retried on timeouts</li>
 *   <li>confirmation through {@link PaymentConfirmationService}, extending from the previous
 *       end date, retried on transient errors; a webhook for the same txRef is then a no-op</li>
 * </ol>
 *
 * <p>Never throws: every failure ends with the subscription PAST_DUE and is reported as the
 * outcome, so one user cannot abort a sweep. A charge the provider accepted is never failed
 * locally: if it cannot be applied, its transaction stays PENDING for the provider webhook or a
 * manual verification, and a reconciliation issue is recorded.
 */
@Service
@Slf4j
public class SubscriptionRenewalService {

    private final SubscriptionStateService stateService;
    private final PaymentConfirmationService confirmationService;
    private final ReconciliationIssueService reconciliationIssueService;
    private final PaymentGateway paymentGateway;
    private final ProviderAmountConverter amountConverter;
    private final Retry chargeRetry;
    private final Retry confirmationRetry;

    public SubscriptionRenewalService(SubscriptionStateService stateService,
                                      PaymentConfirmationService confirmationService,
                                      ReconciliationIssueService reconciliationIssueService,
                                      PaymentGateway paymentGateway,
                                      ProviderAmountConverter amountConverter,
                                      @Qualifier("gatewayChargeRetry") Retry chargeRetry,
                                      @Qualifier("webhookRetry") Retry confirmationRetry) {
        this.stateService = stateService;
        this.confirmationService = confirmationService;
        this.reconciliationIssueService = reconciliationIssueService;
        this.paymentGateway = paymentGateway;
        this.amountConverter = amountConverter;
        this.chargeRetry = chargeRetry;
        this.confirmationRetry = confirmationRetry;
    }

    public RenewalOutcome attemptRenewal(Long userId) {
        String txRef = null;
        try {
            RenewalPreparation preparation = stateService.prepareRenewal(userId);
            switch (preparation.action()) {
                case SKIPPED:
                    log.info("Renewal skipped: userId={}, reason={}", userId, preparation.reason());
                    return RenewalOutcome.SKIPPED;
                case PAST_DUE:
                    return RenewalOutcome.PAST_DUE;
                default:
                    break;
            }
            txRef = preparation.txRef();

            ChargeResult result;
            try {
                result = charge(preparation);
            } catch (PaymentGatewayException e) {
                log.warn("Renewal charge failed: userId={}, txRef={}, retryable={}, cause={}",
                        userId, txRef, e.isRetryable(), e.getMessage());
                confirmationService.recordFailure(new PaymentFailure(txRef, null, TransactionStatus.FAILED,
                        "Payment provider unavailable: " + e.getMessage()));
                return RenewalOutcome.DECLINED;
            }

            if (!result.success()) {
                log.warn("Renewal charge declined: userId={}, txRef={}, error={}", userId, txRef, result.error());
                confirmationService.recordFailure(new PaymentFailure(txRef, result.transactionId(),
                        TransactionStatus.FAILED, result.error()));
                return RenewalOutcome.DECLINED;
            }

            return applyCharge(userId, preparation, result);
        } catch (PaymentIntegrityException e) {
            flagIssue(userId, e.getTxRef(), e.getKind(), e.getMessage());
            markPastDueAfterError(userId, txRef, e);
            return RenewalOutcome.ERROR;
        } catch (RuntimeException e) {
            log.error("Renewal failed unexpectedly: userId={}, txRef={}", userId, txRef, e);
            markPastDueAfterError(userId, txRef, e);
            return RenewalOutcome.ERROR;
        }
    }

    private RenewalOutcome applyCharge(Long userId, RenewalPreparation preparation, ChargeResult result) {
        String txRef = preparation.txRef();
        PaymentConfirmation confirmation = new PaymentConfirmation(txRef, result.transactionId(),
                amountConverter.toProvider(preparation.amount()), preparation.currency());
        try {
            Retry.decorateSupplier(confirmationRetry, () -> confirmationService.confirmSuccess(confirmation)).get();
            return RenewalOutcome.RENEWED;
        } catch (PaymentIntegrityException e) {
            flagIssue(userId, txRef, e.getKind(), e.getMessage());
            holdChargedRenewal(userId, txRef, e);
            return RenewalOutcome.ERROR;
        } catch (RuntimeException e) {
            log.error("Charged renewal could not be applied: userId={}, txRef={}, providerTransactionId={}",
                    userId, txRef, result.transactionId(), e);
            flagIssue(userId, txRef, ReconciliationIssueKind.CHARGE_UNCONFIRMED,
                    "Renewal charged by the provider (transaction " + result.transactionId()
                            + ") but not applied: " + e.getMessage());
            holdChargedRenewal(userId, txRef, e);
            return RenewalOutcome.ERROR;
        }
    }

    private void flagIssue(Long userId, String txRef, ReconciliationIssueKind kind, String details) {
        try {
            reconciliationIssueService.record(kind, txRef, userId, details);
        } catch (RuntimeException e) {
            log.error("Could not record reconciliation issue: userId={}, txRef={}, kind={}", userId, txRef, kind, e);
        }
    }

    private void holdChargedRenewal(Long userId, String txRef, RuntimeException cause) {
        try {
            stateService.markPastDueAwaitingConfirmation(userId, txRef, "Renewal payment not yet applied: " + cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not mark subscription past due: userId={}, txRef={}", userId, txRef, e);
        }
    }

    private ChargeResult charge(RenewalPreparation preparation) {
        ChargeRequest request = new ChargeRequest(
                preparation.txRef(),
                amountConverter.toProvider(preparation.amount()),
                preparation.currency(),
                preparation.authorizationToken(),
                preparation.customerEmail(),
                "Subscription renewal " + preparation.txRef());
        return Retry.decorateSupplier(chargeRetry, () -> paymentGateway.charge(request)).get();
    }

    private void markPastDueAfterError(Long userId, String txRef, RuntimeException cause) {
        try {
            stateService.markPastDueAfterError(userId, txRef, "Renewal failed: " + cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not mark subscription past due: userId={}, txRef={}", userId, txRef, e);
        }
    }
}
