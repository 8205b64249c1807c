package com.skillswap.billing.service;

import com.skillswap.billing.api.model.ReconciliationIssueKind;
import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.response.VerificationResponse;
import com.skillswap.billing.error.PaymentIntegrityException;
import com.skillswap.billing.error.TransactionNotFoundException;
import com.skillswap.billing.gateway.PaymentGateway;
import com.skillswap.billing.gateway.VerificationResult;
import com.skillswap.billing.model.Transaction;
import com.skillswap.billing.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;

/**
 * Client-driven verification, used when the user returns from checkout before the webhook
 * arrived. Confirms through {@link PaymentConfirmationService}, so a verification racing the
 * webhook applies the payment once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentVerificationService {

    private final TransactionRepository transactionRepository;
    private final PaymentGateway paymentGateway;
    private final PaymentConfirmationService confirmationService;
    private final ReconciliationIssueService reconciliationIssueService;

    /**
     * Verifies a payment of the given user with the provider and applies the result.
     *
     * @param userId                authenticated user
     * @param txRef                 our payment reference
     * @param providerTransactionId provider transaction ID returned after checkout
     * @return verification outcome
     * @throws TransactionNotFoundException if the txRef is unknown
     * @throws AccessDeniedException        if the txRef belongs to another user
     * @throws PaymentIntegrityException    if the provider data contradicts the recorded payment
     */
    public VerificationResponse verify(Long userId, String txRef, String providerTransactionId) {
        Transaction transaction = transactionRepository.findByTxRef(txRef)
                .orElseThrow(() -> new TransactionNotFoundException("Transaction with txRef " + txRef + " not found"));
        if (!transaction.getUserId().equals(userId)) {
            log.warn("Verification of foreign payment rejected: txRef={}, userId={}, ownerId={}",
                    txRef, userId, transaction.getUserId());
            throw new AccessDeniedException("Transaction " + txRef + " does not belong to the current user");
        }

        switch (transaction.getStatus()) {
            case SUCCESSFUL:
                return new VerificationResponse(txRef, TransactionStatus.SUCCESSFUL, true, "Payment already verified");
            case FAILED:
            case CANCELLED:
                return new VerificationResponse(txRef, transaction.getStatus(), false,
                        "Payment failed: " + transaction.getFailureReason());
            default:
                break;
        }

        VerificationResult result = paymentGateway.verify(providerTransactionId);
        log.info("Provider verification: txRef={}, providerTransactionId={}, status={}",
                txRef, providerTransactionId, result.status());

        try {
            if (result.txRef() != null && !txRef.equals(result.txRef())) {
                throw new PaymentIntegrityException(ReconciliationIssueKind.STATE_CONFLICT, txRef,
                        String.format("Provider transaction %s belongs to txRef %s, not %s",
                                providerTransactionId, result.txRef(), txRef));
            }

            if (result.isSuccessful()) {
                String providerId = result.transactionId() != null ? result.transactionId() : providerTransactionId;
                ConfirmationOutcome outcome = confirmationService.confirmSuccess(
                        new PaymentConfirmation(txRef, providerId, result.amount(), result.currency()));
                boolean alreadyProcessed = outcome == ConfirmationOutcome.ALREADY_PROCESSED;
                return new VerificationResponse(txRef, TransactionStatus.SUCCESSFUL, alreadyProcessed,
                        alreadyProcessed ? "Payment already verified" : "Payment verified");
            }

            if (result.isFailed()) {
                TransactionStatus status = "cancelled".equalsIgnoreCase(result.status())
                        ? TransactionStatus.CANCELLED
                        : TransactionStatus.FAILED;
                ConfirmationOutcome outcome = confirmationService.recordFailure(
                        new PaymentFailure(txRef, providerTransactionId, status, result.message()));
                if (outcome == ConfirmationOutcome.ALREADY_PROCESSED) {
                    Transaction resolved = transactionRepository.findByTxRef(txRef).orElse(transaction);
                    return new VerificationResponse(txRef, resolved.getStatus(), true, "Payment already resolved");
                }
                return new VerificationResponse(txRef, status, false,
                        "Payment failed: " + (result.message() == null ? "Payment failed" : result.message()));
            }
        } catch (PaymentIntegrityException e) {
            reconciliationIssueService.record(e.getKind(), txRef, userId, e.getMessage());
            throw e;
        }

        return new VerificationResponse(txRef, TransactionStatus.PENDING, false, "Payment is still pending");
    }
}
