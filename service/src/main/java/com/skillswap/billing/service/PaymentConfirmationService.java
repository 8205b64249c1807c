package com.skillswap.billing.service;

import com.skillswap.billing.api.model.PlanDuration;
import com.skillswap.billing.api.model.ReconciliationIssueKind;
import com.skillswap.billing.api.model.SubscriptionStatus;
import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.model.TransactionType;
import com.skillswap.billing.error.PaymentIntegrityException;
import com.skillswap.billing.event.BillingEventPublisher;
import com.skillswap.billing.event.BillingEventType;
import com.skillswap.billing.gateway.ProviderAmountConverter;
import com.skillswap.billing.model.Transaction;
import com.skillswap.billing.model.UserAccount;
import com.skillswap.billing.model.Wallet;
import com.skillswap.billing.repository.TransactionRepository;
import com.skillswap.billing.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Applies provider payment results to the ledger, at most once per txRef.
 *
 * <p>Every path (webhook, client verification, renewal charge) funnels through here. Each call
 * is one database transaction that:
 * <ol>
 *   <li>locks the transaction row by txRef, then the owning user row</li>
 *   <li>returns {@link ConfirmationOutcome#ALREADY_PROCESSED} if the transaction is resolved</li>
 *   <li>cross-checks amount and currency with what was recorded</li>
 *   <li>applies the effect of the transaction type and resolves the transaction</li>
 * </ol>
 *
 * <p>Integrity problems raise {@link PaymentIntegrityException} and change nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentConfirmationService {

    private final TransactionRepository transactionRepository;
    private final UserAccountRepository userAccountRepository;
    private final TransactionStatusStateMachine stateMachine;
    private final ProviderAmountConverter amountConverter;
    private final BillingEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Applies a successful payment.
     *
     * @param confirmation provider statement
     * @return whether this call changed anything
     * @throws PaymentIntegrityException on unknown txRef, amount/currency mismatch, a resolved
     *                                   transaction that contradicts the statement, or a missing user
     */
    @Transactional
    public ConfirmationOutcome confirmSuccess(PaymentConfirmation confirmation) {
        String txRef = confirmation.txRef();
        Transaction transaction = transactionRepository.getOneForUpdate(txRef)
                .orElseThrow(() -> new PaymentIntegrityException(ReconciliationIssueKind.UNKNOWN_REFERENCE, txRef,
                        "No transaction recorded for txRef " + txRef));

        if (transaction.getStatus() == TransactionStatus.SUCCESSFUL) {
            if (confirmation.providerTransactionId() != null && transaction.getProviderTransactionId() != null
                    && !Objects.equals(confirmation.providerTransactionId(), transaction.getProviderTransactionId())) {
                throw new PaymentIntegrityException(ReconciliationIssueKind.STATE_CONFLICT, txRef,
                        String.format("Transaction %s already settled by provider transaction %s, got %s",
                                txRef, transaction.getProviderTransactionId(), confirmation.providerTransactionId()));
            }
            log.info("Payment already processed: txRef={}", txRef);
            return ConfirmationOutcome.ALREADY_PROCESSED;
        }
        if (transaction.getStatus() != TransactionStatus.PENDING) {
            throw new PaymentIntegrityException(ReconciliationIssueKind.STATE_CONFLICT, txRef,
                    String.format("Provider reports success for transaction %s which is %s",
                            txRef, transaction.getStatus()));
        }

        if (!amountConverter.matches(transaction.getAmount(), confirmation.amount())
                || confirmation.currency() == null
                || !transaction.getCurrency().equalsIgnoreCase(confirmation.currency())) {
            throw new PaymentIntegrityException(ReconciliationIssueKind.AMOUNT_MISMATCH, txRef,
                    String.format("Amount mismatch for %s: expected %s %s, provider reported %s %s",
                            txRef, amountConverter.toProvider(transaction.getAmount()), transaction.getCurrency(),
                            confirmation.amount(), confirmation.currency()));
        }

        UserAccount user = userAccountRepository.getOneForUpdate(transaction.getUserId())
                .orElseThrow(() -> new PaymentIntegrityException(ReconciliationIssueKind.MISSING_REFERENCE, txRef,
                        "User " + transaction.getUserId() + " of transaction " + txRef + " does not exist"));

        LocalDateTime now = LocalDateTime.now(clock);
        switch (transaction.getType()) {
            case SUBSCRIPTION -> applySubscription(transaction, user, now);
            case COURSE_ENROLLMENT -> applyCourseEnrollment(transaction, user);
            case TOPUP -> applyTopUp(transaction, user);
            default -> throw new PaymentIntegrityException(ReconciliationIssueKind.STATE_CONFLICT, txRef,
                    "Transactions of type " + transaction.getType() + " are not settled by the payment provider");
        }

        stateMachine.validateTransition(transaction.getStatus(), TransactionStatus.SUCCESSFUL);
        transaction.setStatus(TransactionStatus.SUCCESSFUL);
        transaction.setProviderTransactionId(confirmation.providerTransactionId());
        transaction.setCompletedAt(now);

        eventPublisher.publish(BillingEventType.PAYMENT_SUCCEEDED, user.getId(), Map.of(
                "txRef", txRef,
                "type", transaction.getType().name(),
                "amount", transaction.getAmount(),
                "currency", transaction.getCurrency()));

        log.info("Payment applied: txRef={}, type={}, userId={}, amount={}",
                txRef, transaction.getType(), user.getId(), transaction.getAmount());
        return ConfirmationOutcome.APPLIED;
    }

    /**
     * Records a failed or cancelled payment. No wallet or subscription period changes; a failed
     * renewal charge moves the subscription to PAST_DUE.
     *
     * @param failure provider statement
     * @return whether this call changed anything
     * @throws PaymentIntegrityException on unknown txRef
     */
    @Transactional
    public ConfirmationOutcome recordFailure(PaymentFailure failure) {
        String txRef = failure.txRef();
        Transaction transaction = transactionRepository.getOneForUpdate(txRef)
                .orElseThrow(() -> new PaymentIntegrityException(ReconciliationIssueKind.UNKNOWN_REFERENCE, txRef,
                        "No transaction recorded for txRef " + txRef));

        if (stateMachine.isFinalState(transaction.getStatus())) {
            if (transaction.getStatus() == TransactionStatus.SUCCESSFUL) {
                log.warn("Ignoring failure report for settled payment: txRef={}, reason={}", txRef, failure.reason());
            } else {
                log.info("Payment failure already recorded: txRef={}", txRef);
            }
            return ConfirmationOutcome.ALREADY_PROCESSED;
        }

        TransactionStatus target = failure.status() == TransactionStatus.CANCELLED
                ? TransactionStatus.CANCELLED
                : TransactionStatus.FAILED;
        String reason = failure.reason() == null || failure.reason().isBlank() ? "Payment failed" : failure.reason();
        LocalDateTime now = LocalDateTime.now(clock);

        stateMachine.validateTransition(transaction.getStatus(), target);
        transaction.setStatus(target);
        transaction.setFailureReason(reason);
        transaction.setFailedAt(now);
        if (failure.providerTransactionId() != null) {
            transaction.setProviderTransactionId(failure.providerTransactionId());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("txRef", txRef);
        payload.put("type", transaction.getType().name());
        payload.put("amount", transaction.getAmount());
        payload.put("currency", transaction.getCurrency());
        payload.put("errorReason", reason);

        userAccountRepository.getOneForUpdate(transaction.getUserId()).ifPresent(user -> {
            if (txRef.equals(user.getPendingSubscriptionTxRef())) {
                user.clearPendingSubscription();
            }
            if (transaction.getType() == TransactionType.SUBSCRIPTION) {
                user.setLastPaymentFailureReason(reason);
                if (transaction.isRenewal() && user.isPro()) {
                    user.setSubscriptionStatus(SubscriptionStatus.PAST_DUE);
                    eventPublisher.publish(BillingEventType.SUBSCRIPTION_RENEWAL_FAILED, user.getId(), payload);
                }
            }
        });

        eventPublisher.publish(BillingEventType.PAYMENT_FAILED, transaction.getUserId(), payload);
        log.warn("Payment failed: txRef={}, type={}, userId={}, status={}, reason={}",
                txRef, transaction.getType(), transaction.getUserId(), target, reason);
        return ConfirmationOutcome.APPLIED;
    }

    private void applySubscription(Transaction transaction, UserAccount user, LocalDateTime now) {
        PlanDuration duration = transaction.getPlanDuration();
        if (duration == null || transaction.getPlanId() == null) {
            throw new PaymentIntegrityException(ReconciliationIssueKind.MISSING_REFERENCE, transaction.getTxRef(),
                    "Subscription transaction " + transaction.getTxRef() + " has no plan snapshot");
        }

        LocalDateTime previousEnd = user.getSubscriptionEndDate();
        boolean periodRunning = user.isPro() && previousEnd != null && previousEnd.isAfter(now);
        LocalDateTime periodStart;
        String eventType;
        if (transaction.isRenewal() && previousEnd != null) {
            // billing cycle stays anchored to the previous end date
            periodStart = previousEnd;
            eventType = BillingEventType.SUBSCRIPTION_RENEWED;
        } else if (periodRunning) {
            // a second checkout paid while a period runs: the new period follows the current one
            periodStart = previousEnd;
            eventType = BillingEventType.SUBSCRIPTION_RENEWED;
            log.warn("Subscription payment received during a running period: txRef={}, userId={}, paidUntil={}",
                    transaction.getTxRef(), user.getId(), previousEnd);
        } else {
            periodStart = now;
            eventType = BillingEventType.SUBSCRIPTION_ACTIVATED;
            user.setAutoRenewal(true);
        }
        LocalDateTime periodEnd = duration.addTo(periodStart);

        user.setPro(true);
        user.setSubscriptionStatus(SubscriptionStatus.ACTIVE);
        user.setSubscriptionPlanId(transaction.getPlanId());
        if (transaction.isRenewal() || !periodRunning) {
            user.setSubscriptionStartDate(periodStart);
        }
        user.setSubscriptionEndDate(periodEnd);
        user.setCancelAtPeriodEnd(false);
        user.setLastPaymentReference(transaction.getTxRef());
        user.setLastPaymentAmount(transaction.getAmount());
        user.setLastPaymentDate(now);
        user.setLastPaymentFailureReason(null);
        if (transaction.getTxRef().equals(user.getPendingSubscriptionTxRef()) || !transaction.isRenewal()) {
            user.clearPendingSubscription();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("txRef", transaction.getTxRef());
        payload.put("planId", transaction.getPlanId());
        payload.put("planName", transaction.getPlanName());
        payload.put("startDate", periodStart.toString());
        payload.put("endDate", periodEnd.toString());
        eventPublisher.publish(eventType, user.getId(), payload);

        log.info("Subscription {}: userId={}, planId={}, start={}, end={}",
                eventType.equals(BillingEventType.SUBSCRIPTION_RENEWED) ? "renewed" : "activated", user.getId(),
                transaction.getPlanId(), periodStart, periodEnd);
    }

    private void applyCourseEnrollment(Transaction transaction, UserAccount user) {
        Long courseId = transaction.getCourseId();
        if (courseId == null) {
            throw new PaymentIntegrityException(ReconciliationIssueKind.MISSING_REFERENCE, transaction.getTxRef(),
                    "Course enrollment transaction " + transaction.getTxRef() + " has no course");
        }
        if (user.getEnrolledCourseIds().add(courseId)) {
            eventPublisher.publish(BillingEventType.COURSE_ENROLLED, user.getId(), Map.of(
                    "courseId", courseId,
                    "txRef", transaction.getTxRef()));
            log.info("Course enrollment added: userId={}, courseId={}", user.getId(), courseId);
        } else {
            log.info("User already enrolled: userId={}, courseId={}", user.getId(), courseId);
        }
    }

    private void applyTopUp(Transaction transaction, UserAccount user) {
        Wallet wallet = user.getWallet();
        wallet.setBalance(wallet.getBalance() + transaction.getAmount());
        // total earnings count every credit: provider top-ups and course sales
        wallet.setTotalEarnings(wallet.getTotalEarnings() + transaction.getAmount());

        eventPublisher.publish(BillingEventType.WALLET_CREDITED, user.getId(), Map.of(
                "txRef", transaction.getTxRef(),
                "amount", transaction.getAmount(),
                "newBalance", wallet.getBalance()));
        log.info("Wallet credited: userId={}, amount={}, newBalance={}",
                user.getId(), transaction.getAmount(), wallet.getBalance());
    }
}
