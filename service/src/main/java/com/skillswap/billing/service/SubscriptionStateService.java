package com.skillswap.billing.service;

import com.skillswap.billing.api.model.SubscriptionStatus;
import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.model.TransactionType;
import com.skillswap.billing.api.response.PaymentLinkResponse;
import com.skillswap.billing.config.BillingProperties;
import com.skillswap.billing.error.SubscriptionStateException;
import com.skillswap.billing.error.UserNotFoundException;
import com.skillswap.billing.event.BillingEventPublisher;
import com.skillswap.billing.event.BillingEventType;
import com.skillswap.billing.model.PaymentMethod;
import com.skillswap.billing.model.SubscriptionPlan;
import com.skillswap.billing.model.Transaction;
import com.skillswap.billing.model.UserAccount;
import com.skillswap.billing.repository.PaymentMethodRepository;
import com.skillswap.billing.repository.SubscriptionPlanRepository;
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
import java.util.Optional;

/**
 * Locked subscription state changes of a single user. Every public method is one database
 * transaction holding the user row lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionStateService {

    private final UserAccountRepository userAccountRepository;
    private final TransactionRepository transactionRepository;
    private final SubscriptionPlanRepository planRepository;
    private final PaymentMethodRepository paymentMethodRepository;
    private final TransactionStatusStateMachine stateMachine;
    private final TxRefGenerator txRefGenerator;
    private final BillingEventPublisher eventPublisher;
    private final BillingProperties properties;
    private final Clock clock;

    /**
     * Creates the PENDING subscription transaction with a snapshot of the plan and records it as
     * the user's pending subscription.
     *
     * @throws SubscriptionStateException if the user has a paid period running or an unpaid
     *                                    checkout younger than the pending-checkout timeout
     */
    @Transactional
    public Transaction createPendingSubscription(Long userId, SubscriptionPlan plan) {
        UserAccount user = lockUser(userId);
        LocalDateTime now = LocalDateTime.now(clock);
        requireNoRunningPeriod(user, now);
        requireNoOpenCheckout(user, now);

        Transaction pending = new Transaction();
        pending.setUserId(userId);
        pending.setType(TransactionType.SUBSCRIPTION);
        pending.setAmount(plan.getPrice());
        pending.setCurrency(plan.getCurrency());
        pending.setTxRef(txRefGenerator.generate(TxRefGenerator.SUBSCRIPTION, userId, plan.getId()));
        pending.setStatus(TransactionStatus.PENDING);
        pending.setDescription("Subscription: " + plan.getName());
        pending.setPlanId(plan.getId());
        pending.setPlanName(plan.getName());
        pending.setPlanDuration(plan.getDuration());
        pending.setRenewal(false);
        pending.setInitiatedAt(now);
        transactionRepository.save(pending);

        user.setPendingSubscriptionTxRef(pending.getTxRef());
        user.setPendingSubscriptionPlanId(plan.getId());

        log.info("Pending subscription created: userId={}, planId={}, txRef={}", userId, plan.getId(), pending.getTxRef());
        return pending;
    }

    /**
     * Clears the pending markers if they still point at the given txRef.
     */
    @Transactional
    public void clearPending(Long userId, String txRef) {
        userAccountRepository.getOneForUpdate(userId).ifPresent(user -> {
            if (txRef.equals(user.getPendingSubscriptionTxRef())) {
                user.clearPendingSubscription();
                log.info("Pending subscription cleared: userId={}, txRef={}", userId, txRef);
            }
        });
    }

    /**
     * Activates a plan with price 0 without a provider payment. A SUCCESSFUL transaction of
     * amount 0 is recorded for the history.
     */
    @Transactional
    public PaymentLinkResponse activateFreePlan(Long userId, SubscriptionPlan plan) {
        UserAccount user = lockUser(userId);
        LocalDateTime now = LocalDateTime.now(clock);
        requireNoRunningPeriod(user, now);
        requireNoOpenCheckout(user, now);

        Transaction transaction = new Transaction();
        transaction.setUserId(userId);
        transaction.setType(TransactionType.SUBSCRIPTION);
        transaction.setAmount(0L);
        transaction.setCurrency(plan.getCurrency());
        transaction.setTxRef(txRefGenerator.generate(TxRefGenerator.SUBSCRIPTION, userId, plan.getId()));
        transaction.setStatus(TransactionStatus.SUCCESSFUL);
        transaction.setDescription("Subscription: " + plan.getName());
        transaction.setPlanId(plan.getId());
        transaction.setPlanName(plan.getName());
        transaction.setPlanDuration(plan.getDuration());
        transaction.setInitiatedAt(now);
        transaction.setCompletedAt(now);
        transactionRepository.save(transaction);

        LocalDateTime end = plan.getDuration().addTo(now);
        user.setPro(true);
        user.setSubscriptionStatus(SubscriptionStatus.ACTIVE);
        user.setSubscriptionPlanId(plan.getId());
        user.setSubscriptionStartDate(now);
        user.setSubscriptionEndDate(end);
        user.setAutoRenewal(true);
        user.setCancelAtPeriodEnd(false);
        user.setLastPaymentFailureReason(null);
        user.clearPendingSubscription();

        eventPublisher.publish(BillingEventType.SUBSCRIPTION_ACTIVATED, userId, Map.of(
                "txRef", transaction.getTxRef(),
                "planId", plan.getId(),
                "planName", plan.getName(),
                "startDate", now.toString(),
                "endDate", end.toString()));

        log.info("Free plan activated: userId={}, planId={}, end={}", userId, plan.getId(), end);
        return new PaymentLinkResponse(transaction.getTxRef(), null, 0L, plan.getCurrency(), TransactionStatus.SUCCESSFUL);
    }

    /**
     * Cancels at period end: access continues until the end date, then the expiry sweep moves the
     * subscription to CANCELLED.
     *
     * @throws SubscriptionStateException if the user has no subscription to cancel
     */
    @Transactional
    public void cancelAtPeriodEnd(Long userId) {
        UserAccount user = lockUser(userId);
        if (!user.isPro() || user.getSubscriptionEndDate() == null) {
            throw new SubscriptionStateException("No active subscription to cancel");
        }
        user.setCancelAtPeriodEnd(true);
        user.setAutoRenewal(false);

        eventPublisher.publish(BillingEventType.SUBSCRIPTION_CANCELLED, userId, Map.of(
                "endDate", user.getSubscriptionEndDate().toString()));
        log.info("Subscription cancelled at period end: userId={}, endDate={}", userId, user.getSubscriptionEndDate());
    }

    /**
     * Turning auto renewal back on also withdraws a pending cancellation.
     */
    @Transactional
    public void setAutoRenewal(Long userId, boolean enabled) {
        UserAccount user = lockUser(userId);
        user.setAutoRenewal(enabled);
        if (enabled) {
            user.setCancelAtPeriodEnd(false);
        }
        log.info("Auto renewal {}: userId={}", enabled ? "enabled" : "disabled", userId);
    }

    /**
     * Re-checks renewal eligibility under the user lock and creates the PENDING renewal
     * transaction. The charge itself happens outside this transaction.
     */
    @Transactional
    public RenewalPreparation prepareRenewal(Long userId) {
        Optional<UserAccount> locked = userAccountRepository.getOneForUpdate(userId);
        if (locked.isEmpty()) {
            return RenewalPreparation.skipped("User not found");
        }
        UserAccount user = locked.get();
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime horizon = now.plus(properties.subscription().renewalLookahead());
        if (!user.isPro()
                || !user.isAutoRenewal()
                || user.isCancelAtPeriodEnd()
                || user.getSubscriptionStatus() != SubscriptionStatus.ACTIVE
                || user.getSubscriptionEndDate() == null
                || user.getSubscriptionEndDate().isAfter(horizon)) {
            return RenewalPreparation.skipped("No longer due for renewal");
        }

        Optional<PaymentMethod> paymentMethod = paymentMethodRepository.findFirstByUserIdOrderByPrimaryMethodDescCreatedAtAsc(userId);
        if (paymentMethod.isEmpty()) {
            markPastDue(user, "No payment method available");
            return RenewalPreparation.pastDue("No payment method available");
        }

        Optional<SubscriptionPlan> plan = Optional.ofNullable(user.getSubscriptionPlanId()).flatMap(planRepository::findById);
        if (plan.isEmpty() || !plan.get().isActive() || plan.get().getPrice() <= 0) {
            markPastDue(user, "Subscription plan is no longer available for renewal");
            return RenewalPreparation.pastDue("Subscription plan is no longer available for renewal");
        }

        SubscriptionPlan renewedPlan = plan.get();
        Transaction pending = new Transaction();
        pending.setUserId(userId);
        pending.setType(TransactionType.SUBSCRIPTION);
        pending.setAmount(renewedPlan.getPrice());
        pending.setCurrency(renewedPlan.getCurrency());
        pending.setTxRef(txRefGenerator.generate(TxRefGenerator.RENEWAL, userId));
        pending.setStatus(TransactionStatus.PENDING);
        pending.setDescription("Subscription renewal: " + renewedPlan.getName());
        pending.setPlanId(renewedPlan.getId());
        pending.setPlanName(renewedPlan.getName());
        pending.setPlanDuration(renewedPlan.getDuration());
        pending.setRenewal(true);
        pending.setInitiatedAt(now);
        transactionRepository.save(pending);

        log.info("Renewal prepared: userId={}, planId={}, txRef={}, amount={}",
                userId, renewedPlan.getId(), pending.getTxRef(), renewedPlan.getPrice());
        return RenewalPreparation.charge(pending.getTxRef(), renewedPlan.getPrice(), renewedPlan.getCurrency(),
                paymentMethod.get().getAuthorizationToken(), user.getEmail());
    }

    /**
     * Fails a renewal that broke with an unexpected error before the provider charged it: the
     * pending transaction becomes FAILED and the subscription PAST_DUE. Locks the transaction
     * before the user.
     */
    @Transactional
    public void markPastDueAfterError(Long userId, String txRef, String reason) {
        if (txRef != null) {
            transactionRepository.getOneForUpdate(txRef).ifPresent(transaction -> {
                if (stateMachine.isTransitionAllowed(transaction.getStatus(), TransactionStatus.FAILED)) {
                    transaction.setStatus(TransactionStatus.FAILED);
                    transaction.setFailureReason(reason);
                    transaction.setFailedAt(LocalDateTime.now(clock));
                }
            });
        }
        userAccountRepository.getOneForUpdate(userId).ifPresent(user -> pastDueAfterRenewalError(user, txRef, reason));
    }

    /**
     * Marks the subscription PAST_DUE for a renewal the provider has charged but that could not be
     * applied. The transaction is left untouched so the provider webhook or a verification can
     * still confirm it and restore the subscription.
     */
    @Transactional
    public void markPastDueAwaitingConfirmation(Long userId, String txRef, String reason) {
        userAccountRepository.getOneForUpdate(userId).ifPresent(user -> pastDueAfterRenewalError(user, txRef, reason));
    }

    private void pastDueAfterRenewalError(UserAccount user, String txRef, String reason) {
        if (user.isPro() && user.getSubscriptionStatus() == SubscriptionStatus.ACTIVE) {
            user.setSubscriptionStatus(SubscriptionStatus.PAST_DUE);
            user.setLastPaymentFailureReason(reason);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("errorReason", reason);
            if (txRef != null) {
                payload.put("txRef", txRef);
            }
            eventPublisher.publish(BillingEventType.SUBSCRIPTION_RENEWAL_FAILED, user.getId(), payload);
            log.warn("Subscription marked past due after renewal error: userId={}, txRef={}, reason={}",
                    user.getId(), txRef, reason);
        }
    }

    private void markPastDue(UserAccount user, String reason) {
        user.setSubscriptionStatus(SubscriptionStatus.PAST_DUE);
        user.setLastPaymentFailureReason(reason);
        eventPublisher.publish(BillingEventType.SUBSCRIPTION_PAST_DUE, user.getId(), Map.of("reason", reason));
        log.warn("Subscription past due: userId={}, reason={}", user.getId(), reason);
    }

    private void requireNoRunningPeriod(UserAccount user, LocalDateTime now) {
        if (user.isPro() && user.getSubscriptionEndDate() != null && user.getSubscriptionEndDate().isAfter(now)) {
            throw new SubscriptionStateException("User already has an active subscription until " + user.getSubscriptionEndDate());
        }
    }

    private void requireNoOpenCheckout(UserAccount user, LocalDateTime now) {
        String pendingTxRef = user.getPendingSubscriptionTxRef();
        if (pendingTxRef == null) {
            return;
        }
        LocalDateTime openSince = now.minus(properties.subscription().pendingCheckoutTimeout());
        transactionRepository.findByTxRef(pendingTxRef)
                .filter(pending -> pending.getStatus() == TransactionStatus.PENDING)
                .filter(pending -> pending.getInitiatedAt().isAfter(openSince))
                .ifPresent(pending -> {
                    throw new SubscriptionStateException("A subscription checkout is already in progress: " + pendingTxRef);
                });
    }

    private UserAccount lockUser(Long userId) {
        return userAccountRepository.getOneForUpdate(userId)
                .orElseThrow(() -> new UserNotFoundException("User with ID " + userId + " not found"));
    }
}
