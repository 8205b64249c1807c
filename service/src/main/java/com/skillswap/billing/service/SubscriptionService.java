package com.skillswap.billing.service;

import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.model.TransactionType;
import com.skillswap.billing.api.response.MySubscriptionResponse;
import com.skillswap.billing.api.response.PaymentLinkResponse;
import com.skillswap.billing.api.response.SubscriptionAnalyticsResponse;
import com.skillswap.billing.api.response.VerificationResponse;
import com.skillswap.billing.error.PaymentGatewayException;
import com.skillswap.billing.error.PlanNotFoundException;
import com.skillswap.billing.error.SubscriptionStateException;
import com.skillswap.billing.model.SubscriptionPlan;
import com.skillswap.billing.model.Transaction;
import com.skillswap.billing.model.UserAccount;
import com.skillswap.billing.repository.TransactionRepository;
import com.skillswap.billing.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Subscription operations of a user.
 *
 * <p>Subscribing is two-step like a top-up: a PENDING transaction carrying a snapshot of the
 * plan, then activation when the provider confirms. The snapshot decides the period, so later
 * plan edits do not affect a payment in flight.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private static final long MILLIS_PER_DAY = 86_400_000L;

    private final SubscriptionPlanService planService;
    private final SubscriptionStateService stateService;
    private final UserAccountService userAccountService;
    private final PaymentInitiationService paymentInitiationService;
    private final PaymentVerificationService paymentVerificationService;
    private final UserAccountRepository userAccountRepository;
    private final TransactionRepository transactionRepository;
    private final Clock clock;

    /**
     * Starts a subscription to an active plan.
     *
     * @return checkout link; for a free plan the subscription is active already and the link is {@code null}
     * @throws PlanNotFoundException      if the plan does not exist or is inactive
     * @throws SubscriptionStateException if the user has a paid period running
     * @throws PaymentGatewayException    if the provider could not create the checkout
     */
    public PaymentLinkResponse subscribe(Long userId, Long planId, String redirectUrl) {
        SubscriptionPlan plan = planService.getPlan(planId);
        if (!plan.isActive()) {
            throw new PlanNotFoundException("Subscription plan with ID " + planId + " is not available");
        }

        if (plan.getPrice() == 0) {
            return stateService.activateFreePlan(userId, plan);
        }

        Transaction pending = stateService.createPendingSubscription(userId, plan);
        UserAccount user = userAccountService.getAccount(userId);
        try {
            return paymentInitiationService.requestPaymentLink(pending, user, redirectUrl);
        } catch (PaymentGatewayException e) {
            stateService.clearPending(userId, pending.getTxRef());
            throw e;
        }
    }

    public VerificationResponse verify(Long userId, String txRef, String providerTransactionId) {
        return paymentVerificationService.verify(userId, txRef, providerTransactionId);
    }

    @Transactional(readOnly = true)
    public MySubscriptionResponse mySubscription(Long userId) {
        UserAccount user = userAccountService.getAccount(userId);
        return new MySubscriptionResponse(
                user.isPro(),
                user.getSubscriptionStatus(),
                planService.findPlanResponse(user.getSubscriptionPlanId()).orElse(null),
                user.getSubscriptionStartDate(),
                user.getSubscriptionEndDate(),
                daysRemaining(user.getSubscriptionEndDate(), LocalDateTime.now(clock)),
                user.isAutoRenewal(),
                user.isCancelAtPeriodEnd(),
                user.getLastPaymentFailureReason());
    }

    public MySubscriptionResponse cancel(Long userId) {
        stateService.cancelAtPeriodEnd(userId);
        return mySubscription(userId);
    }

    public MySubscriptionResponse setAutoRenewal(Long userId, boolean enabled) {
        stateService.setAutoRenewal(userId, enabled);
        return mySubscription(userId);
    }

    @Transactional(readOnly = true)
    public SubscriptionAnalyticsResponse analytics() {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (Object[] row : userAccountRepository.countBySubscriptionStatus()) {
            byStatus.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
        }
        Map<String, Long> revenue = new LinkedHashMap<>();
        for (Object[] row : transactionRepository.sumAmountByCurrency(TransactionType.SUBSCRIPTION, TransactionStatus.SUCCESSFUL)) {
            revenue.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
        }
        return new SubscriptionAnalyticsResponse(userAccountRepository.countByProTrue(), byStatus, revenue);
    }

    /**
     * Whole days until the end date, rounded up; 0 once the end date has passed.
     */
    static long daysRemaining(LocalDateTime endDate, LocalDateTime now) {
        if (endDate == null || !endDate.isAfter(now)) {
            return 0;
        }
        long millis = Duration.between(now, endDate).toMillis();
        return Math.max(1, (millis + MILLIS_PER_DAY - 1) / MILLIS_PER_DAY);
    }
}
