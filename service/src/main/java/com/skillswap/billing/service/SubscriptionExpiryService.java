package com.skillswap.billing.service;

import com.skillswap.billing.api.model.SubscriptionStatus;
import com.skillswap.billing.config.BillingProperties;
import com.skillswap.billing.event.BillingEventPublisher;
import com.skillswap.billing.event.BillingEventType;
import com.skillswap.billing.model.UserAccount;
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
 * Per-user steps of the expiry and reminder sweeps. Each call locks the user and re-checks the
 * sweep condition, so running a step twice changes nothing the second time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionExpiryService {

    private final UserAccountRepository userAccountRepository;
    private final BillingEventPublisher eventPublisher;
    private final BillingProperties properties;
    private final Clock clock;

    /**
     * Ends Pro access if the paid period is over. A subscription cancelled at period end becomes
     * CANCELLED, any other EXPIRED.
     *
     * @return {@code true} if the user was expired by this call
     */
    @Transactional
    public boolean expireIfOverdue(Long userId) {
        Optional<UserAccount> locked = userAccountRepository.getOneForUpdate(userId);
        if (locked.isEmpty()) {
            return false;
        }
        UserAccount user = locked.get();
        LocalDateTime now = LocalDateTime.now(clock);
        boolean overdue = user.isPro()
                && (user.getSubscriptionStatus() == SubscriptionStatus.ACTIVE
                || user.getSubscriptionStatus() == SubscriptionStatus.PAST_DUE)
                && user.getSubscriptionEndDate() != null
                && user.getSubscriptionEndDate().isBefore(now);
        if (!overdue) {
            return false;
        }

        SubscriptionStatus previous = user.getSubscriptionStatus();
        SubscriptionStatus next = user.isCancelAtPeriodEnd() ? SubscriptionStatus.CANCELLED : SubscriptionStatus.EXPIRED;
        user.setPro(false);
        user.setSubscriptionStatus(next);
        user.setCancelAtPeriodEnd(false);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", next.name());
        payload.put("previousStatus", previous.name());
        payload.put("endDate", user.getSubscriptionEndDate().toString());
        eventPublisher.publish(BillingEventType.SUBSCRIPTION_EXPIRED, userId, payload);

        log.info("Subscription expired: userId={}, status={}, endDate={}", userId, next, user.getSubscriptionEndDate());
        return true;
    }

    /**
     * Sends the "expiring soon" reminder once per end date.
     *
     * @return {@code true} if a reminder was sent by this call
     */
    @Transactional
    public boolean remindIfExpiringSoon(Long userId) {
        Optional<UserAccount> locked = userAccountRepository.getOneForUpdate(userId);
        if (locked.isEmpty()) {
            return false;
        }
        UserAccount user = locked.get();
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime end = user.getSubscriptionEndDate();
        boolean due = user.isPro()
                && user.getSubscriptionStatus() == SubscriptionStatus.ACTIVE
                && end != null
                && end.isAfter(now)
                && !end.isAfter(now.plus(properties.subscription().reminderLookahead()))
                && !end.equals(user.getReminderSentForEndDate());
        if (!due) {
            return false;
        }

        user.setReminderSentForEndDate(end);
        eventPublisher.publish(BillingEventType.SUBSCRIPTION_EXPIRING_SOON, userId, Map.of(
                "endDate", end.toString(),
                "autoRenewal", user.isAutoRenewal() && !user.isCancelAtPeriodEnd()));

        log.info("Expiry reminder sent: userId={}, endDate={}", userId, end);
        return true;
    }
}
