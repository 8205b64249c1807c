package com.skillswap.billing.service;

import com.skillswap.billing.api.model.SubscriptionStatus;
import com.skillswap.billing.event.BillingEventPublisher;
import com.skillswap.billing.event.BillingEventType;
import com.skillswap.billing.model.UserAccount;
import com.skillswap.billing.repository.UserAccountRepository;
import com.skillswap.billing.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubscriptionExpiryServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 1, 2, 0);
    private static final long USER_ID = 8L;

    @Mock
    private UserAccountRepository userAccountRepository;
    @Mock
    private BillingEventPublisher eventPublisher;

    private SubscriptionExpiryService expiryService;

    @BeforeEach
    void setUp() {
        expiryService = new SubscriptionExpiryService(userAccountRepository, eventPublisher, TestProperties.defaults(),
                Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    @Test
    void expireIfOverdue_WhenEndDatePassed_ShouldExpireOnce() {
        UserAccount user = proUser(NOW.minusHours(1), SubscriptionStatus.PAST_DUE);
        when(userAccountRepository.getOneForUpdate(USER_ID)).thenReturn(Optional.of(user));

        assertThat(expiryService.expireIfOverdue(USER_ID)).isTrue();
        assertThat(expiryService.expireIfOverdue(USER_ID)).isFalse();

        assertThat(user.isPro()).isFalse();
        assertThat(user.getSubscriptionStatus()).isEqualTo(SubscriptionStatus.EXPIRED);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(eventPublisher, times(1)).publish(eq(BillingEventType.SUBSCRIPTION_EXPIRED), eq(USER_ID), payload.capture());
        assertThat(payload.getValue()).containsEntry("previousStatus", "PAST_DUE").containsEntry("status", "EXPIRED");
    }

    @Test
    void expireIfOverdue_WhenCancelledAtPeriodEnd_ShouldEndAsCancelled() {
        UserAccount user = proUser(NOW.minusMinutes(1), SubscriptionStatus.ACTIVE);
        user.setCancelAtPeriodEnd(true);
        when(userAccountRepository.getOneForUpdate(USER_ID)).thenReturn(Optional.of(user));

        assertThat(expiryService.expireIfOverdue(USER_ID)).isTrue();

        assertThat(user.getSubscriptionStatus()).isEqualTo(SubscriptionStatus.CANCELLED);
        assertThat(user.isCancelAtPeriodEnd()).isFalse();
    }

    @Test
    void expireIfOverdue_WhenRenewedMeanwhile_ShouldLeaveUserAlone() {
        UserAccount user = proUser(NOW.plusDays(30), SubscriptionStatus.ACTIVE);
        when(userAccountRepository.getOneForUpdate(USER_ID)).thenReturn(Optional.of(user));

        assertThat(expiryService.expireIfOverdue(USER_ID)).isFalse();
        assertThat(user.isPro()).isTrue();
    }

    @Test
    void remindIfExpiringSoon_ShouldSendOncePerEndDate() {
        LocalDateTime end = NOW.plusDays(2);
        UserAccount user = proUser(end, SubscriptionStatus.ACTIVE);
        when(userAccountRepository.getOneForUpdate(USER_ID)).thenReturn(Optional.of(user));

        assertThat(expiryService.remindIfExpiringSoon(USER_ID)).isTrue();
        assertThat(expiryService.remindIfExpiringSoon(USER_ID)).isFalse();

        assertThat(user.getReminderSentForEndDate()).isEqualTo(end);
        verify(eventPublisher, times(1)).publish(eq(BillingEventType.SUBSCRIPTION_EXPIRING_SOON), eq(USER_ID), anyMap());

        user.setSubscriptionEndDate(end.plusHours(12));
        assertThat(expiryService.remindIfExpiringSoon(USER_ID)).isTrue();
    }

    @Test
    void remindIfExpiringSoon_WhenEndBeyondWindow_ShouldNotRemind() {
        UserAccount user = proUser(NOW.plusDays(10), SubscriptionStatus.ACTIVE);
        when(userAccountRepository.getOneForUpdate(USER_ID)).thenReturn(Optional.of(user));

        assertThat(expiryService.remindIfExpiringSoon(USER_ID)).isFalse();
        verify(eventPublisher, times(0)).publish(anyString(), any(), anyMap());
    }

    private static UserAccount proUser(LocalDateTime endDate, SubscriptionStatus status) {
        UserAccount user = new UserAccount();
        user.setId(USER_ID);
        user.setPro(true);
        user.setSubscriptionStatus(status);
        user.setSubscriptionStartDate(endDate.minusMonths(1));
        user.setSubscriptionEndDate(endDate);
        return user;
    }
}
