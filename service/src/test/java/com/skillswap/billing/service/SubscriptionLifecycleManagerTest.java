package com.skillswap.billing.service;

import com.skillswap.billing.api.model.BillingJob;
import com.skillswap.billing.api.response.SweepResponse;
import com.skillswap.billing.repository.UserAccountRepository;
import com.skillswap.billing.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubscriptionLifecycleManagerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T03:00:00Z");

    @Mock
    private UserAccountRepository userAccountRepository;
    @Mock
    private SubscriptionExpiryService expiryService;
    @Mock
    private SubscriptionRenewalService renewalService;

    private SubscriptionLifecycleManager manager;

    @BeforeEach
    void setUp() {
        manager = new SubscriptionLifecycleManager(userAccountRepository, expiryService, renewalService,
                TestProperties.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void expireOverdueSubscriptions_WhenOneUserFails_ShouldContinueWithOthers() {
        when(userAccountRepository.findExpiredSubscriptionIds(anyCollection(), any())).thenReturn(List.of(1L, 2L, 3L));
        when(expiryService.expireIfOverdue(1L)).thenReturn(true);
        when(expiryService.expireIfOverdue(2L)).thenThrow(new IllegalStateException("lock timeout"));
        when(expiryService.expireIfOverdue(3L)).thenReturn(true);

        SweepResponse response = manager.expireOverdueSubscriptions();

        assertThat(response.job()).isEqualTo(BillingJob.SUBSCRIPTION_EXPIRY.getPathName());
        assertThat(response.processed()).isEqualTo(3);
        assertThat(response.succeeded()).isEqualTo(2);
        assertThat(response.failed()).isEqualTo(1);
        assertThat(response.failedUserIds()).containsExactly(2L);
    }

    @Test
    void renewExpiringSubscriptions_ShouldCountOutcomes() {
        when(userAccountRepository.findRenewalCandidateIds(any())).thenReturn(List.of(1L, 2L, 3L, 4L));
        when(renewalService.attemptRenewal(1L)).thenReturn(RenewalOutcome.RENEWED);
        when(renewalService.attemptRenewal(2L)).thenReturn(RenewalOutcome.DECLINED);
        when(renewalService.attemptRenewal(3L)).thenReturn(RenewalOutcome.SKIPPED);
        when(renewalService.attemptRenewal(4L)).thenReturn(RenewalOutcome.PAST_DUE);

        SweepResponse response = manager.run(BillingJob.SUBSCRIPTION_RENEWAL);

        assertThat(response.processed()).isEqualTo(4);
        assertThat(response.succeeded()).isEqualTo(1);
        assertThat(response.failedUserIds()).containsExactly(2L, 4L);
    }

    @Test
    void renewExpiringSubscriptions_ShouldLookAheadByConfiguredWindow() {
        when(userAccountRepository.findRenewalCandidateIds(any())).thenReturn(List.of());

        manager.renewExpiringSubscriptions();

        verify(userAccountRepository).findRenewalCandidateIds(
                eq(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).plusDays(3)));
    }

    @Test
    void sendExpiryReminders_WhenAlreadyReminded_ShouldNotCountAsSent() {
        when(userAccountRepository.findReminderCandidateIds(any(), any())).thenReturn(List.of(5L, 6L));
        when(expiryService.remindIfExpiringSoon(5L)).thenReturn(true);
        when(expiryService.remindIfExpiringSoon(6L)).thenReturn(false);

        SweepResponse response = manager.run(BillingJob.SUBSCRIPTION_REMINDERS);

        assertThat(response.processed()).isEqualTo(2);
        assertThat(response.succeeded()).isEqualTo(1);
        assertThat(response.failed()).isZero();
    }
}
