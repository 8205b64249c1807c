package com.skillswap.billing.service;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 0);

    @Test
    void daysRemaining_WhenPartialDayLeft_ShouldRoundUp() {
        assertThat(SubscriptionService.daysRemaining(NOW.plusDays(2).plusHours(1), NOW)).isEqualTo(3);
        assertThat(SubscriptionService.daysRemaining(NOW.plusSeconds(1), NOW)).isEqualTo(1);
        assertThat(SubscriptionService.daysRemaining(NOW.plusNanos(500_000), NOW)).isEqualTo(1);
    }

    @Test
    void daysRemaining_WhenExactDays_ShouldNotRoundUp() {
        assertThat(SubscriptionService.daysRemaining(NOW.plusDays(30), NOW)).isEqualTo(30);
    }

    @Test
    void daysRemaining_WhenEndedOrMissing_ShouldBeZero() {
        assertThat(SubscriptionService.daysRemaining(NOW, NOW)).isZero();
        assertThat(SubscriptionService.daysRemaining(NOW.minusDays(1), NOW)).isZero();
        assertThat(SubscriptionService.daysRemaining(null, NOW)).isZero();
    }
}
