package com.skillswap.billing.service;

import com.skillswap.billing.api.model.ReconciliationIssueKind;
import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.config.BillingProperties;
import com.skillswap.billing.config.ResilienceConfig;
import com.skillswap.billing.error.PaymentGatewayException;
import com.skillswap.billing.error.PaymentIntegrityException;
import com.skillswap.billing.gateway.ChargeRequest;
import com.skillswap.billing.gateway.ChargeResult;
import com.skillswap.billing.gateway.PaymentGateway;
import com.skillswap.billing.gateway.ProviderAmountConverter;
import com.skillswap.billing.support.TestProperties;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.TransientDataAccessResourceException;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubscriptionRenewalServiceTest {

    private static final long USER_ID = 3L;
    private static final String TX_REF = "RENEW_3_1714554000000_0a0b0c0d";

    @Mock
    private SubscriptionStateService stateService;
    @Mock
    private PaymentConfirmationService confirmationService;
    @Mock
    private ReconciliationIssueService reconciliationIssueService;
    @Mock
    private PaymentGateway paymentGateway;

    private SubscriptionRenewalService renewalService;

    @BeforeEach
    void setUp() {
        BillingProperties properties = TestProperties.defaults();
        renewalService = new SubscriptionRenewalService(stateService, confirmationService, reconciliationIssueService,
                paymentGateway, new ProviderAmountConverter(properties),
                new ResilienceConfig().gatewayChargeRetry(RetryRegistry.ofDefaults(), properties),
                new ResilienceConfig().webhookRetry(RetryRegistry.ofDefaults(), properties));
    }

    @Test
    void attemptRenewal_WhenUserNoLongerQualifies_ShouldSkipWithoutCharging() {
        when(stateService.prepareRenewal(USER_ID)).thenReturn(RenewalPreparation.skipped("Not eligible"));

        assertThat(renewalService.attemptRenewal(USER_ID)).isEqualTo(RenewalOutcome.SKIPPED);
        verifyNoInteractions(paymentGateway, confirmationService);
    }

    @Test
    void attemptRenewal_WhenNoPaymentMethod_ShouldReportPastDue() {
        when(stateService.prepareRenewal(USER_ID)).thenReturn(RenewalPreparation.pastDue("No payment method available"));

        assertThat(renewalService.attemptRenewal(USER_ID)).isEqualTo(RenewalOutcome.PAST_DUE);
        verifyNoInteractions(paymentGateway);
    }

    @Test
    void attemptRenewal_WhenChargeSucceeds_ShouldConfirmWithProviderAmount() {
        when(stateService.prepareRenewal(USER_ID)).thenReturn(chargePreparation());
        when(paymentGateway.charge(any())).thenReturn(ChargeResult.succeeded("flw-renew-1"));

        assertThat(renewalService.attemptRenewal(USER_ID)).isEqualTo(RenewalOutcome.RENEWED);

        ArgumentCaptor<ChargeRequest> charge = ArgumentCaptor.forClass(ChargeRequest.class);
        verify(paymentGateway).charge(charge.capture());
        assertThat(charge.getValue().txRef()).isEqualTo(TX_REF);
        assertThat(charge.getValue().authorizationToken()).isEqualTo("AUTH_abc");

        ArgumentCaptor<PaymentConfirmation> confirmation = ArgumentCaptor.forClass(PaymentConfirmation.class);
        verify(confirmationService).confirmSuccess(confirmation.capture());
        assertThat(confirmation.getValue().amount()).isEqualByComparingTo(new BigDecimal("2500.00"));
        assertThat(confirmation.getValue().providerTransactionId()).isEqualTo("flw-renew-1");
    }

    @Test
    void attemptRenewal_WhenChargeTimesOutOnce_ShouldRetrySameReference() {
        when(stateService.prepareRenewal(USER_ID)).thenReturn(chargePreparation());
        when(paymentGateway.charge(any()))
                .thenThrow(new PaymentGatewayException("Read timed out", true))
                .thenReturn(ChargeResult.succeeded("flw-renew-2"));

        assertThat(renewalService.attemptRenewal(USER_ID)).isEqualTo(RenewalOutcome.RENEWED);

        ArgumentCaptor<ChargeRequest> charge = ArgumentCaptor.forClass(ChargeRequest.class);
        verify(paymentGateway, times(2)).charge(charge.capture());
        assertThat(charge.getAllValues()).extracting(ChargeRequest::txRef).containsOnly(TX_REF);
    }

    @Test
    void attemptRenewal_WhenProviderKeepsTimingOut_ShouldRecordFailure() {
        when(stateService.prepareRenewal(USER_ID)).thenReturn(chargePreparation());
        when(paymentGateway.charge(any())).thenThrow(new PaymentGatewayException("Read timed out", true));

        assertThat(renewalService.attemptRenewal(USER_ID)).isEqualTo(RenewalOutcome.DECLINED);

        verify(paymentGateway, times(2)).charge(any());
        ArgumentCaptor<PaymentFailure> failure = ArgumentCaptor.forClass(PaymentFailure.class);
        verify(confirmationService).recordFailure(failure.capture());
        assertThat(failure.getValue().txRef()).isEqualTo(TX_REF);
        assertThat(failure.getValue().reason()).contains("Read timed out");
        verify(confirmationService, never()).confirmSuccess(any());
    }

    @Test
    void attemptRenewal_WhenCardDeclined_ShouldRecordFailureWithProviderReason() {
        when(stateService.prepareRenewal(USER_ID)).thenReturn(chargePreparation());
        when(paymentGateway.charge(any())).thenReturn(ChargeResult.declined("Insufficient funds"));

        assertThat(renewalService.attemptRenewal(USER_ID)).isEqualTo(RenewalOutcome.DECLINED);

        ArgumentCaptor<PaymentFailure> failure = ArgumentCaptor.forClass(PaymentFailure.class);
        verify(confirmationService).recordFailure(failure.capture());
        assertThat(failure.getValue().status()).isEqualTo(TransactionStatus.FAILED);
        assertThat(failure.getValue().reason()).isEqualTo("Insufficient funds");
        verify(paymentGateway, times(1)).charge(any());
    }

    @Test
    void attemptRenewal_WhenConfirmationContradicts_ShouldFlagIssueAndKeepChargePending() {
        when(stateService.prepareRenewal(USER_ID)).thenReturn(chargePreparation());
        when(paymentGateway.charge(any())).thenReturn(ChargeResult.succeeded("flw-renew-3"));
        when(confirmationService.confirmSuccess(any())).thenThrow(new PaymentIntegrityException(
                ReconciliationIssueKind.STATE_CONFLICT, TX_REF, "conflict"));

        assertThat(renewalService.attemptRenewal(USER_ID)).isEqualTo(RenewalOutcome.ERROR);

        verify(confirmationService, times(1)).confirmSuccess(any());
        verify(reconciliationIssueService).record(ReconciliationIssueKind.STATE_CONFLICT, TX_REF, USER_ID, "conflict");
        verify(stateService).markPastDueAwaitingConfirmation(eq(USER_ID), eq(TX_REF), anyString());
        verify(stateService, never()).markPastDueAfterError(any(), any(), any());
        verify(confirmationService, never()).recordFailure(any());
    }

    @Test
    void attemptRenewal_WhenConfirmationHitsTransientErrorOnce_ShouldRetryAndRenew() {
        when(stateService.prepareRenewal(USER_ID)).thenReturn(chargePreparation());
        when(paymentGateway.charge(any())).thenReturn(ChargeResult.succeeded("flw-renew-5"));
        when(confirmationService.confirmSuccess(any()))
                .thenThrow(new TransientDataAccessResourceException("connection reset"))
                .thenReturn(ConfirmationOutcome.APPLIED);

        assertThat(renewalService.attemptRenewal(USER_ID)).isEqualTo(RenewalOutcome.RENEWED);

        verify(confirmationService, times(2)).confirmSuccess(any());
        verify(paymentGateway, times(1)).charge(any());
        verifyNoInteractions(reconciliationIssueService);
        verify(stateService, never()).markPastDueAwaitingConfirmation(any(), any(), any());
    }

    @Test
    void attemptRenewal_WhenChargedButConfirmationKeepsFailing_ShouldLeaveTransactionPending() {
        when(stateService.prepareRenewal(USER_ID)).thenReturn(chargePreparation());
        when(paymentGateway.charge(any())).thenReturn(ChargeResult.succeeded("flw-renew-4"));
        when(confirmationService.confirmSuccess(any()))
                .thenThrow(new TransientDataAccessResourceException("connection reset"));

        assertThat(renewalService.attemptRenewal(USER_ID)).isEqualTo(RenewalOutcome.ERROR);

        verify(confirmationService, times(3)).confirmSuccess(any());
        ArgumentCaptor<String> details = ArgumentCaptor.forClass(String.class);
        verify(reconciliationIssueService).record(eq(ReconciliationIssueKind.CHARGE_UNCONFIRMED), eq(TX_REF),
                eq(USER_ID), details.capture());
        assertThat(details.getValue()).contains("flw-renew-4");
        verify(stateService).markPastDueAwaitingConfirmation(eq(USER_ID), eq(TX_REF), anyString());
        verify(stateService, never()).markPastDueAfterError(any(), any(), any());
        verify(confirmationService, never()).recordFailure(any());
    }

    @Test
    void attemptRenewal_WhenChargedAndMarkingFails_ShouldStillReturnError() {
        when(stateService.prepareRenewal(USER_ID)).thenReturn(chargePreparation());
        when(paymentGateway.charge(any())).thenReturn(ChargeResult.succeeded("flw-renew-6"));
        when(confirmationService.confirmSuccess(any())).thenThrow(new IllegalStateException("boom"));
        doThrow(new IllegalStateException("database unavailable"))
                .when(reconciliationIssueService).record(any(), any(), any(), any());
        doThrow(new IllegalStateException("database unavailable"))
                .when(stateService).markPastDueAwaitingConfirmation(eq(USER_ID), eq(TX_REF), anyString());

        assertThat(renewalService.attemptRenewal(USER_ID)).isEqualTo(RenewalOutcome.ERROR);

        verify(stateService, never()).markPastDueAfterError(any(), any(), any());
    }

    @Test
    void attemptRenewal_WhenPreparationFailsUnexpectedly_ShouldMarkPastDue() {
        when(stateService.prepareRenewal(USER_ID)).thenThrow(new IllegalStateException("boom"));

        assertThat(renewalService.attemptRenewal(USER_ID)).isEqualTo(RenewalOutcome.ERROR);

        verify(stateService).markPastDueAfterError(eq(USER_ID), eq(null), anyString());
        verifyNoInteractions(paymentGateway);
    }

    private static RenewalPreparation chargePreparation() {
        return RenewalPreparation.charge(TX_REF, 250_000L, "NGN", "AUTH_abc", "pro@example.com");
    }
}
