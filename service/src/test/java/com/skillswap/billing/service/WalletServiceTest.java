package com.skillswap.billing.service;

import com.skillswap.billing.api.model.ReconciliationIssueKind;
import com.skillswap.billing.api.response.DeductionResponse;
import com.skillswap.billing.error.UserNotFoundException;
import com.skillswap.billing.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WalletServiceTest {

    @Mock
    private UserAccountService userAccountService;
    @Mock
    private WalletLedgerService walletLedgerService;
    @Mock
    private PaymentInitiationService paymentInitiationService;
    @Mock
    private PaymentVerificationService paymentVerificationService;
    @Mock
    private ReconciliationIssueService reconciliationIssueService;

    private WalletService walletService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T09:00:00Z"), ZoneOffset.UTC);
        walletService = new WalletService(userAccountService, walletLedgerService, paymentInitiationService,
                paymentVerificationService, reconciliationIssueService, new TxRefGenerator(clock),
                TestProperties.defaults(), clock);
    }

    @Test
    void deductTokens_WhenCourseSale_ShouldCreditInstructor() {
        when(walletLedgerService.debit(1L, 500L, "Course", 9L, 2L)).thenReturn(new WalletDebit("DEDUCT_1", 500L, 1_500L));

        DeductionResponse response = walletService.deductTokens(1L, 500L, "Course", 9L, 2L);

        assertThat(response.txRef()).isEqualTo("DEDUCT_1");
        assertThat(response.newBalance()).isEqualTo(1_500L);
        assertThat(response.instructorCredited()).isTrue();
        verify(userAccountService).provision(2L, null, null);
        verify(walletLedgerService).creditInstructorEarnings(2L, 1L, 500L, 9L, "DEDUCT_1");
        verifyNoInteractions(reconciliationIssueService);
    }

    @Test
    void deductTokens_WhenInstructorCreditFails_ShouldKeepDebitAndFlagIssue() {
        when(walletLedgerService.debit(1L, 500L, null, 9L, 2L)).thenReturn(new WalletDebit("DEDUCT_2", 500L, 0L));
        when(walletLedgerService.creditInstructorEarnings(2L, 1L, 500L, 9L, "DEDUCT_2"))
                .thenThrow(new UserNotFoundException("Instructor with ID 2 not found"));

        DeductionResponse response = walletService.deductTokens(1L, 500L, null, 9L, 2L);

        assertThat(response.txRef()).isEqualTo("DEDUCT_2");
        assertThat(response.instructorCredited()).isFalse();
        verify(reconciliationIssueService).record(eq(ReconciliationIssueKind.INSTRUCTOR_CREDIT_FAILED),
                eq("DEDUCT_2"), eq(1L), anyString());
    }

    @Test
    void deductTokens_WithoutCourse_ShouldNotTouchInstructor() {
        when(walletLedgerService.debit(1L, 500L, "Tip", null, null)).thenReturn(new WalletDebit("DEDUCT_3", 500L, 0L));

        DeductionResponse response = walletService.deductTokens(1L, 500L, "Tip", null, null);

        assertThat(response.instructorCredited()).isNull();
        verify(walletLedgerService, never()).creditInstructorEarnings(any(), any(), any(), any(), any());
    }

    @Test
    void deductTokens_WhenBuyerIsInstructor_ShouldReject() {
        assertThatThrownBy(() -> walletService.deductTokens(1L, 500L, null, 9L, 1L))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(walletLedgerService);
    }

    @Test
    void deductTokens_WhenAmountNotPositive_ShouldReject() {
        assertThatThrownBy(() -> walletService.deductTokens(1L, 0L, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void initiateTopUp_WhenCurrencyUnsupported_ShouldRejectBeforeCreatingTransaction() {
        assertThatThrownBy(() -> walletService.initiateTopUp(1L, 1_000L, "EUR", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported currency");
        verifyNoInteractions(paymentInitiationService, userAccountService);
    }
}
