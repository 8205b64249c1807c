package com.skillswap.billing.service;

import com.skillswap.billing.api.model.ReconciliationIssueKind;
import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.model.TransactionType;
import com.skillswap.billing.api.response.BalanceResponse;
import com.skillswap.billing.api.response.DeductionResponse;
import com.skillswap.billing.api.response.PaymentLinkResponse;
import com.skillswap.billing.api.response.VerificationResponse;
import com.skillswap.billing.config.BillingProperties;
import com.skillswap.billing.error.InsufficientFundsException;
import com.skillswap.billing.error.PaymentGatewayException;
import com.skillswap.billing.model.Transaction;
import com.skillswap.billing.model.UserAccount;
import com.skillswap.billing.model.Wallet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Wallet operations of a user.
 *
 * <p>Top-ups are two-step: {@link #initiateTopUp} creates a PENDING transaction and a checkout
 * link, and the balance is credited only when the provider confirms the payment (webhook or
 * {@link #verifyTopUp}).
 *
 * <p>A deduction for a course sale is two separate commits: the buyer debit first, then the
 * instructor credit. A failed credit is flagged for reconciliation and never undoes the debit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    private final UserAccountService userAccountService;
    private final WalletLedgerService walletLedgerService;
    private final PaymentInitiationService paymentInitiationService;
    private final PaymentVerificationService paymentVerificationService;
    private final ReconciliationIssueService reconciliationIssueService;
    private final TxRefGenerator txRefGenerator;
    private final BillingProperties properties;
    private final Clock clock;

    public BalanceResponse getBalance(Long userId) {
        Wallet wallet = userAccountService.getAccount(userId).getWallet();
        return new BalanceResponse(userId, wallet.getBalance(), wallet.getTotalEarnings(), wallet.getTotalSpent());
    }

    /**
     * Starts a top-up payment.
     *
     * @param amount   amount in minor units
     * @param currency one of the configured top-up currencies
     * @return checkout link and txRef
     * @throws IllegalArgumentException if the amount is not positive or the currency is not supported
     * @throws PaymentGatewayException  if the provider could not create the checkout
     */
    public PaymentLinkResponse initiateTopUp(Long userId, Long amount, String currency, String redirectUrl) {
        if (amount == null || amount <= 0) {
            throw new IllegalArgumentException("Top-up amount must be positive");
        }
        String normalizedCurrency = currency == null ? null : currency.trim().toUpperCase(Locale.ROOT);
        if (normalizedCurrency == null || !properties.wallet().topUpCurrencies().contains(normalizedCurrency)) {
            throw new IllegalArgumentException("Unsupported currency: " + currency
                    + ". Supported: " + properties.wallet().topUpCurrencies());
        }

        UserAccount user = userAccountService.getAccount(userId);

        Transaction pending = new Transaction();
        pending.setUserId(userId);
        pending.setType(TransactionType.TOPUP);
        pending.setAmount(amount);
        pending.setCurrency(normalizedCurrency);
        pending.setTxRef(txRefGenerator.generate(TxRefGenerator.TOPUP, userId));
        pending.setStatus(TransactionStatus.PENDING);
        pending.setDescription("Wallet top-up");
        pending.setInitiatedAt(LocalDateTime.now(clock));

        return paymentInitiationService.initiate(pending, user, redirectUrl);
    }

    public VerificationResponse verifyTopUp(Long userId, String txRef, String providerTransactionId) {
        return paymentVerificationService.verify(userId, txRef, providerTransactionId);
    }

    /**
     * Deducts tokens. With both a course and an instructor the deduction is a course sale and the
     * instructor is credited the same amount.
     *
     * @throws IllegalArgumentException   if the amount is not positive or the buyer is the instructor
     * @throws InsufficientFundsException if the balance is lower than the amount; nothing changes
     */
    public DeductionResponse deductTokens(Long userId, Long amount, String description, Long courseId,
                                          Long instructorId) {
        if (amount == null || amount <= 0) {
            throw new IllegalArgumentException("Deduction amount must be positive");
        }
        if (instructorId != null && instructorId.equals(userId)) {
            throw new IllegalArgumentException("Instructor cannot purchase their own course");
        }

        WalletDebit debit = walletLedgerService.debit(userId, amount, description, courseId, instructorId);

        Boolean instructorCredited = null;
        if (courseId != null && instructorId != null) {
            instructorCredited = creditInstructor(instructorId, userId, amount, courseId, debit.txRef());
        }

        return new DeductionResponse(debit.txRef(), amount, debit.newBalance(), courseId, instructorCredited);
    }

    private boolean creditInstructor(Long instructorId, Long buyerId, Long amount, Long courseId,
                                     String deductionTxRef) {
        try {
            userAccountService.provision(instructorId, null, null);
            walletLedgerService.creditInstructorEarnings(instructorId, buyerId, amount, courseId, deductionTxRef);
            return true;
        } catch (RuntimeException e) {
            log.error("Instructor credit failed: instructorId={}, deductionTxRef={}, amount={}",
                    instructorId, deductionTxRef, amount, e);
            reconciliationIssueService.record(ReconciliationIssueKind.INSTRUCTOR_CREDIT_FAILED, deductionTxRef,
                    buyerId, String.format("Instructor %d was not credited %d for course %d: %s",
                            instructorId, amount, courseId, e.getMessage()));
            return false;
        }
    }
}
