package com.skillswap.billing.controller;

import com.skillswap.billing.api.WalletApi;
import com.skillswap.billing.api.dto.PagedResponse;
import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.model.TransactionType;
import com.skillswap.billing.api.request.DeductTokensRequest;
import com.skillswap.billing.api.request.TopUpRequest;
import com.skillswap.billing.api.request.VerifyPaymentRequest;
import com.skillswap.billing.api.response.BalanceResponse;
import com.skillswap.billing.api.response.DeductionResponse;
import com.skillswap.billing.api.response.PaymentLinkResponse;
import com.skillswap.billing.api.response.TransactionResponse;
import com.skillswap.billing.api.response.TransactionSummaryResponse;
import com.skillswap.billing.api.response.VerificationResponse;
import com.skillswap.billing.security.CurrentUserProvider;
import com.skillswap.billing.service.TransactionHistoryService;
import com.skillswap.billing.service.WalletService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

/**
 * REST controller for the wallet of the authenticated user.
 *
 * <p>Implements {@link WalletApi}:
 * <ul>
 *   <li>Balance and transaction history</li>
 *   <li>Top-up through the payment provider, with verification fallback</li>
 *   <li>Deductions, including course sales credited to the instructor</li>
 * </ul>
 *
 * <p>A deduction naming an instructor is accepted only from a service or admin token; the
 * marketplace course service relays purchases with the buyer as subject.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class WalletController implements WalletApi {

    private static final String[] COURSE_SALE_ROLES = {"SERVICE", "ADMIN"};

    private final WalletService walletService;
    private final TransactionHistoryService transactionHistoryService;
    private final CurrentUserProvider currentUserProvider;

    @Override
    public ResponseEntity<BalanceResponse> getBalance() {
        return ResponseEntity.ok(walletService.getBalance(currentUserProvider.currentUserId()));
    }

    @Override
    public ResponseEntity<PaymentLinkResponse> topUp(TopUpRequest request) {
        Long userId = currentUserProvider.currentUserId();
        log.info("Top-up requested: userId={}, amount={}, currency={}", userId, request.amount(), request.currency());

        PaymentLinkResponse response = walletService.initiateTopUp(userId, request.amount(), request.currency(),
                request.redirectUrl());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<VerificationResponse> verifyPayment(VerifyPaymentRequest request) {
        Long userId = currentUserProvider.currentUserId();
        log.info("Top-up verification requested: userId={}, txRef={}", userId, request.txRef());
        return ResponseEntity.ok(walletService.verifyTopUp(userId, request.txRef(), request.transactionId()));
    }

    @Override
    public ResponseEntity<DeductionResponse> deduct(DeductTokensRequest request) {
        Long userId = currentUserProvider.currentUserId();
        log.info("Deduction requested: userId={}, amount={}, courseId={}, instructorId={}",
                userId, request.amount(), request.courseId(), request.instructorId());

        if (request.instructorId() != null && !currentUserProvider.hasAnyRole(COURSE_SALE_ROLES)) {
            log.warn("Instructor credit refused for a user token: userId={}, instructorId={}",
                    userId, request.instructorId());
            throw new AccessDeniedException("Crediting an instructor requires a service or admin token");
        }

        DeductionResponse response = walletService.deductTokens(userId, request.amount(), request.description(),
                request.courseId(), request.instructorId());
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<PagedResponse<TransactionResponse>> getTransactions(TransactionType type,
                                                                              TransactionStatus status,
                                                                              LocalDateTime from,
                                                                              LocalDateTime to,
                                                                              int page,
                                                                              int size) {
        Long userId = currentUserProvider.currentUserId();
        return ResponseEntity.ok(transactionHistoryService.getHistory(userId, type, status, from, to, page, size));
    }

    @Override
    public ResponseEntity<TransactionResponse> getTransaction(String txRef) {
        return ResponseEntity.ok(transactionHistoryService.getTransaction(currentUserProvider.currentUserId(), txRef));
    }

    @Override
    public ResponseEntity<TransactionSummaryResponse> getSummary() {
        return ResponseEntity.ok(transactionHistoryService.getSummary(currentUserProvider.currentUserId()));
    }
}
