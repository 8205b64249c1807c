package com.skillswap.billing.api;

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
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;

/**
 * Wallet API of the authenticated user.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>WalletController - in service module (server-side implementation)</li>
 *   <li>WalletClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/wallet")
public interface WalletApi {

    @GetMapping("/balance")
    ResponseEntity<BalanceResponse> getBalance();

    /**
     * Initiates a top-up. The wallet is credited only when the provider confirms the payment.
     *
     * @param request amount and currency
     * @return payment link and txRef
     */
    @PostMapping("/topup")
    ResponseEntity<PaymentLinkResponse> topUp(@RequestBody @Valid TopUpRequest request);

    /**
     * Verifies a top-up with the provider and credits the wallet once.
     *
     * @param request txRef and provider transaction ID
     * @return verification outcome
     */
    @PostMapping("/verify-payment")
    ResponseEntity<VerificationResponse> verifyPayment(@RequestBody @Valid VerifyPaymentRequest request);

    /**
     * Deducts from the wallet. Rejected without any change when the balance is insufficient.
     * Naming an instructor requires a service or admin token, otherwise 403.
     *
     * @param request amount, reason and optional course/instructor
     * @return deduction result with the new balance
     */
    @PostMapping("/deduct")
    ResponseEntity<DeductionResponse> deduct(@RequestBody @Valid DeductTokensRequest request);

    /**
     * Lists transactions, newest first.
     *
     * @param type   optional type filter
     * @param status optional status filter
     * @param from   optional inclusive lower bound on initiation time
     * @param to     optional inclusive upper bound on initiation time
     * @param page   1-based page number
     * @param size   page size, at most 100
     * @return one page of transactions
     */
    @GetMapping("/transactions")
    ResponseEntity<PagedResponse<TransactionResponse>> getTransactions(
            @RequestParam(value = "type", required = false) TransactionType type,
            @RequestParam(value = "status", required = false) TransactionStatus status,
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "size", defaultValue = "20") int size);

    /**
     * Returns one transaction of the authenticated user.
     *
     * @param txRef payment reference
     * @return the transaction; 404 when unknown or owned by another user
     */
    @GetMapping("/transactions/{txRef}")
    ResponseEntity<TransactionResponse> getTransaction(@PathVariable("txRef") String txRef);

    @GetMapping("/summary")
    ResponseEntity<TransactionSummaryResponse> getSummary();
}
