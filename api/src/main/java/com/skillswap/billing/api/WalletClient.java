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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * WebClient-based implementation of WalletApi for consuming the billing service wallet.
 *
 * <p>Course and tutoring services use it to deduct tokens on behalf of the user whose
 * bearer token the WebClient forwards.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class BillingClientConfig {
 *     @Bean
 *     public WebClient billingWebClient(WebClient.Builder builder,
 *                                       @Value("${services.billing.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public WalletClient walletClient(WebClient billingWebClient) {
 *         return new WalletClient(billingWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class WalletClient implements WalletApi {

    private static final ParameterizedTypeReference<PagedResponse<TransactionResponse>> TRANSACTION_PAGE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;

    @Override
    public ResponseEntity<BalanceResponse> getBalance() {
        log.debug("Calling getBalance");

        return webClient.get()
                .uri("/api/v1/wallet/balance")
                .retrieve()
                .toEntity(BalanceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PaymentLinkResponse> topUp(TopUpRequest request) {
        log.debug("Calling topUp: amount={}, currency={}", request.amount(), request.currency());

        return webClient.post()
                .uri("/api/v1/wallet/topup")
                .bodyValue(request)
                .retrieve()
                .toEntity(PaymentLinkResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<VerificationResponse> verifyPayment(VerifyPaymentRequest request) {
        log.debug("Calling verifyPayment: txRef={}", request.txRef());

        return webClient.post()
                .uri("/api/v1/wallet/verify-payment")
                .bodyValue(request)
                .retrieve()
                .toEntity(VerificationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DeductionResponse> deduct(DeductTokensRequest request) {
        log.debug("Calling deduct: amount={}, courseId={}, instructorId={}",
                request.amount(), request.courseId(), request.instructorId());

        return webClient.post()
                .uri("/api/v1/wallet/deduct")
                .bodyValue(request)
                .retrieve()
                .toEntity(DeductionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<TransactionResponse>> getTransactions(TransactionType type,
                                                                              TransactionStatus status,
                                                                              LocalDateTime from,
                                                                              LocalDateTime to,
                                                                              int page,
                                                                              int size) {
        log.debug("Calling getTransactions: type={}, status={}, page={}, size={}", type, status, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/wallet/transactions")
                        .queryParamIfPresent("type", Optional.ofNullable(type))
                        .queryParamIfPresent("status", Optional.ofNullable(status))
                        .queryParamIfPresent("from", Optional.ofNullable(from))
                        .queryParamIfPresent("to", Optional.ofNullable(to))
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .retrieve()
                .toEntity(TRANSACTION_PAGE)
                .block();
    }

    @Override
    public ResponseEntity<TransactionResponse> getTransaction(String txRef) {
        log.debug("Calling getTransaction: txRef={}", txRef);

        return webClient.get()
                .uri("/api/v1/wallet/transactions/{txRef}", txRef)
                .retrieve()
                .toEntity(TransactionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TransactionSummaryResponse> getSummary() {
        log.debug("Calling getSummary");

        return webClient.get()
                .uri("/api/v1/wallet/summary")
                .retrieve()
                .toEntity(TransactionSummaryResponse.class)
                .block();
    }
}
