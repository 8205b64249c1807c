package com.skillswap.billing.api;

import com.skillswap.billing.api.dto.PagedResponse;
import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.model.TransactionType;
import com.skillswap.billing.api.request.DeductTokensRequest;
import com.skillswap.billing.api.response.DeductionResponse;
import com.skillswap.billing.api.response.TransactionResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WalletClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @Test
    void deduct_ShouldPostToWalletEndpointAndReadResponse() {
        WalletClient client = clientReturning(HttpStatus.OK, """
                {"txRef": "DEDUCT_5_1", "amount": 500, "newBalance": 1500, "courseId": 9, "instructorCredited": true}
                """);

        ResponseEntity<DeductionResponse> response = client.deduct(new DeductTokensRequest(500L, "Course", 9L, 2L));

        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(lastRequest.get().url().getPath()).isEqualTo("/api/v1/wallet/deduct");
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().newBalance()).isEqualTo(1500L);
        assertThat(response.getBody().instructorCredited()).isTrue();
    }

    @Test
    void getTransactions_ShouldSendOnlyGivenFilters() {
        WalletClient client = clientReturning(HttpStatus.OK, """
                {"data": [], "pageNumber": 2, "pageSize": 10, "totalRecords": 0, "totalPages": 0}
                """);

        ResponseEntity<PagedResponse<TransactionResponse>> response =
                client.getTransactions(TransactionType.TOPUP, null, null, null, 2, 10);

        assertThat(response.getBody().pageNumber()).isEqualTo(2);
        assertThat(response.getBody().data()).isEmpty();
        String query = lastRequest.get().url().getQuery();
        assertThat(query).contains("type=TOPUP", "page=2", "size=10");
        assertThat(query).doesNotContain("status=", "from=");
    }

    @Test
    void getTransaction_ShouldRequestByReference() {
        WalletClient client = clientReturning(HttpStatus.OK, """
                {"txRef": "TOPUP_5_1", "type": "TOPUP", "status": "SUCCESSFUL", "amount": 50000, "currency": "NGN"}
                """);

        ResponseEntity<TransactionResponse> response = client.getTransaction("TOPUP_5_1");

        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.GET);
        assertThat(lastRequest.get().url().getPath()).isEqualTo("/api/v1/wallet/transactions/TOPUP_5_1");
        assertThat(response.getBody().status()).isEqualTo(TransactionStatus.SUCCESSFUL);
        assertThat(response.getBody().amount()).isEqualTo(50_000L);
    }

    @Test
    void getTransaction_WhenUnknown_ShouldSurfaceNotFound() {
        WalletClient client = clientReturning(HttpStatus.NOT_FOUND, """
                {"status": 404, "error": "Not Found", "message": "Transaction with txRef X not found"}
                """);

        assertThatThrownBy(() -> client.getTransaction("X"))
                .isInstanceOf(WebClientResponseException.NotFound.class);
    }

    @Test
    void deduct_WhenInsufficientFunds_ShouldSurfaceClientError() {
        WalletClient client = clientReturning(HttpStatus.BAD_REQUEST, """
                {"status": 400, "error": "Bad Request", "message": "Insufficient balance"}
                """);

        assertThatThrownBy(() -> client.deduct(new DeductTokensRequest(500L, null, null, null)))
                .isInstanceOf(WebClientResponseException.BadRequest.class);
    }

    private WalletClient clientReturning(HttpStatus status, String json) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://billing.test")
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(json)
                            .build());
                })
                .build();
        return new WalletClient(webClient);
    }
}
