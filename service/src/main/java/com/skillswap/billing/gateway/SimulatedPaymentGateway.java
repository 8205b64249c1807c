package com.skillswap.billing.gateway;

import com.skillswap.billing.error.PaymentGatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deterministic stand-in for local development.
 *
 * <p>Behaviour:
 * <ul>
 *   <li>Checkout links point to a fake host; provider transaction IDs are {@code SIM-<txRef>}</li>
 *   <li>Charges succeed unless the authorization token starts with {@code decline} (declined)
 *       or {@code timeout} (retryable failure)</li>
 *   <li>Verification reports success with the amount of the checkout created for the txRef</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(value = "billing.gateway.provider", havingValue = "simulated", matchIfMissing = true)
@Slf4j
public class SimulatedPaymentGateway implements PaymentGateway {

    static final String ID_PREFIX = "SIM-";

    private final Map<String, PaymentInitRequest> checkouts = new ConcurrentHashMap<>();

    @Override
    public PaymentLink initializePayment(PaymentInitRequest request) {
        checkouts.put(request.txRef(), request);
        log.info("Simulated checkout created: txRef={}, amount={}, currency={}",
                request.txRef(), request.amount(), request.currency());
        return new PaymentLink("https://checkout.simulated.local/pay/" + request.txRef());
    }

    @Override
    public ChargeResult charge(ChargeRequest request) {
        String token = request.authorizationToken() == null ? "" : request.authorizationToken();
        if (token.startsWith("timeout")) {
            throw new PaymentGatewayException("Simulated provider timeout", true);
        }
        if (token.startsWith("decline")) {
            log.info("Simulated charge declined: txRef={}", request.txRef());
            return ChargeResult.declined("Card declined");
        }
        log.info("Simulated charge succeeded: txRef={}, amount={}", request.txRef(), request.amount());
        return ChargeResult.succeeded(ID_PREFIX + request.txRef());
    }

    @Override
    public VerificationResult verify(String providerTransactionId) {
        if (providerTransactionId == null || !providerTransactionId.startsWith(ID_PREFIX)) {
            return new VerificationResult("failed", BigDecimal.ZERO, null, null, providerTransactionId,
                    "Unknown transaction");
        }
        String txRef = providerTransactionId.substring(ID_PREFIX.length());
        PaymentInitRequest checkout = checkouts.get(txRef);
        if (checkout == null) {
            return new VerificationResult("pending", null, null, txRef, providerTransactionId, "Checkout not found");
        }
        return new VerificationResult("successful", checkout.amount(), checkout.currency(), txRef,
                providerTransactionId, "Approved");
    }
}
