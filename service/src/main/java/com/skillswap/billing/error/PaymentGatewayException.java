package com.skillswap.billing.error;

import lombok.Getter;

/**
 * Failure talking to the payment provider.
 * <p>
 * {@code retryable} is true for timeouts, connection problems and 5xx responses. A timeout is
 * never interpreted as a successful charge.
 * </p>
 */
@Getter
public class PaymentGatewayException extends RuntimeException {

    private final boolean retryable;

    public PaymentGatewayException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public PaymentGatewayException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }
}
