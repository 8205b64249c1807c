package com.skillswap.billing.gateway;

/**
 * Payment provider boundary.
 *
 * <p>Implementations must bound every call with a timeout and report a timeout as a retryable
 * {@link com.skillswap.billing.error.PaymentGatewayException}, never as a successful charge.
 */
public interface PaymentGateway {

    /**
     * Creates a hosted checkout for a pending transaction.
     *
     * @param request payment details keyed by our txRef
     * @return checkout link to send the user to
     */
    PaymentLink initializePayment(PaymentInitRequest request);

    /**
     * Charges a stored card authorization without user interaction.
     *
     * @param request charge details keyed by our txRef
     * @return outcome; a decline is a non-successful result, not an exception
     */
    ChargeResult charge(ChargeRequest request);

    /**
     * Looks up a provider transaction.
     *
     * @param providerTransactionId ID assigned by the provider
     * @return status, amount, currency and our txRef as recorded by the provider
     */
    VerificationResult verify(String providerTransactionId);
}
