package com.skillswap.billing.gateway;

/**
 * @param success       whether the provider accepted the charge
 * @param transactionId provider transaction ID, present on success
 * @param error         provider's stated reason, present on failure
 */
public record ChargeResult(boolean success, String transactionId, String error) {

    public static ChargeResult succeeded(String transactionId) {
        return new ChargeResult(true, transactionId, null);
    }

    public static ChargeResult declined(String error) {
        return new ChargeResult(false, null, error);
    }
}
