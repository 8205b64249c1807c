package com.skillswap.billing.service;

/**
 * Result of the locked preparation step of a renewal.
 *
 * @param action             what the renewal should do next
 * @param txRef              reference of the pending renewal transaction, for {@link Action#CHARGE}
 * @param amount             amount to charge in minor units
 * @param currency           ISO 4217 code
 * @param authorizationToken stored card authorization to charge
 * @param customerEmail      payer email
 * @param reason             why the renewal was skipped or marked past due
 */
public record RenewalPreparation(
        Action action,
        String txRef,
        long amount,
        String currency,
        String authorizationToken,
        String customerEmail,
        String reason
) {

    public enum Action {
        /** Charge the stored payment method. */
        CHARGE,
        /** User no longer qualifies; nothing done. */
        SKIPPED,
        /** Renewal impossible; subscription moved to PAST_DUE. */
        PAST_DUE
    }

    public static RenewalPreparation charge(String txRef, long amount, String currency,
                                            String authorizationToken, String customerEmail) {
        return new RenewalPreparation(Action.CHARGE, txRef, amount, currency, authorizationToken, customerEmail, null);
    }

    public static RenewalPreparation skipped(String reason) {
        return new RenewalPreparation(Action.SKIPPED, null, 0, null, null, null, reason);
    }

    public static RenewalPreparation pastDue(String reason) {
        return new RenewalPreparation(Action.PAST_DUE, null, 0, null, null, null, reason);
    }
}
