package com.skillswap.billing.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Token wallet embedded in a user account. All amounts are minor currency units.
 * <p>
 * {@code balance} is never negative. Database CHECK constraints in migration V1 enforce this
 * independently of the service layer.
 * </p>
 */
@Embeddable
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Wallet {

    @Column(name = "wallet_balance", nullable = false)
    private Long balance = 0L;

    /**
     * Lifetime amount credited: confirmed top-ups and course sales as an instructor.
     */
    @Column(name = "wallet_total_earnings", nullable = false)
    private Long totalEarnings = 0L;

    /**
     * Lifetime amount spent from the wallet.
     */
    @Column(name = "wallet_total_spent", nullable = false)
    private Long totalSpent = 0L;
}
