package com.skillswap.billing.gateway;

import com.skillswap.billing.config.BillingProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Converts between ledger minor units and the decimal amounts the provider works with.
 * With the default scale of 2, a ledger amount of 250000 is 2500.00 at the provider.
 */
@Component
public class ProviderAmountConverter {

    private final int scale;

    public ProviderAmountConverter(BillingProperties properties) {
        this.scale = properties.gateway().amountScale();
    }

    public BigDecimal toProvider(long minorUnits) {
        return BigDecimal.valueOf(minorUnits).movePointLeft(scale);
    }

    /**
     * Exact comparison: 2500.00 matches 250000 minor units, 2500.01 does not.
     */
    public boolean matches(long minorUnits, BigDecimal providerAmount) {
        return providerAmount != null && toProvider(minorUnits).compareTo(providerAmount) == 0;
    }
}
