package com.stablecore.oracle;

import com.stablecore.util.FixedPoint;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * One oracle observation: price of the asset's smallest unit = multiplier * 10^-decimals
 * reference units.
 */
@Value
@Builder
public class PriceQuote {
    public static final int MAX_DECIMALS = 77;

    String assetId;
    BigInteger multiplier;
    int decimals;
    Instant observedAt;

    /** Reference-unit value of a balance in the asset's smallest unit. */
    public BigDecimal value(BigInteger balance) {
        return new BigDecimal(balance.multiply(multiplier))
                .divide(new BigDecimal(FixedPoint.pow10(decimals)), FixedPoint.RATE_SCALE, RoundingMode.DOWN);
    }
}
