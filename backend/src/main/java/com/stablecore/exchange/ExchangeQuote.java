package com.stablecore.exchange;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Priced exchange. For a buy {@code amountIn} is native and {@code amountOut} stable; for a sell the
 * other way round. Fees are in stable units.
 */
@Value
@Builder
public class ExchangeQuote {
    BigInteger amountIn;
    /** Stable notional before fees. */
    BigInteger gross;
    BigInteger spreadFee;
    BigInteger commission;
    BigInteger amountOut;
    long spreadPpm;
    BigInteger rateMultiplier;
    int rateDecimals;
}
