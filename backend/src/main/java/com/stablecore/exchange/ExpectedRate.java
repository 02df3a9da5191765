package com.stablecore.exchange;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.oracle.PriceQuote;
import lombok.Value;

import java.math.BigInteger;

/**
 * Rate the caller expects, with the tolerated deviation expressed in the same decimals.
 */
@Value
public class ExpectedRate {
    BigInteger multiplier;
    BigInteger slippage;
    int decimals;

    public void validate() {
        if (multiplier == null || multiplier.signum() <= 0) {
            throw new CoreException(ErrorCode.INVALID_REQUEST, "expected rate multiplier must be positive");
        }
        if (slippage == null || slippage.signum() < 0) {
            throw new CoreException(ErrorCode.INVALID_REQUEST, "slippage must not be negative");
        }
        if (decimals < 0 || decimals > PriceQuote.MAX_DECIMALS) {
            throw new CoreException(ErrorCode.INVALID_REQUEST, "expected rate decimals out of range: " + decimals);
        }
    }
}
