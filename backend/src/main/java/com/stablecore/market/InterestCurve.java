package com.stablecore.market;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Piecewise-linear borrow APR keyed on utilization, with a steeper slope above the kink.
 */
@Value
@Builder(toBuilder = true)
public class InterestCurve {
    BigDecimal baseRate;
    BigDecimal slope1;
    BigDecimal slope2;
    BigDecimal kink;
    BigDecimal reserveFactor;

    public BigDecimal borrowApr(BigDecimal utilization) {
        if (utilization.compareTo(kink) <= 0) {
            return baseRate.add(utilization.multiply(slope1));
        }
        return baseRate.add(kink.multiply(slope1)).add(utilization.subtract(kink).multiply(slope2));
    }

    public void validate() {
        if (baseRate == null || slope1 == null || slope2 == null || kink == null || reserveFactor == null) {
            throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "interest curve has missing parameters");
        }
        if (baseRate.signum() < 0 || slope1.signum() < 0 || slope2.signum() < 0) {
            throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "interest curve rates must be non-negative");
        }
        if (kink.signum() <= 0 || kink.compareTo(BigDecimal.ONE) >= 0) {
            throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "kink must be within (0, 1): " + kink);
        }
        if (reserveFactor.signum() < 0 || reserveFactor.compareTo(BigDecimal.ONE) >= 0) {
            throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "reserve factor must be within [0, 1): " + reserveFactor);
        }
    }
}
