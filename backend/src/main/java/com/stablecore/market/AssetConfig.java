package com.stablecore.market;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class AssetConfig {
    InterestCurve curve;
    /** Fraction of collateral value that counts as borrowing power, within [0, 1). */
    BigDecimal collateralFactor;
    boolean canDeposit;
    boolean canWithdraw;
    boolean canUseAsCollateral;
    boolean canBorrow;

    public void validate() {
        if (curve == null) throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "asset config has no curve");
        curve.validate();
        if (collateralFactor == null || collateralFactor.signum() < 0 || collateralFactor.compareTo(BigDecimal.ONE) >= 0) {
            throw new CoreException(ErrorCode.INVALID_CONFIGURATION,
                    "collateral factor must be within [0, 1): " + collateralFactor);
        }
    }
}
