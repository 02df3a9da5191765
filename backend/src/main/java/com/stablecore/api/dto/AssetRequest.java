package com.stablecore.api.dto;

import com.stablecore.market.AssetConfig;
import com.stablecore.market.InterestCurve;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Asset registration and config update. {@code assetId} and {@code decimals} are ignored on update.
 * Range checks happen in the registry and fail with INVALID_CONFIGURATION.
 */
@Data
public class AssetRequest {
    private String assetId;
    private int decimals;

    @NotNull
    private BigDecimal baseRate;
    @NotNull
    private BigDecimal slope1;
    @NotNull
    private BigDecimal slope2;
    @NotNull
    private BigDecimal kink;
    @NotNull
    private BigDecimal reserveFactor;
    @NotNull
    private BigDecimal collateralFactor;

    private boolean canDeposit = true;
    private boolean canWithdraw = true;
    private boolean canUseAsCollateral = true;
    private boolean canBorrow = true;

    public AssetConfig toConfig() {
        return AssetConfig.builder()
                .curve(InterestCurve.builder()
                        .baseRate(baseRate)
                        .slope1(slope1)
                        .slope2(slope2)
                        .kink(kink)
                        .reserveFactor(reserveFactor)
                        .build())
                .collateralFactor(collateralFactor)
                .canDeposit(canDeposit)
                .canWithdraw(canWithdraw)
                .canUseAsCollateral(canUseAsCollateral)
                .canBorrow(canBorrow)
                .build();
    }
}
