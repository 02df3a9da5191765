package com.stablecore.market;

import com.stablecore.util.FixedPoint;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AssetView {
    String assetId;
    int decimals;
    boolean stable;
    boolean enabled;
    String suppliedBalance;
    String suppliedShares;
    String borrowedBalance;
    String borrowedShares;
    String reserved;
    String available;
    String utilization;
    String borrowApr;
    String supplyApr;
    long lastAccrualMs;
    AssetConfig config;

    public static AssetView of(AssetRecord a) {
        return AssetView.builder()
                .assetId(a.getAssetId())
                .decimals(a.getDecimals())
                .stable(a.isStable())
                .enabled(a.isEnabled())
                .suppliedBalance(a.getSupplied().getBalance().toString())
                .suppliedShares(a.getSupplied().getShares().toString())
                .borrowedBalance(a.getBorrowed().getBalance().toString())
                .borrowedShares(a.getBorrowed().getShares().toString())
                .reserved(a.getReserved().toString())
                .available(a.available().toString())
                .utilization(FixedPoint.normalize(a.utilization()).toPlainString())
                .borrowApr(FixedPoint.normalize(a.borrowApr()).toPlainString())
                .supplyApr(FixedPoint.normalize(a.supplyApr()).toPlainString())
                .lastAccrualMs(a.getLastAccrualMs())
                .config(a.getConfig())
                .build();
    }
}
