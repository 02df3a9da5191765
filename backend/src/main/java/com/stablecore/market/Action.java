package com.stablecore.market;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One step of a market batch. Which fields apply depends on {@link Type}:
 * single-asset actions use {@code asset}; SUPPLY also names the venue {@code receiptId} of the
 * deposit it credits; LIQUIDATE uses {@code account}, {@code inAssets} and {@code outAssets};
 * FORCE_CLOSE uses {@code account}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Action {

    public enum Type {
        SUPPLY(false, false),
        WITHDRAW(false, false),
        INCREASE_COLLATERAL(false, false),
        DECREASE_COLLATERAL(true, true),
        BORROW(true, true),
        REPAY(false, false),
        BORROW_STABLE(true, true),
        REPAY_STABLE(false, false),
        LIQUIDATE(true, false),
        FORCE_CLOSE(true, false);

        private final boolean needsPrices;
        private final boolean needsHealthCheck;

        Type(boolean needsPrices, boolean needsHealthCheck) {
            this.needsPrices = needsPrices;
            this.needsHealthCheck = needsHealthCheck;
        }

        public boolean needsPrices() {
            return needsPrices;
        }

        /** Increases the caller's risk; the batch ends with a health check. */
        public boolean needsHealthCheck() {
            return needsHealthCheck;
        }
    }

    private Type type;
    private AssetAmount asset;
    private String receiptId;
    private String account;
    private List<AssetAmount> inAssets;
    private List<AssetAmount> outAssets;

    public static Action of(Type type, AssetAmount asset) {
        return Action.builder().type(type).asset(asset).build();
    }

    public static Action supply(String receiptId, String assetId) {
        return Action.builder().type(Type.SUPPLY).asset(AssetAmount.all(assetId)).receiptId(receiptId).build();
    }
}
