package com.stablecore.market;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Amount selector for an action. No {@code amount} means everything available,
 * optionally bounded by {@code maxAmount}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssetAmount {
    private String assetId;
    private BigInteger amount;
    private BigInteger maxAmount;

    public static AssetAmount of(String assetId, BigInteger amount) {
        return new AssetAmount(assetId, amount, null);
    }

    public static AssetAmount all(String assetId) {
        return new AssetAmount(assetId, null, null);
    }
}
