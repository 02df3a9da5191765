package com.stablecore.market;

import com.stablecore.util.FixedPoint;
import lombok.Data;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Market state of one accepted asset.
 *
 * Cash held for the asset is {@code supplied.balance + reserved - borrowed.balance}. The reserve
 * stays in cash and is never lent, so borrowing and supplier withdrawals are limited to
 * {@code supplied.balance - borrowed.balance}.
 */
@Data
public class AssetRecord {
    private String assetId;
    private int decimals;
    /** The synthetic stable asset: minted on borrow, never supplied by users. */
    private boolean stable;
    private boolean enabled;
    private Pool supplied = new Pool();
    private Pool borrowed = new Pool();
    private BigInteger reserved = BigInteger.ZERO;
    private long lastAccrualMs;
    private AssetConfig config;

    public BigDecimal utilization() {
        if (stable) {
            return borrowed.getBalance().signum() > 0 ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        BigDecimal u = FixedPoint.ratio(borrowed.getBalance(), supplied.getBalance());
        return u.compareTo(BigDecimal.ONE) > 0 ? BigDecimal.ONE : u;
    }

    public BigDecimal borrowApr() {
        if (borrowed.getBalance().signum() == 0) return config.getCurve().getBaseRate();
        return config.getCurve().borrowApr(utilization());
    }

    public BigDecimal supplyApr() {
        if (borrowed.getBalance().signum() == 0 || supplied.getBalance().signum() == 0) return BigDecimal.ZERO;
        BigDecimal keep = BigDecimal.ONE.subtract(config.getCurve().getReserveFactor());
        return borrowApr().multiply(utilization()).multiply(keep);
    }

    public BigInteger available() {
        return FixedPoint.nonNegative(supplied.getBalance().subtract(borrowed.getBalance()));
    }

    /** Supply balance left behind without shares (rounding dust) moves to the reserve. */
    public void sweepOrphanSupply() {
        if (supplied.getShares().signum() == 0 && supplied.getBalance().signum() > 0) {
            reserved = reserved.add(supplied.getBalance());
            supplied.setBalance(BigInteger.ZERO);
        }
    }

    public AssetRecord copy() {
        AssetRecord c = new AssetRecord();
        c.assetId = assetId;
        c.decimals = decimals;
        c.stable = stable;
        c.enabled = enabled;
        c.supplied = supplied.copy();
        c.borrowed = borrowed.copy();
        c.reserved = reserved;
        c.lastAccrualMs = lastAccrualMs;
        c.config = config;
        return c;
    }
}
