package com.stablecore.market;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.oracle.Prices;
import com.stablecore.util.FixedPoint;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Map;
import java.util.function.Function;

/**
 * Collateral adequacy of an account, in reference units.
 * Healthy iff debt value <= borrowing power.
 */
@Component
public class HealthEvaluator {

    public BigDecimal borrowingPower(AccountPosition p, Function<String, AssetRecord> assets, Prices prices) {
        BigDecimal sum = BigDecimal.ZERO;
        for (Map.Entry<String, BigInteger> e : p.getCollateral().entrySet()) {
            AssetRecord a = assets.apply(e.getKey());
            BigInteger balance = a.getSupplied().sharesToAmount(e.getValue(), false);
            sum = sum.add(prices.value(e.getKey(), balance).multiply(a.getConfig().getCollateralFactor()));
        }
        return sum;
    }

    /** Collateral value without the collateral factor. */
    public BigDecimal collateralValue(AccountPosition p, Function<String, AssetRecord> assets, Prices prices) {
        BigDecimal sum = BigDecimal.ZERO;
        for (Map.Entry<String, BigInteger> e : p.getCollateral().entrySet()) {
            AssetRecord a = assets.apply(e.getKey());
            sum = sum.add(prices.value(e.getKey(), a.getSupplied().sharesToAmount(e.getValue(), false)));
        }
        return sum;
    }

    public BigDecimal debtValue(AccountPosition p, Function<String, AssetRecord> assets, Prices prices) {
        BigDecimal sum = BigDecimal.ZERO;
        for (Map.Entry<String, BigInteger> e : p.getBorrowed().entrySet()) {
            AssetRecord a = assets.apply(e.getKey());
            sum = sum.add(prices.value(e.getKey(), a.getBorrowed().sharesToAmount(e.getValue(), true)));
        }
        return sum;
    }

    public boolean isHealthy(AccountPosition p, Function<String, AssetRecord> assets, Prices prices) {
        if (p.getBorrowed().isEmpty()) return true;
        return debtValue(p, assets, prices).compareTo(borrowingPower(p, assets, prices)) <= 0;
    }

    /** Borrowing power / debt value; null when the account has no debt. */
    public BigDecimal healthFactor(AccountPosition p, Function<String, AssetRecord> assets, Prices prices) {
        BigDecimal debt = debtValue(p, assets, prices);
        if (debt.signum() == 0) return null;
        return borrowingPower(p, assets, prices).divide(debt, FixedPoint.RATE_SCALE, RoundingMode.DOWN);
    }

    public void requireHealthy(AccountPosition p, Function<String, AssetRecord> assets, Prices prices) {
        BigDecimal debt = debtValue(p, assets, prices);
        BigDecimal power = borrowingPower(p, assets, prices);
        if (debt.compareTo(power) > 0) {
            throw CoreException.of(ErrorCode.INSUFFICIENT_COLLATERAL,
                    "%s would owe %s against borrowing power %s", p.getAccountId(),
                    debt.stripTrailingZeros().toPlainString(), power.stripTrailingZeros().toPlainString());
        }
    }
}
