package com.stablecore.market;

import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.oracle.Prices;
import com.stablecore.util.FixedPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Repays part of an unhealthy account's debt on its behalf and hands the liquidator
 * collateral worth at most the repaid value plus the configured incentive.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LiquidationEngine {

    private final HealthEvaluator health;
    private final StableBorrowPath stablePath;
    private final AppProps props;

    /**
     * Debt in {@code inAssets} is paid from the liquidator's supplied role, or for the stable
     * asset burned from the liquidator's token balance. Collateral in {@code outAssets} moves
     * to the liquidator's supplied role.
     */
    public void liquidate(MarketSession s, String liquidatorId, String targetId,
                          List<AssetAmount> inAssets, List<AssetAmount> outAssets, Prices prices) {
        if (liquidatorId.equals(targetId)) {
            throw new CoreException(ErrorCode.INVALID_REQUEST, "can't liquidate yourself");
        }
        CoreException.require(inAssets != null && !inAssets.isEmpty(), "liquidation needs at least one debt asset");
        CoreException.require(outAssets != null && !outAssets.isEmpty(), "liquidation needs at least one collateral asset");

        AccountPosition target = s.position(targetId);
        if (health.isHealthy(target, s::asset, prices)) {
            throw new CoreException(ErrorCode.NOT_LIQUIDATABLE, "account " + targetId + " is healthy");
        }
        BigDecimal factorBefore = health.healthFactor(target, s::asset, prices);
        AccountPosition liquidator = s.position(liquidatorId);
        PositionLedger ledger = s.ledger();

        BigDecimal repaidValue = BigDecimal.ZERO;
        List<Map<String, Object>> repaid = new ArrayList<>();
        for (AssetAmount in : inAssets) {
            AssetRecord a = s.asset(in.getAssetId());
            BigInteger amount;
            if (a.isStable()) {
                amount = stablePath.repay(s, liquidatorId, targetId, requested(in)).getAmount();
            } else {
                BigInteger funds = PositionLedger.suppliedAmount(liquidator, a);
                PositionLedger.Movement m = ledger.decreaseBorrowed(target, a, requested(in), funds);
                ledger.decreaseSupplied(liquidator, a, fundingRequest(a, m.getAmount(), funds));
                amount = m.getAmount();
            }
            repaidValue = repaidValue.add(prices.value(a.getAssetId(), amount));
            repaid.add(entry(a.getAssetId(), amount));
        }

        BigDecimal seizedValue = BigDecimal.ZERO;
        List<Map<String, Object>> seized = new ArrayList<>();
        for (AssetAmount out : outAssets) {
            AssetRecord a = s.asset(out.getAssetId());
            PositionLedger.Movement m = ledger.seizeCollateral(target, liquidator, a, out);
            seizedValue = seizedValue.add(prices.value(a.getAssetId(), m.getAmount()));
            seized.add(entry(a.getAssetId(), m.getAmount()));
        }

        BigDecimal bound = repaidValue.multiply(BigDecimal.ONE.add(props.getMarket().getLiquidationIncentive()));
        if (seizedValue.compareTo(bound) > 0) {
            throw CoreException.of(ErrorCode.INVALID_REQUEST,
                    "seized collateral worth %s exceeds repaid %s plus incentive",
                    seizedValue.stripTrailingZeros().toPlainString(), repaidValue.stripTrailingZeros().toPlainString());
        }
        BigDecimal factorAfter = health.healthFactor(target, s::asset, prices);
        if (factorAfter != null && factorAfter.compareTo(factorBefore) < 0) {
            throw CoreException.of(ErrorCode.INVALID_REQUEST,
                    "liquidation would lower the health factor of %s from %s to %s", targetId, factorBefore, factorAfter);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("liquidation_account_id", targetId);
        data.put("account_id", liquidatorId);
        data.put("repaid_assets", repaid);
        data.put("collateral_assets", seized);
        data.put("repaid_sum", repaidValue.stripTrailingZeros().toPlainString());
        data.put("collateral_sum", seizedValue.stripTrailingZeros().toPlainString());
        s.event("liquidate", data);
        log.info("[liquidation] {} liquidated {}: repaid={} seized={}", liquidatorId, targetId, repaidValue, seizedValue);
    }

    /**
     * Closes an insolvent account: its collateral goes to the reserves and its debt is written
     * off against them. Any shortfall beyond the reserve is absorbed by the supplied pool.
     */
    public void forceClose(MarketSession s, String targetId, Prices prices) {
        AccountPosition target = s.position(targetId);
        CoreException.require(!target.getBorrowed().isEmpty(), "account " + targetId + " has no debt");
        BigDecimal collateral = health.collateralValue(target, s::asset, prices);
        BigDecimal debt = health.debtValue(target, s::asset, prices);
        if (collateral.compareTo(debt) >= 0) {
            throw CoreException.of(ErrorCode.NOT_LIQUIDATABLE,
                    "account %s is not insolvent: collateral %s >= debt %s", targetId,
                    collateral.stripTrailingZeros().toPlainString(), debt.stripTrailingZeros().toPlainString());
        }

        List<Map<String, Object>> collateralMoved = new ArrayList<>();
        for (String assetId : List.copyOf(target.getCollateral().keySet())) {
            AssetRecord a = s.asset(assetId);
            BigInteger shares = target.collateralShares(assetId);
            BigInteger amount = a.getSupplied().sharesToAmount(shares, false);
            a.getSupplied().withdraw(shares, amount);
            a.setReserved(a.getReserved().add(amount));
            a.sweepOrphanSupply();
            AccountPosition.subtract(target.getCollateral(), assetId, shares);
            collateralMoved.add(entry(assetId, amount));
        }

        List<Map<String, Object>> debtCleared = new ArrayList<>();
        for (String assetId : List.copyOf(target.getBorrowed().keySet())) {
            AssetRecord a = s.asset(assetId);
            BigInteger shares = target.borrowedShares(assetId);
            BigInteger amount = a.getBorrowed().sharesToAmount(shares, true);
            a.getBorrowed().withdraw(shares, amount);
            AccountPosition.subtract(target.getBorrowed(), assetId, shares);
            BigInteger fromReserve = amount.min(a.getReserved());
            a.setReserved(a.getReserved().subtract(fromReserve));
            BigInteger shortfall = amount.subtract(fromReserve);
            if (shortfall.signum() > 0) {
                Pool supplied = a.getSupplied();
                supplied.setBalance(FixedPoint.nonNegative(supplied.getBalance().subtract(shortfall)));
            }
            debtCleared.add(entry(assetId, amount));
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("liquidation_account_id", targetId);
        data.put("collateral_assets", collateralMoved);
        data.put("repaid_assets", debtCleared);
        data.put("collateral_sum", collateral.stripTrailingZeros().toPlainString());
        data.put("repaid_sum", debt.stripTrailingZeros().toPlainString());
        s.event("force_close", data);
        log.warn("[liquidation] force-closed {}: collateral={} debt={}", targetId, collateral, debt);
    }

    private static BigInteger requested(AssetAmount a) {
        if (a.getAmount() != null) return a.getAmount();
        return a.getMaxAmount();
    }

    /** Spends exactly {@code amount} of supplied funds, or all of them when that is the whole holding. */
    private static AssetAmount fundingRequest(AssetRecord a, BigInteger amount, BigInteger funds) {
        return amount.equals(funds) ? AssetAmount.all(a.getAssetId()) : AssetAmount.of(a.getAssetId(), amount);
    }

    static Map<String, Object> entry(String assetId, BigInteger amount) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("token_id", assetId);
        m.put("amount", amount.toString());
        return m;
    }
}
