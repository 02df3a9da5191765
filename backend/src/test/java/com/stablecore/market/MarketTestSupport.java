package com.stablecore.market;

import com.stablecore.auth.AuthContext;
import com.stablecore.auth.Role;
import com.stablecore.config.AppProps;
import com.stablecore.ledger.InMemoryTokenLedger;
import com.stablecore.oracle.PriceQuote;
import com.stablecore.oracle.Prices;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Real market components over a fixed clock: a native asset (24 decimals, factor 0.6),
 * usdt (6 decimals, factor 0.9, slope1 of the reference curve) and the stable asset.
 */
final class MarketTestSupport {

    static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    static final AuthContext OWNER = AuthContext.of("owner.test", Role.OWNER);
    static final String REFERENCE_SLOPE1 = "0.24903108674625580324879543";

    final AppProps props = new AppProps();
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    final InterestAccrualEngine accrual = new InterestAccrualEngine(props);
    final AssetRegistry registry = new AssetRegistry(props, accrual, clock);
    final PositionLedger ledger = new PositionLedger();
    final InMemoryTokenLedger tokens = new InMemoryTokenLedger();
    final HealthEvaluator health = new HealthEvaluator();
    final StableBorrowPath stablePath = new StableBorrowPath(props);
    final LiquidationEngine liquidation = new LiquidationEngine(health, stablePath, props);

    MarketTestSupport() {
        registry.register(OWNER, "native", 24, config("0.1", "0.6"));
        registry.register(OWNER, "usdt", 6, config(REFERENCE_SLOPE1, "0.9"));
        registry.register(OWNER, "stable", 18, config("0.04", "0").toBuilder().canDeposit(false).build());
    }

    static AssetConfig config(String slope1, String collateralFactor) {
        return AssetConfig.builder()
                .curve(InterestCurve.builder()
                        .baseRate(BigDecimal.ZERO)
                        .slope1(new BigDecimal(slope1))
                        .slope2(BigDecimal.ONE)
                        .kink(new BigDecimal("0.8"))
                        .reserveFactor(new BigDecimal("0.1"))
                        .build())
                .collateralFactor(new BigDecimal(collateralFactor))
                .canDeposit(true)
                .canWithdraw(true)
                .canUseAsCollateral(true)
                .canBorrow(true)
                .build();
    }

    MarketSession session() {
        return new MarketSession(registry, ledger, accrual, tokens, clock.millis(), 20);
    }

    /** Native priced at {@code nativeMultiplier}e-28, usdt at one reference unit, stable at its peg. */
    static Prices prices(String nativeMultiplier) {
        Map<String, PriceQuote> m = new LinkedHashMap<>();
        m.put("native", quote("native", nativeMultiplier, 28));
        m.put("usdt", quote("usdt", "1", 6));
        m.put("stable", quote("stable", "10000", 22));
        return new Prices(m);
    }

    static PriceQuote quote(String id, String multiplier, int decimals) {
        return PriceQuote.builder()
                .assetId(id)
                .multiplier(new BigInteger(multiplier))
                .decimals(decimals)
                .observedAt(NOW)
                .build();
    }

    static BigInteger units(String v) {
        return new BigInteger(v);
    }

    /** Supplies, pledges and borrows like a committed batch would. */
    void seedBorrower(String account, BigInteger nativeCollateral, BigInteger usdtDebt) {
        MarketSession s = session();
        AccountPosition p = s.position(account);
        AssetRecord nativeAsset = s.asset("native");
        AssetRecord usdt = s.asset("usdt");
        s.ledger().increaseSupplied(p, nativeAsset, nativeCollateral);
        s.ledger().increaseCollateral(p, nativeAsset, AssetAmount.all("native"));
        s.ledger().increaseBorrowed(p, usdt, usdtDebt);
        s.ledger().increaseSupplied(p, usdt, usdtDebt);
        s.commit();
    }

    void seedSupply(String account, String assetId, BigInteger amount) {
        MarketSession s = session();
        s.ledger().increaseSupplied(s.position(account), s.asset(assetId), amount);
        s.commit();
    }
}
