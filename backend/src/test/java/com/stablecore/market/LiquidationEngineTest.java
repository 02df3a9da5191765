package com.stablecore.market;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static com.stablecore.market.MarketTestSupport.prices;
import static com.stablecore.market.MarketTestSupport.units;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LiquidationEngineTest {

    private static final String BORROWER = "borrower.test";
    private static final String LIQUIDATOR = "liquidator.test";
    private static final BigInteger TEN_NATIVE = units("10000000000000000000000000");

    private MarketTestSupport m;

    @BeforeEach
    void setUp() {
        m = new MarketTestSupport();
        m.seedSupply("lender.test", "usdt", units("100000000"));
        m.seedBorrower(BORROWER, TEN_NATIVE, units("60000000"));
        m.seedSupply(LIQUIDATOR, "usdt", units("30000000"));
    }

    @Test
    @DisplayName("liquidating a healthy account fails and changes nothing")
    void healthyNotLiquidatable() {
        AccountPosition before = m.ledger.get(BORROWER);
        AssetRecord usdtBefore = m.registry.get("usdt");
        MarketSession s = m.session();

        assertThatThrownBy(() -> m.liquidation.liquidate(s, LIQUIDATOR, BORROWER,
                List.of(AssetAmount.of("usdt", units("10000000"))),
                List.of(AssetAmount.of("native", units("1000000000000000000000000"))),
                prices("111439")))
                .isInstanceOf(CoreException.class)
                .extracting("code").isEqualTo(ErrorCode.NOT_LIQUIDATABLE);

        assertThat(m.ledger.get(BORROWER)).isEqualTo(before);
        assertThat(m.registry.get("usdt").getBorrowed()).isEqualTo(usdtBefore.getBorrowed());
        assertThat(m.registry.get("usdt").getSupplied()).isEqualTo(usdtBefore.getSupplied());
        assertThat(m.ledger.get(LIQUIDATOR).suppliedShares("usdt")).isEqualTo(units("30000000"));
    }

    @Test
    @DisplayName("an unhealthy account is repaid and its collateral moves to the liquidator's supplied role")
    void liquidatesUnhealthyAccount() {
        MarketSession s = m.session();

        m.liquidation.liquidate(s, LIQUIDATOR, BORROWER,
                List.of(AssetAmount.of("usdt", units("10000000"))),
                List.of(AssetAmount.of("native", units("1100000000000000000000000"))),
                prices("91439"));
        s.commit();

        AccountPosition target = m.ledger.get(BORROWER);
        AccountPosition liquidator = m.ledger.get(LIQUIDATOR);
        assertThat(target.borrowedShares("usdt")).isEqualTo(units("50000000"));
        assertThat(target.collateralShares("native")).isEqualTo(units("8900000000000000000000000"));
        assertThat(liquidator.suppliedShares("native")).isEqualTo(units("1100000000000000000000000"));
        assertThat(liquidator.suppliedShares("usdt")).isEqualTo(units("20000000"));
        assertThat(m.registry.get("usdt").getBorrowed().getBalance()).isEqualTo(units("50000000"));
    }

    @Test
    @DisplayName("seizing more than repaid value plus the incentive is rejected")
    void seizeBeyondIncentive() {
        MarketSession s = m.session();

        assertThatThrownBy(() -> m.liquidation.liquidate(s, LIQUIDATOR, BORROWER,
                List.of(AssetAmount.of("usdt", units("10000000"))),
                List.of(AssetAmount.of("native", units("1200000000000000000000000"))),
                prices("91439")))
                .isInstanceOf(CoreException.class)
                .extracting("code").isEqualTo(ErrorCode.INVALID_REQUEST);
        assertThat(m.ledger.get(BORROWER).collateralShares("native")).isEqualTo(TEN_NATIVE);
    }

    @Test
    @DisplayName("an account cannot liquidate itself")
    void selfLiquidation() {
        assertThatThrownBy(() -> m.liquidation.liquidate(m.session(), BORROWER, BORROWER,
                List.of(AssetAmount.all("usdt")), List.of(AssetAmount.all("native")), prices("91439")))
                .isInstanceOf(CoreException.class)
                .extracting("code").isEqualTo(ErrorCode.INVALID_REQUEST);
    }

    @Test
    @DisplayName("force close moves collateral to the reserve and writes the debt off")
    void forceCloseInsolvent() {
        MarketSession s = m.session();

        m.liquidation.forceClose(s, BORROWER, prices("51439"));
        s.commit();

        AccountPosition target = m.ledger.get(BORROWER);
        assertThat(target.getCollateral()).isEmpty();
        assertThat(target.getBorrowed()).isEmpty();
        AssetRecord nativeAsset = m.registry.get("native");
        assertThat(nativeAsset.getReserved()).isEqualTo(TEN_NATIVE);
        assertThat(nativeAsset.getSupplied().getBalance()).isEqualTo(BigInteger.ZERO);
        AssetRecord usdt = m.registry.get("usdt");
        assertThat(usdt.getBorrowed().getBalance()).isEqualTo(BigInteger.ZERO);
        // 190 supplied, 60 of debt written off with an empty reserve
        assertThat(usdt.getSupplied().getBalance()).isEqualTo(units("130000000"));
    }

    @Test
    @DisplayName("force close refuses an account whose collateral still covers its debt")
    void forceCloseSolvent() {
        assertThatThrownBy(() -> m.liquidation.forceClose(m.session(), BORROWER, prices("91439")))
                .isInstanceOf(CoreException.class)
                .extracting("code").isEqualTo(ErrorCode.NOT_LIQUIDATABLE);
    }
}
