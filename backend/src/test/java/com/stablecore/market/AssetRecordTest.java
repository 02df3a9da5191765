package com.stablecore.market;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.util.FixedPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssetRecordTest {

    private static AssetRecord asset(String slope1, long supplied, long borrowed) {
        AssetRecord a = new AssetRecord();
        a.setAssetId("usdt");
        a.setConfig(MarketTestSupport.config(slope1, "0.9"));
        a.setSupplied(new Pool(BigInteger.valueOf(supplied), BigInteger.valueOf(supplied)));
        a.setBorrowed(new Pool(BigInteger.valueOf(borrowed), BigInteger.valueOf(borrowed)));
        return a;
    }

    @Test
    @DisplayName("reference curve at 10% utilization gives the reference borrow APR")
    void referenceApr() {
        AssetRecord a = asset(MarketTestSupport.REFERENCE_SLOPE1, 10_000_000, 1_000_000);

        assertThat(FixedPoint.normalize(a.borrowApr()).toPlainString())
                .isEqualTo("0.024903108674625580324879543");
        assertThat(a.supplyApr()).isEqualByComparingTo(new BigDecimal("0.00224127978071630222923915887"));
    }

    @Test
    @DisplayName("rates fall back to base and zero without debt")
    void noDebt() {
        AssetRecord a = asset(MarketTestSupport.REFERENCE_SLOPE1, 10_000_000, 0);

        assertThat(FixedPoint.normalize(a.borrowApr()).toPlainString()).isEqualTo("0.0");
        assertThat(FixedPoint.normalize(a.supplyApr()).toPlainString()).isEqualTo("0.0");
    }

    @Test
    @DisplayName("above the kink the second slope applies")
    void aboveKink() {
        AssetRecord a = asset("0.1", 1_000, 900);
        // 0.8 * 0.1 + 0.1 * 1
        assertThat(a.borrowApr()).isEqualByComparingTo("0.18");
    }

    @Test
    @DisplayName("the stable asset is fully utilized while anything is borrowed")
    void stableUtilization() {
        AssetRecord a = asset("0.04", 0, 10);
        a.setStable(true);
        assertThat(a.utilization()).isEqualByComparingTo(BigDecimal.ONE);
        // 0.8 * 0.04 + 0.2 * 1
        assertThat(a.borrowApr()).isEqualByComparingTo("0.232");
    }

    @Test
    @DisplayName("curve validation rejects a kink outside (0, 1)")
    void invalidCurve() {
        InterestCurve bad = MarketTestSupport.config("0.1", "0.5").getCurve().toBuilder().kink(BigDecimal.ONE).build();

        assertThatThrownBy(bad::validate)
                .isInstanceOf(CoreException.class)
                .extracting("code").isEqualTo(ErrorCode.INVALID_CONFIGURATION);
    }
}
