package com.stablecore.exchange;

import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExchangeQuoteEngineTest {

    private static final BigInteger TEN_NATIVE = new BigInteger("10000000000000000000000000");
    private static final BigInteger ONE_NATIVE = new BigInteger("1000000000000000000000000");
    private static final BigInteger RATE = BigInteger.valueOf(111439);

    private ExchangeQuoteEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ExchangeQuoteEngine(new AppProps());
    }

    @Test
    @DisplayName("minting 10 native at 111439e-28 follows the collateral ratio")
    void mintByCollateralRatio() {
        assertThat(engine.mintByCollateralRatio(TEN_NATIVE, RATE, 28, 100))
                .isEqualTo(new BigInteger("111439000000000000000"));
        assertThat(engine.mintByCollateralRatio(TEN_NATIVE, RATE, 28, 210))
                .isEqualTo(new BigInteger("53066190476190476190"));
        assertThat(engine.mintByCollateralRatio(TEN_NATIVE, RATE, 28, 1000))
                .isEqualTo(new BigInteger("11143900000000000000"));
    }

    @Test
    @DisplayName("collateral ratios outside [100, 1000] are refused")
    void collateralRatioBounds() {
        assertThatThrownBy(() -> engine.mintByCollateralRatio(TEN_NATIVE, RATE, 28, 99))
                .extracting("code").isEqualTo(ErrorCode.INVALID_REQUEST);
        assertThatThrownBy(() -> engine.mintByCollateralRatio(TEN_NATIVE, RATE, 28, 1001))
                .extracting("code").isEqualTo(ErrorCode.INVALID_REQUEST);
    }

    @Test
    @DisplayName("buy then sell of the same notional loses exactly 2 x spread plus both commissions")
    void roundTrip() {
        long spreadPpm = 1_000;
        long commissionPpm = 100;
        BigInteger two = BigInteger.TWO;

        ExchangeQuote buy = engine.quoteBuy(ONE_NATIVE, two, 24, spreadPpm, commissionPpm);
        assertThat(buy.getGross()).isEqualTo(new BigInteger("2000000000000000000"));
        assertThat(buy.getSpreadFee()).isEqualTo(new BigInteger("2000000000000000"));
        assertThat(buy.getCommission()).isEqualTo(new BigInteger("200000000000000"));
        assertThat(buy.getAmountOut()).isEqualTo(new BigInteger("1997800000000000000"));

        ExchangeQuote sell = engine.quoteSell(buy.getGross(), two, 24, spreadPpm, commissionPpm);
        assertThat(sell.getAmountOut()).isEqualTo(new BigInteger("998900000000000000000000"));

        // 0.0011 on each leg of the gross notional: 2 x 0.001 + 0.0001 + 0.0001 in total
        BigInteger stableLoss = buy.getGross().subtract(buy.getAmountOut());
        BigInteger nativeLoss = ONE_NATIVE.subtract(sell.getAmountOut());
        assertThat(stableLoss).isEqualTo(buy.getGross().multiply(BigInteger.valueOf(11)).divide(BigInteger.valueOf(10_000)));
        assertThat(nativeLoss).isEqualTo(ONE_NATIVE.multiply(BigInteger.valueOf(11)).divide(BigInteger.valueOf(10_000)));
    }

    @Test
    @DisplayName("an exchange that rounds to nothing is rejected")
    void belowMinimum() {
        assertThatThrownBy(() -> engine.quoteBuy(BigInteger.ONE, BigInteger.ONE, 28, 1_000, 100))
                .isInstanceOf(CoreException.class)
                .extracting("code").isEqualTo(ErrorCode.BELOW_MINIMUM_EXCHANGE);
        assertThatThrownBy(() -> engine.quoteSell(BigInteger.ONE, BigInteger.TEN.pow(12), 0, 1_000, 100))
                .isInstanceOf(CoreException.class)
                .extracting("code").isEqualTo(ErrorCode.BELOW_MINIMUM_EXCHANGE);
    }

    @Test
    @DisplayName("slippage compares both rates at the larger decimal scale")
    void slippage() {
        assertThatCode(() -> engine.checkSlippage(RATE, 28, new ExpectedRate(BigInteger.valueOf(11144), BigInteger.ONE, 27)))
                .doesNotThrowAnyException();
        assertThatCode(() -> engine.checkSlippage(RATE, 28, new ExpectedRate(BigInteger.valueOf(1114390), BigInteger.ZERO, 29)))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> engine.checkSlippage(RATE, 28, new ExpectedRate(BigInteger.valueOf(11145), BigInteger.ZERO, 27)))
                .isInstanceOf(CoreException.class)
                .extracting("code").isEqualTo(ErrorCode.SLIPPAGE_EXCEEDED);
    }
}
