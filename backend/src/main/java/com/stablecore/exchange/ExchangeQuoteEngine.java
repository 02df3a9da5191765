package com.stablecore.exchange;

import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.util.FixedPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Pure pricing of mint and redeem. The rate is {@code multiplier * 10^-decimals} stable per native
 * smallest unit, scaled to stable decimals. Spread and commission are both taken from the gross
 * stable notional, floor-rounded, so callers never receive more than the rate allows.
 */
@Component
@RequiredArgsConstructor
public class ExchangeQuoteEngine {

    private final AppProps props;

    public ExchangeQuote quoteBuy(BigInteger nativeAmount, BigInteger multiplier, int decimals,
                                  long spreadPpm, long commissionPpm) {
        requirePositive(nativeAmount);
        requireRate(multiplier, decimals);
        BigInteger gross = nativeAmount.multiply(multiplier)
                .multiply(FixedPoint.pow10(stableDecimals()))
                .divide(FixedPoint.pow10(decimals));
        BigInteger spreadFee = FixedPoint.applyPpm(gross, spreadPpm);
        BigInteger commission = FixedPoint.applyPpm(gross, commissionPpm);
        BigInteger out = gross.subtract(spreadFee).subtract(commission);
        if (out.signum() <= 0) {
            throw CoreException.of(ErrorCode.BELOW_MINIMUM_EXCHANGE, "%s native is too little to exchange", nativeAmount);
        }
        return ExchangeQuote.builder()
                .amountIn(nativeAmount)
                .gross(gross)
                .spreadFee(spreadFee)
                .commission(commission)
                .amountOut(out)
                .spreadPpm(spreadPpm)
                .rateMultiplier(multiplier)
                .rateDecimals(decimals)
                .build();
    }

    public ExchangeQuote quoteSell(BigInteger stableAmount, BigInteger multiplier, int decimals,
                                   long spreadPpm, long commissionPpm) {
        requirePositive(stableAmount);
        requireRate(multiplier, decimals);
        BigInteger spreadFee = FixedPoint.applyPpm(stableAmount, spreadPpm);
        BigInteger commission = FixedPoint.applyPpm(stableAmount, commissionPpm);
        BigInteger net = stableAmount.subtract(spreadFee).subtract(commission);
        BigInteger out = net.multiply(FixedPoint.pow10(decimals))
                .divide(multiplier.multiply(FixedPoint.pow10(stableDecimals())));
        if (out.signum() <= 0) {
            throw CoreException.of(ErrorCode.BELOW_MINIMUM_EXCHANGE, "%s stable is too little to exchange", stableAmount);
        }
        return ExchangeQuote.builder()
                .amountIn(stableAmount)
                .gross(stableAmount)
                .spreadFee(spreadFee)
                .commission(commission)
                .amountOut(out)
                .spreadPpm(spreadPpm)
                .rateMultiplier(multiplier)
                .rateDecimals(decimals)
                .build();
    }

    /**
     * Fails with SLIPPAGE_EXCEEDED when the oracle rate is further than {@code slippage} from the
     * expected rate. Both rates are compared at the larger of the two decimal scales.
     */
    public void checkSlippage(BigInteger oracleMultiplier, int oracleDecimals, ExpectedRate expected) {
        expected.validate();
        int scale = Math.max(oracleDecimals, expected.getDecimals());
        BigInteger oracle = oracleMultiplier.multiply(FixedPoint.pow10(scale - oracleDecimals));
        BigInteger shift = FixedPoint.pow10(scale - expected.getDecimals());
        BigInteger exp = expected.getMultiplier().multiply(shift);
        BigInteger tolerance = expected.getSlippage().multiply(shift);
        if (oracle.subtract(exp).abs().compareTo(tolerance) > 0) {
            throw CoreException.of(ErrorCode.SLIPPAGE_EXCEEDED,
                    "rate %se-%d is outside %s±%s e-%d", oracleMultiplier, oracleDecimals,
                    expected.getMultiplier(), expected.getSlippage(), expected.getDecimals());
        }
    }

    /**
     * Owner mint against native collateral. {@code collateralRatio} is in percent; every step floors.
     */
    public BigInteger mintByCollateralRatio(BigInteger nativeAmount, BigInteger multiplier, int decimals, int collateralRatio) {
        AppProps.Exchange ex = props.getExchange();
        if (collateralRatio < ex.getMinCollateralRatio() || collateralRatio > ex.getMaxCollateralRatio()) {
            throw CoreException.of(ErrorCode.INVALID_REQUEST, "collateral ratio must be within [%d, %d], got %d",
                    ex.getMinCollateralRatio(), ex.getMaxCollateralRatio(), collateralRatio);
        }
        requirePositive(nativeAmount);
        requireRate(multiplier, decimals);
        BigInteger raw = nativeAmount.multiply(multiplier);
        BigInteger stable = FixedPoint.convertDecimals(raw, decimals, stableDecimals());
        BigInteger amount = stable.multiply(BigInteger.valueOf(100)).divide(BigInteger.valueOf(collateralRatio));
        if (amount.signum() <= 0) {
            throw CoreException.of(ErrorCode.BELOW_MINIMUM_EXCHANGE, "%s native mints nothing", nativeAmount);
        }
        return amount;
    }

    /** Reference-unit size of a stable amount, fed to the adaptive spread. */
    public BigDecimal notional(BigInteger stableAmount) {
        return new BigDecimal(stableAmount).divide(new BigDecimal(FixedPoint.pow10(stableDecimals())), 6, RoundingMode.DOWN);
    }

    private int stableDecimals() {
        return props.getExchange().getStableDecimals();
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new CoreException(ErrorCode.INVALID_REQUEST, "amount must be positive");
        }
    }

    private static void requireRate(BigInteger multiplier, int decimals) {
        if (multiplier == null || multiplier.signum() <= 0 || decimals < 0 || decimals > 77) {
            throw CoreException.of(ErrorCode.INVALID_REQUEST, "invalid rate %se-%d", multiplier, decimals);
        }
    }
}
