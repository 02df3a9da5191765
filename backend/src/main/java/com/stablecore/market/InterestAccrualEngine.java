package com.stablecore.market;

import com.stablecore.config.AppProps;
import com.stablecore.util.FixedPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Lazy, share-price based interest accrual. Only pool totals move; account shares are untouched.
 */
@Component
@RequiredArgsConstructor
public class InterestAccrualEngine {

    public static final long MS_PER_YEAR = 31_536_000_000L;
    private static final BigDecimal MS_PER_YEAR_BD = BigDecimal.valueOf(MS_PER_YEAR);

    private final AppProps props;

    /**
     * Brings the asset up to {@code nowMs}. Borrowed balance grows by the interest; the reserve-factor
     * cut goes to {@code reserved} and the remainder to the supplied pool. With no supplied shares the
     * whole interest goes to the reserve.
     */
    public void accrue(AssetRecord asset, long nowMs) {
        long dt = nowMs - asset.getLastAccrualMs();
        if (dt <= 0) return;
        asset.setLastAccrualMs(nowMs);

        Pool borrowed = asset.getBorrowed();
        if (borrowed.getBalance().signum() == 0) return;

        BigDecimal growth = growth(asset.borrowApr(), dt);
        BigInteger interest = new BigDecimal(borrowed.getBalance()).multiply(growth)
                .setScale(0, RoundingMode.DOWN).toBigIntegerExact();
        if (interest.signum() == 0) return;

        BigInteger reserveCut;
        if (asset.getSupplied().getShares().signum() == 0) {
            reserveCut = interest;
        } else {
            reserveCut = new BigDecimal(interest).multiply(asset.getConfig().getCurve().getReserveFactor())
                    .setScale(0, RoundingMode.DOWN).toBigIntegerExact();
        }
        borrowed.setBalance(borrowed.getBalance().add(interest));
        asset.setReserved(asset.getReserved().add(reserveCut));
        Pool supplied = asset.getSupplied();
        supplied.setBalance(supplied.getBalance().add(interest.subtract(reserveCut)));
    }

    /** Fractional growth of a balance over {@code dtMs} at the given APR. */
    public BigDecimal growth(BigDecimal apr, long dtMs) {
        if (apr.signum() == 0) return BigDecimal.ZERO;
        if (props.getMarket().getAccrualMode() == AccrualMode.SIMPLE) {
            return apr.multiply(BigDecimal.valueOf(dtMs)).divide(MS_PER_YEAR_BD, FixedPoint.MC);
        }
        BigDecimal perMs = BigDecimal.ONE.add(apr.divide(MS_PER_YEAR_BD, FixedPoint.MC));
        return pow(perMs, dtMs).subtract(BigDecimal.ONE);
    }

    static BigDecimal pow(BigDecimal base, long exp) {
        BigDecimal result = BigDecimal.ONE;
        BigDecimal b = base;
        long e = exp;
        while (e > 0) {
            if ((e & 1L) == 1L) result = result.multiply(b, FixedPoint.MC);
            e >>= 1;
            if (e > 0) b = b.multiply(b, FixedPoint.MC);
        }
        return result;
    }
}
