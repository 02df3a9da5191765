package com.stablecore.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Integer fixed-point helpers. Every division names its rounding direction.
 */
public final class FixedPoint {
    private FixedPoint() {}

    /** Parts-per-million denominator used for spreads and commission rates. */
    public static final long PPM = 1_000_000L;
    public static final BigInteger PPM_BI = BigInteger.valueOf(PPM);

    /** Scale of APR, utilization and value computations. */
    public static final int RATE_SCALE = 27;
    public static final MathContext MC = new MathContext(60, RoundingMode.HALF_EVEN);

    private static final BigInteger[] POW10 = new BigInteger[80];

    static {
        POW10[0] = BigInteger.ONE;
        for (int i = 1; i < POW10.length; i++) POW10[i] = POW10[i - 1].multiply(BigInteger.TEN);
    }

    public static BigInteger pow10(int exp) {
        if (exp < 0 || exp >= POW10.length) throw new IllegalArgumentException("exponent out of range: " + exp);
        return POW10[exp];
    }

    /** a * b / c, floor or ceiling. */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger c, boolean roundUp) {
        BigInteger num = a.multiply(b);
        BigInteger[] qr = num.divideAndRemainder(c);
        if (roundUp && qr[1].signum() > 0) return qr[0].add(BigInteger.ONE);
        return qr[0];
    }

    /** Floor of amount * ppm / PPM. */
    public static BigInteger applyPpm(BigInteger amount, long ppm) {
        return amount.multiply(BigInteger.valueOf(ppm)).divide(PPM_BI);
    }

    /** Moves an amount between decimal scales; floor when narrowing. */
    public static BigInteger convertDecimals(BigInteger amount, int fromDecimals, int toDecimals) {
        if (fromDecimals == toDecimals) return amount;
        if (toDecimals > fromDecimals) return amount.multiply(pow10(toDecimals - fromDecimals));
        return amount.divide(pow10(fromDecimals - toDecimals));
    }

    public static BigDecimal ratio(BigInteger num, BigInteger den) {
        if (den.signum() == 0) return BigDecimal.ZERO;
        return new BigDecimal(num).divide(new BigDecimal(den), RATE_SCALE, RoundingMode.DOWN);
    }

    /** Drops trailing zeros but keeps at least one decimal digit, e.g. 0.0 and 0.1. */
    public static BigDecimal normalize(BigDecimal v) {
        BigDecimal s = v.stripTrailingZeros();
        return s.scale() < 1 ? s.setScale(1, RoundingMode.UNNECESSARY) : s;
    }

    public static BigInteger nonNegative(BigInteger v) {
        return v.signum() < 0 ? BigInteger.ZERO : v;
    }
}
