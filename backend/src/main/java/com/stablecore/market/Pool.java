package com.stablecore.market;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Share accounting for one side (supplied or borrowed) of an asset. Interest grows
 * {@code balance} while {@code shares} stay put, so the share price rises.
 * Invariant: balance >= shares.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Pool {
    private BigInteger shares = BigInteger.ZERO;
    private BigInteger balance = BigInteger.ZERO;

    /** A pool without shares prices 1:1 whatever balance it still reports. */
    public BigInteger amountToShares(BigInteger amount, boolean roundUp) {
        if (shares.signum() == 0 || balance.signum() == 0) return amount;
        BigInteger num = shares.multiply(amount);
        if (roundUp) num = num.add(balance.subtract(BigInteger.ONE));
        return num.divide(balance);
    }

    public BigInteger sharesToAmount(BigInteger s, boolean roundUp) {
        if (s.signum() == 0) return BigInteger.ZERO;
        if (s.compareTo(shares) >= 0) return balance;
        BigInteger num = balance.multiply(s);
        if (roundUp) num = num.add(shares.subtract(BigInteger.ONE));
        return num.divide(shares);
    }

    public void deposit(BigInteger s, BigInteger amount) {
        shares = shares.add(s);
        balance = balance.add(amount);
    }

    public void withdraw(BigInteger s, BigInteger amount) {
        if (s.compareTo(shares) > 0 || amount.compareTo(balance) > 0) {
            throw CoreException.of(ErrorCode.INSUFFICIENT_BALANCE,
                    "pool underflow: withdraw %s shares / %s from %s shares / %s", s, amount, shares, balance);
        }
        shares = shares.subtract(s);
        balance = balance.subtract(amount);
    }

    public Pool copy() {
        return new Pool(shares, balance);
    }
}
