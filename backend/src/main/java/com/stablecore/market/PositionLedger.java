package com.stablecore.market;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Committed account positions plus the primitive share mutations every user action is built from.
 *
 * Rounding: shares credited to an account and amounts paid out to it round down; shares debited
 * from it and debt charged to it round up. The pools therefore never owe more than they hold.
 */
@Component
public class PositionLedger {

    private final Map<String, AccountPosition> positions = new ConcurrentHashMap<>();

    /** Resolved share/amount pair for one primitive mutation. */
    @Value
    public static class Movement {
        BigInteger shares;
        BigInteger amount;
    }

    /** Detached copy of the committed position, or an empty one. */
    public AccountPosition get(String accountId) {
        AccountPosition p = positions.get(accountId);
        return p == null ? new AccountPosition(accountId) : p.copy();
    }

    public List<String> accountIds() {
        return List.copyOf(positions.keySet());
    }

    void commit(AccountPosition position) {
        if (position.isEmpty()) positions.remove(position.getAccountId());
        else positions.put(position.getAccountId(), position.copy());
    }

    // ---------------------------- supplied ----------------------------

    public Movement increaseSupplied(AccountPosition p, AssetRecord a, BigInteger amount) {
        requirePositive(amount);
        a.sweepOrphanSupply();
        BigInteger shares = a.getSupplied().amountToShares(amount, false);
        if (shares.signum() == 0) {
            throw CoreException.of(ErrorCode.INVALID_REQUEST, "amount %s of %s is below one share", amount, a.getAssetId());
        }
        a.getSupplied().deposit(shares, amount);
        AccountPosition.add(p.getSupplied(), a.getAssetId(), shares);
        return new Movement(shares, amount);
    }

    public Movement decreaseSupplied(AccountPosition p, AssetRecord a, AssetAmount req) {
        Movement m = resolve(a.getSupplied(), p.suppliedShares(a.getAssetId()), req, false);
        a.getSupplied().withdraw(m.getShares(), m.getAmount());
        a.sweepOrphanSupply();
        AccountPosition.subtract(p.getSupplied(), a.getAssetId(), m.getShares());
        return m;
    }

    // ---------------------------- collateral ----------------------------

    /** Pledges supplied shares. Pool totals do not change. */
    public Movement increaseCollateral(AccountPosition p, AssetRecord a, AssetAmount req) {
        Movement m = resolve(a.getSupplied(), p.suppliedShares(a.getAssetId()), req, false);
        AccountPosition.subtract(p.getSupplied(), a.getAssetId(), m.getShares());
        AccountPosition.add(p.getCollateral(), a.getAssetId(), m.getShares());
        return m;
    }

    /** Releases pledged shares back to the supplied role. */
    public Movement decreaseCollateral(AccountPosition p, AssetRecord a, AssetAmount req) {
        Movement m = resolve(a.getSupplied(), p.collateralShares(a.getAssetId()), req, false);
        AccountPosition.subtract(p.getCollateral(), a.getAssetId(), m.getShares());
        AccountPosition.add(p.getSupplied(), a.getAssetId(), m.getShares());
        return m;
    }

    /** Moves pledged shares of one account straight into another account's supplied role. */
    public Movement seizeCollateral(AccountPosition from, AccountPosition to, AssetRecord a, AssetAmount req) {
        Movement m = resolve(a.getSupplied(), from.collateralShares(a.getAssetId()), req, false);
        AccountPosition.subtract(from.getCollateral(), a.getAssetId(), m.getShares());
        AccountPosition.add(to.getSupplied(), a.getAssetId(), m.getShares());
        return m;
    }

    // ---------------------------- borrowed ----------------------------

    public Movement increaseBorrowed(AccountPosition p, AssetRecord a, BigInteger amount) {
        requirePositive(amount);
        BigInteger shares = a.getBorrowed().amountToShares(amount, true);
        a.getBorrowed().deposit(shares, amount);
        AccountPosition.add(p.getBorrowed(), a.getAssetId(), shares);
        return new Movement(shares, amount);
    }

    /**
     * Repays debt, capped to what is owed and to {@code fundsLimit}. Clearing the whole debt
     * burns every borrowed share of the account.
     */
    public Movement decreaseBorrowed(AccountPosition p, AssetRecord a, BigInteger requested, BigInteger fundsLimit) {
        BigInteger held = p.borrowedShares(a.getAssetId());
        if (held.signum() == 0) {
            throw CoreException.of(ErrorCode.INVALID_REQUEST, "%s owes nothing in %s", p.getAccountId(), a.getAssetId());
        }
        Pool pool = a.getBorrowed();
        BigInteger owed = pool.sharesToAmount(held, true);
        BigInteger amount = requested == null ? owed : requested.min(owed);
        amount = amount.min(fundsLimit);
        if (amount.signum() <= 0) {
            throw CoreException.of(ErrorCode.INSUFFICIENT_BALANCE, "no funds to repay %s", a.getAssetId());
        }
        BigInteger shares = amount.equals(owed) ? held : pool.amountToShares(amount, false);
        pool.withdraw(shares, amount);
        AccountPosition.subtract(p.getBorrowed(), a.getAssetId(), shares);
        return new Movement(shares, amount);
    }

    // ---------------------------- helpers ----------------------------

    public static BigInteger suppliedAmount(AccountPosition p, AssetRecord a) {
        return a.getSupplied().sharesToAmount(p.suppliedShares(a.getAssetId()), false);
    }

    public static BigInteger collateralAmount(AccountPosition p, AssetRecord a) {
        return a.getSupplied().sharesToAmount(p.collateralShares(a.getAssetId()), false);
    }

    public static BigInteger borrowedAmount(AccountPosition p, AssetRecord a) {
        return a.getBorrowed().sharesToAmount(p.borrowedShares(a.getAssetId()), true);
    }

    /**
     * Turns a request into shares of {@code pool} taken from {@code available} shares.
     * An explicit amount must be covered; no amount takes everything, bounded by maxAmount.
     */
    static Movement resolve(Pool pool, BigInteger available, AssetAmount req, boolean inverseRounding) {
        BigInteger shares;
        BigInteger amount;
        if (req.getAmount() != null) {
            requirePositive(req.getAmount());
            amount = req.getAmount();
            shares = pool.amountToShares(amount, !inverseRounding);
        } else if (req.getMaxAmount() != null) {
            requirePositive(req.getMaxAmount());
            shares = available.min(pool.amountToShares(req.getMaxAmount(), !inverseRounding));
            amount = pool.sharesToAmount(shares, inverseRounding).min(req.getMaxAmount());
        } else {
            shares = available;
            amount = pool.sharesToAmount(shares, inverseRounding);
        }
        if (shares.compareTo(available) > 0) {
            throw CoreException.of(ErrorCode.INSUFFICIENT_BALANCE,
                    "not enough %s: requested %s shares, holding %s", req.getAssetId(), shares, available);
        }
        if (shares.signum() == 0) {
            throw CoreException.of(ErrorCode.INSUFFICIENT_BALANCE, "nothing to move for %s", req.getAssetId());
        }
        return new Movement(shares, amount);
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new CoreException(ErrorCode.INVALID_REQUEST, "amount must be positive");
        }
    }
}
