package com.stablecore.market;

import lombok.Data;

import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-account share balances by role. Supplied and collateral shares are both shares of the
 * asset's supplied pool; borrowed shares belong to its borrowed pool. Zero entries are removed.
 */
@Data
public class AccountPosition {
    private String accountId;
    private Map<String, BigInteger> supplied = new TreeMap<>();
    private Map<String, BigInteger> collateral = new TreeMap<>();
    private Map<String, BigInteger> borrowed = new TreeMap<>();

    public AccountPosition(String accountId) {
        this.accountId = accountId;
    }

    public BigInteger suppliedShares(String assetId) {
        return supplied.getOrDefault(assetId, BigInteger.ZERO);
    }

    public BigInteger collateralShares(String assetId) {
        return collateral.getOrDefault(assetId, BigInteger.ZERO);
    }

    public BigInteger borrowedShares(String assetId) {
        return borrowed.getOrDefault(assetId, BigInteger.ZERO);
    }

    static void add(Map<String, BigInteger> role, String assetId, BigInteger shares) {
        if (shares.signum() == 0) return;
        role.merge(assetId, shares, BigInteger::add);
    }

    static void subtract(Map<String, BigInteger> role, String assetId, BigInteger shares) {
        BigInteger left = role.getOrDefault(assetId, BigInteger.ZERO).subtract(shares);
        if (left.signum() < 0) throw new IllegalStateException("negative shares for " + assetId);
        if (left.signum() == 0) role.remove(assetId);
        else role.put(assetId, left);
    }

    /** Distinct assets across all three roles. */
    public Set<String> assetIds() {
        Set<String> ids = new LinkedHashSet<>(supplied.keySet());
        ids.addAll(collateral.keySet());
        ids.addAll(borrowed.keySet());
        return ids;
    }

    public boolean isEmpty() {
        return supplied.isEmpty() && collateral.isEmpty() && borrowed.isEmpty();
    }

    public AccountPosition copy() {
        AccountPosition c = new AccountPosition(accountId);
        c.supplied.putAll(supplied);
        c.collateral.putAll(collateral);
        c.borrowed.putAll(borrowed);
        return c;
    }
}
