package com.stablecore.oracle;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Validated quotes fetched within one logical operation. Every value computed
 * by that operation reads from the same instance.
 */
public final class Prices {

    private final Map<String, PriceQuote> quotes;

    public Prices(Map<String, PriceQuote> quotes) {
        this.quotes = Collections.unmodifiableMap(quotes);
    }

    public PriceQuote require(String assetId) {
        PriceQuote q = quotes.get(assetId);
        if (q == null) throw new CoreException(ErrorCode.UNKNOWN_ASSET, "no price for asset " + assetId);
        return q;
    }

    public BigDecimal value(String assetId, BigInteger balance) {
        return require(assetId).value(balance);
    }

    public boolean covers(Set<String> assetIds) {
        return quotes.keySet().containsAll(assetIds);
    }

    public Set<String> assetIds() {
        return quotes.keySet();
    }
}
