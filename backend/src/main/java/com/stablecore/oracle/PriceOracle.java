package com.stablecore.oracle;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * External price source. One call returns quotes for a batch of assets; assets the
 * source does not know are simply absent from the result.
 */
public interface PriceOracle {
    CompletableFuture<List<PriceQuote>> fetch(Collection<String> assetIds);
}
