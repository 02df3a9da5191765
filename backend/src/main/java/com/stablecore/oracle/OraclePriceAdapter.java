package com.stablecore.oracle;

import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches quotes from the {@link PriceOracle} and rejects anything unusable.
 * <ul>
 *   <li>quote older than the recency window, or dated in the future: STALE_PRICE</li>
 *   <li>requested asset missing from the batch: UNKNOWN_ASSET</li>
 *   <li>decimals above 77: INVALID_REQUEST</li>
 * </ul>
 * The stable asset never goes to the oracle; it is priced at its configured peg.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OraclePriceAdapter {

    private final PriceOracle oracle;
    private final AppProps props;
    private final Clock clock;

    public CompletableFuture<Prices> fetch(Collection<String> assetIds) {
        String stableId = props.getMarket().getStableAssetId();
        Set<String> external = new LinkedHashSet<>(assetIds);
        external.remove(stableId);
        if (external.isEmpty()) {
            return CompletableFuture.completedFuture(validate(List.of(), assetIds));
        }
        CompletableFuture<List<PriceQuote>> raw;
        try {
            raw = oracle.fetch(external);
        } catch (RuntimeException e) {
            raw = CompletableFuture.failedFuture(e);
        }
        return raw.handle((quotes, err) -> {
            if (err != null) {
                log.warn("[oracle] fetch failed for {}: {}", external, err.toString());
                throw CoreException.unwrap(err);
            }
            return validate(quotes, assetIds);
        });
    }

    public Prices validate(List<PriceQuote> quotes, Collection<String> requested) {
        Instant now = clock.instant();
        Duration window = Duration.ofSeconds(props.getOracle().getRecencyWindowSec());
        Map<String, PriceQuote> out = new LinkedHashMap<>();
        for (PriceQuote q : quotes) {
            if (q.getDecimals() < 0 || q.getDecimals() > PriceQuote.MAX_DECIMALS) {
                throw CoreException.of(ErrorCode.INVALID_REQUEST,
                        "quote for %s has invalid decimals %d", q.getAssetId(), q.getDecimals());
            }
            if (q.getMultiplier() == null || q.getMultiplier().signum() <= 0) {
                throw CoreException.of(ErrorCode.INVALID_REQUEST, "quote for %s has no multiplier", q.getAssetId());
            }
            if (q.getObservedAt().isAfter(now)) {
                throw CoreException.of(ErrorCode.STALE_PRICE,
                        "quote for %s is dated in the future (%s > %s)", q.getAssetId(), q.getObservedAt(), now);
            }
            if (!now.isBefore(q.getObservedAt().plus(window))) {
                throw CoreException.of(ErrorCode.STALE_PRICE,
                        "quote for %s observed at %s is older than %ss", q.getAssetId(), q.getObservedAt(), window.getSeconds());
            }
            out.put(q.getAssetId(), q);
        }
        String stableId = props.getMarket().getStableAssetId();
        out.put(stableId, stableQuote(stableId, now));
        for (String id : requested) {
            if (!out.containsKey(id)) {
                throw new CoreException(ErrorCode.UNKNOWN_ASSET, "oracle has no price for asset " + id);
            }
        }
        return new Prices(out);
    }

    private PriceQuote stableQuote(String stableId, Instant now) {
        return PriceQuote.builder()
                .assetId(stableId)
                .multiplier(new BigInteger(props.getOracle().getStableMultiplier()))
                .decimals(props.getOracle().getStableDecimals())
                .observedAt(now)
                .build();
    }
}
