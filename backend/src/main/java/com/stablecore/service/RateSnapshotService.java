package com.stablecore.service;

import com.stablecore.market.AssetView;
import com.stablecore.model.AssetRateSnapshot;
import com.stablecore.repo.AssetRateSnapshotRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Samples every registered asset's rates and pool totals and stores one snapshot row per asset.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RateSnapshotService {

    private final MarketService market;
    private final AssetRateSnapshotRepo snapshotRepo;
    private final Clock clock;

    /** Reads the accrued asset views on the core thread, then saves them off it. */
    public CompletableFuture<List<AssetRateSnapshot>> poll() {
        return market.assets().thenApply(this::store);
    }

    private List<AssetRateSnapshot> store(List<AssetView> assets) {
        Instant ts = clock.instant();
        List<AssetRateSnapshot> batch = new ArrayList<>(assets.size());
        for (AssetView a : assets) {
            batch.add(AssetRateSnapshot.builder()
                    .assetId(a.getAssetId())
                    .ts(ts)
                    .borrowApr(a.getBorrowApr())
                    .supplyApr(a.getSupplyApr())
                    .utilization(a.getUtilization())
                    .suppliedBalance(a.getSuppliedBalance())
                    .borrowedBalance(a.getBorrowedBalance())
                    .reserved(a.getReserved())
                    .enabled(a.isEnabled())
                    .build());
        }
        if (batch.isEmpty()) return batch;
        try {
            List<AssetRateSnapshot> saved = snapshotRepo.saveAll(batch);
            log.info("[snapshots] stored {} asset snapshots at {}", saved.size(), ts);
            return saved;
        } catch (DataAccessException e) {
            log.error("[snapshots] failed to store {} snapshots: {}", batch.size(), e.getMessage());
            throw e;
        }
    }

    public AssetRateSnapshot latest(String assetId) {
        return snapshotRepo.findTopByAssetIdOrderByTsDesc(assetId);
    }

    public List<AssetRateSnapshot> range(String assetId, Instant from, Instant to) {
        return snapshotRepo.findByAssetIdAndTsBetweenOrderByTsAsc(assetId, from, to);
    }
}
