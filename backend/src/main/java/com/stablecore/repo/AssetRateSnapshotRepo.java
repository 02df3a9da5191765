package com.stablecore.repo;

import com.stablecore.model.AssetRateSnapshot;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface AssetRateSnapshotRepo extends MongoRepository<AssetRateSnapshot, String> {
    List<AssetRateSnapshot> findByAssetIdAndTsBetweenOrderByTsAsc(String assetId, Instant from, Instant to);

    AssetRateSnapshot findTopByAssetIdOrderByTsDesc(String assetId);
}
