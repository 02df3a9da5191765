package com.stablecore.api;

import com.stablecore.model.AssetRateSnapshot;
import com.stablecore.service.RateSnapshotService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Read endpoints over the stored asset rate snapshots (time series).
 */
@RestController
@RequestMapping("/api/v1/asset-snapshots")
@RequiredArgsConstructor
public class AssetSnapshotController {

    private final RateSnapshotService service;

    /** Latest snapshot of one asset. */
    @GetMapping("/latest")
    public AssetRateSnapshot latest(@RequestParam String asset) {
        return service.latest(asset);
    }

    /** Time range for one asset (inclusive). ISO-8601 instants. */
    @GetMapping
    public List<AssetRateSnapshot> range(
            @RequestParam String asset,
            @RequestParam Instant from,
            @RequestParam Instant to
    ) {
        return service.range(asset, from, to);
    }

    @PostMapping("/poll")
    public List<AssetRateSnapshot> poll() {
        return service.poll().join();
    }
}
