package com.stablecore.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Time-series snapshot of one market asset: rates, utilization and pool totals,
 * sampled on the snapshot cron.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("asset_rate_snapshots")
public class AssetRateSnapshot {

    @Id
    private String id;

    @Indexed
    private String assetId;

    /** UTC timestamp of when the snapshot was taken. */
    @Indexed
    private Instant ts;

    /** Annual rates as plain decimal strings, e.g. "0.0249". */
    private String borrowApr;
    private String supplyApr;
    private String utilization;

    private String suppliedBalance;
    private String borrowedBalance;
    private String reserved;

    private boolean enabled;
}
