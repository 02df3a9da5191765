package com.stablecore.market;

import com.stablecore.auth.AuthContext;
import com.stablecore.auth.Role;
import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Accepted assets keyed by id, plus the registration-order index. Records are only ever
 * enabled or disabled, never removed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssetRegistry {

    private final AppProps props;
    private final InterestAccrualEngine accrual;
    private final Clock clock;

    private final Map<String, AssetRecord> assets = new ConcurrentHashMap<>();
    private final List<String> index = new CopyOnWriteArrayList<>();

    @PostConstruct
    void bootstrap() {
        String stableId = props.getMarket().getStableAssetId();
        for (AppProps.AssetDef def : props.getMarket().getAssets()) {
            AssetRecord r = insert(def.getId(), def.getDecimals(), def.getId().equals(stableId), toConfig(def));
            r.setEnabled(def.isEnabled());
        }
        log.info("[market] {} assets registered: {}", index.size(), index);
    }

    public AssetRecord register(AuthContext auth, String assetId, int decimals, AssetConfig config) {
        auth.requireAny(Role.OWNER);
        return insert(assetId, decimals, assetId.equals(props.getMarket().getStableAssetId()), config).copy();
    }

    private AssetRecord insert(String assetId, int decimals, boolean stable, AssetConfig config) {
        if (assetId == null || assetId.isBlank()) {
            throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "asset id is required");
        }
        if (decimals <= 0 || decimals > 37) {
            throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "decimals out of bounds: " + decimals);
        }
        config.validate();
        if (assets.containsKey(assetId)) {
            throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "asset " + assetId + " is already registered");
        }
        AssetRecord r = new AssetRecord();
        r.setAssetId(assetId);
        r.setDecimals(decimals);
        r.setStable(stable);
        r.setEnabled(true);
        r.setConfig(config);
        r.setLastAccrualMs(clock.millis());
        assets.put(assetId, r);
        index.add(assetId);
        log.info("[market] registered asset={} decimals={} stable={}", assetId, decimals, stable);
        return r;
    }

    /** Accrues under the old curve up to now, then swaps the config. */
    public void updateConfig(AuthContext auth, String assetId, AssetConfig config) {
        auth.requireAny(Role.OWNER);
        config.validate();
        AssetRecord r = get(assetId);
        accrual.accrue(r, clock.millis());
        r.setConfig(config);
        commit(r);
        log.info("[market] config updated for asset={}", assetId);
    }

    public void setEnabled(AuthContext auth, String assetId, boolean enabled) {
        auth.requireAny(Role.OWNER);
        AssetRecord r = get(assetId);
        if (r.isEnabled() == enabled) {
            throw CoreException.of(ErrorCode.INVALID_CONFIGURATION,
                    "asset %s is already %s", assetId, enabled ? "enabled" : "disabled");
        }
        r.setEnabled(enabled);
        commit(r);
        log.info("[market] asset={} enabled={}", assetId, enabled);
    }

    /** Detached copy of the committed record. */
    public AssetRecord get(String assetId) {
        AssetRecord r = assets.get(assetId);
        if (r == null) throw new CoreException(ErrorCode.UNKNOWN_ASSET, "unknown asset " + assetId);
        return r.copy();
    }

    public List<String> ids() {
        return List.copyOf(index);
    }

    public String stableAssetId() {
        return props.getMarket().getStableAssetId();
    }

    void commit(AssetRecord record) {
        if (!assets.containsKey(record.getAssetId())) {
            throw new IllegalStateException("commit of unregistered asset " + record.getAssetId());
        }
        assets.put(record.getAssetId(), record.copy());
    }

    public static AssetConfig toConfig(AppProps.AssetDef def) {
        return AssetConfig.builder()
                .curve(InterestCurve.builder()
                        .baseRate(def.getBaseRate())
                        .slope1(def.getSlope1())
                        .slope2(def.getSlope2())
                        .kink(def.getKink())
                        .reserveFactor(def.getReserveFactor())
                        .build())
                .collateralFactor(def.getCollateralFactor())
                .canDeposit(def.isCanDeposit())
                .canWithdraw(def.isCanWithdraw())
                .canUseAsCollateral(def.isCanUseAsCollateral())
                .canBorrow(def.isCanBorrow())
                .build();
    }
}
