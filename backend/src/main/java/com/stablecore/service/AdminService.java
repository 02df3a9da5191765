package com.stablecore.service;

import com.stablecore.auth.AuthContext;
import com.stablecore.auth.Role;
import com.stablecore.market.AssetConfig;
import com.stablecore.market.AssetRegistry;
import com.stablecore.market.AssetView;
import com.stablecore.model.PendingAction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Owner operations on the money market and the saga markers, run on the core thread. */
@Service
@RequiredArgsConstructor
public class AdminService {

    private final AssetRegistry registry;
    private final SagaCoordinator saga;
    private final CoreExecutor executor;

    public CompletableFuture<AssetView> registerAsset(AuthContext caller, String assetId, int decimals, AssetConfig config) {
        return executor.submit(() -> AssetView.of(registry.register(caller, assetId, decimals, config)));
    }

    public CompletableFuture<AssetView> updateAssetConfig(AuthContext caller, String assetId, AssetConfig config) {
        return executor.submit(() -> {
            registry.updateConfig(caller, assetId, config);
            return AssetView.of(registry.get(assetId));
        });
    }

    public CompletableFuture<Void> setAssetEnabled(AuthContext caller, String assetId, boolean enabled) {
        return executor.run(() -> registry.setEnabled(caller, assetId, enabled));
    }

    public CompletableFuture<List<PendingAction>> pendingActions(AuthContext caller) {
        return executor.submit(() -> {
            caller.requireAny(Role.OWNER, Role.GUARDIAN);
            return saga.needingRecovery();
        });
    }

    public CompletableFuture<PendingAction> resolvePendingAction(AuthContext caller, String id, boolean recompensate) {
        return executor.submit(() -> saga.resolve(caller, id, recompensate));
    }
}
