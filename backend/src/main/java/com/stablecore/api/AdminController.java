package com.stablecore.api;

import com.stablecore.api.dto.*;
import com.stablecore.auth.AuthContext;
import com.stablecore.auth.AuthContextResolver;
import com.stablecore.market.AssetView;
import com.stablecore.model.PendingAction;
import com.stablecore.service.AdminService;
import com.stablecore.service.ExchangeService;
import com.stablecore.service.TreasuryService;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Owner configuration surface. Every call resolves the caller from its bearer token and
 * its roles from the roster; the services reject callers without the role.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AdminService admin;
    private final ExchangeService exchange;
    private final TreasuryService treasury;
    private final AuthContextResolver auth;

    @PutMapping("/spread")
    public void setSpread(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization,
                          @Validated @RequestBody SpreadRequest req) {
        AuthContext ctx = auth.resolve(authorization);
        exchange.setSpread(ctx, req.toConfig()).join();
    }

    @PutMapping("/commission/{asset}")
    public void setCommission(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization,
                              @PathVariable String asset,
                              @Validated @RequestBody CommissionRequest req) {
        exchange.setCommission(auth.resolve(authorization), asset, req.getDepositPpm(), req.getWithdrawPpm()).join();
    }

    @GetMapping("/commission")
    public Map<String, BigInteger> collectedCommission() {
        return exchange.collectedCommission().join();
    }

    @PostMapping("/commission/transfer")
    public void transferCommission(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization,
                                   @Validated @RequestBody CommissionTransferRequest req) {
        exchange.transferCommission(auth.resolve(authorization), req.getAssetId(), req.getAccountId(), req.getAmount()).join();
    }

    @PostMapping("/assets")
    public AssetView registerAsset(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization,
                                   @Validated @RequestBody AssetRequest req) {
        return admin.registerAsset(auth.resolve(authorization), req.getAssetId(), req.getDecimals(), req.toConfig()).join();
    }

    @PutMapping("/assets/{id}/config")
    public AssetView updateAssetConfig(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization,
                                       @PathVariable String id,
                                       @Validated @RequestBody AssetRequest req) {
        return admin.updateAssetConfig(auth.resolve(authorization), id, req.toConfig()).join();
    }

    @PostMapping("/assets/{id}/enable")
    public void enableAsset(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization, @PathVariable String id) {
        admin.setAssetEnabled(auth.resolve(authorization), id, true).join();
    }

    @PostMapping("/assets/{id}/disable")
    public void disableAsset(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization, @PathVariable String id) {
        admin.setAssetEnabled(auth.resolve(authorization), id, false).join();
    }

    @PostMapping("/treasury/tokens")
    public void addTreasuryToken(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization,
                                 @Validated @RequestBody TreasuryTokenRequest req) {
        treasury.addToken(auth.resolve(authorization), req.getTokenId(), req.getDecimals()).join();
    }

    @PostMapping("/treasury/tokens/{id}/enable")
    public void enableTreasuryToken(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization, @PathVariable String id) {
        treasury.setTokenEnabled(auth.resolve(authorization), id, true).join();
    }

    @PostMapping("/treasury/tokens/{id}/disable")
    public void disableTreasuryToken(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization, @PathVariable String id) {
        treasury.setTokenEnabled(auth.resolve(authorization), id, false).join();
    }

    @PostMapping("/mint-by-native")
    public Map<String, String> mintByNative(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization,
                                            @Validated @RequestBody MintByNativeRequest req) {
        BigInteger minted = exchange.mintByNative(auth.resolve(authorization), req.getReceiptId(), req.getCollateralRatio()).join();
        return Map.of("amount", minted.toString());
    }

    @GetMapping("/pending-actions")
    public List<PendingAction> pendingActions(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization) {
        return admin.pendingActions(auth.resolve(authorization)).join();
    }

    /** Closes a NEEDS_RECOVERY marker; {@code recompensate} runs its compensation once more first. */
    @PostMapping("/pending-actions/{id}/resolve")
    public PendingAction resolve(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization,
                                 @PathVariable String id,
                                 @RequestParam(defaultValue = "false") boolean recompensate) {
        return admin.resolvePendingAction(auth.resolve(authorization), id, recompensate).join();
    }
}
