package com.stablecore.api;

import com.stablecore.api.dto.ExecuteRequest;
import com.stablecore.auth.AuthContextResolver;
import com.stablecore.market.AccountView;
import com.stablecore.market.AssetView;
import com.stablecore.market.MarketResult;
import com.stablecore.service.MarketService;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Money market actions and views.
 * Example:
 *   POST /api/v1/market/execute
 *   {"actions":[{"type":"INCREASE_COLLATERAL","asset":{"assetId":"native"}},
 *               {"type":"BORROW_STABLE","asset":{"assetId":"stable","amount":"1000000000000000000"}}]}
 */
@RestController
@RequestMapping("/api/v1/market")
@RequiredArgsConstructor
public class MarketController {

    private final MarketService service;
    private final AuthContextResolver auth;

    @PostMapping("/execute")
    public MarketResult execute(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization,
                                @Validated @RequestBody ExecuteRequest req) {
        return service.execute(auth.resolve(authorization), req.getActions()).join();
    }

    @GetMapping("/assets")
    public List<AssetView> assets() {
        return service.assets().join();
    }

    @GetMapping("/assets/{id}")
    public AssetView asset(@PathVariable String id) {
        return service.asset(id).join();
    }

    @GetMapping("/accounts/{id}")
    public AccountView account(@PathVariable String id) {
        return service.account(id).join();
    }
}
