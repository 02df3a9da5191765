package com.stablecore.api;

import com.stablecore.api.dto.TreasuryDepositRequest;
import com.stablecore.api.dto.TreasuryRequest;
import com.stablecore.auth.AuthContextResolver;
import com.stablecore.exchange.StableTreasury;
import com.stablecore.service.TreasuryService;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/treasury")
@RequiredArgsConstructor
public class TreasuryController {

    private final TreasuryService service;
    private final AuthContextResolver auth;

    @PostMapping("/deposit")
    public TreasuryService.Result deposit(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization,
                                          @Validated @RequestBody TreasuryDepositRequest req) {
        return service.deposit(auth.resolve(authorization), req.getReceiptId()).join();
    }

    @PostMapping("/withdraw")
    public TreasuryService.Result withdraw(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization,
                                           @Validated @RequestBody TreasuryRequest req) {
        return service.withdraw(auth.resolve(authorization), req.getTokenId(), req.getAmount()).join();
    }

    /** Accepted tokens with status and held balance. */
    @GetMapping
    public List<StableTreasury.Token> tokens() {
        return service.tokens().join();
    }
}
