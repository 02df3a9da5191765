package com.stablecore.api;

import com.stablecore.api.dto.BuyRequest;
import com.stablecore.api.dto.SellRequest;
import com.stablecore.auth.AuthContextResolver;
import com.stablecore.exchange.ExchangeQuote;
import com.stablecore.exchange.ExchangeResult;
import com.stablecore.exchange.ExpectedRate;
import com.stablecore.service.ExchangeService;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.Map;

/**
 * Mint and redeem of the stable asset against native coin.
 * Example:
 *   POST /api/v1/exchange/buy   {"receiptId":"dep-7f3a"}
 *   GET  /api/v1/exchange/predict-buy?amount=...&multiplier=111439&decimals=28
 */
@RestController
@RequestMapping("/api/v1/exchange")
@RequiredArgsConstructor
public class ExchangeController {

    private final ExchangeService service;
    private final AuthContextResolver auth;

    @PostMapping("/buy")
    public ExchangeResult buy(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization,
                              @Validated @RequestBody BuyRequest req) {
        ExpectedRate expected = req.getExpected() == null ? null : req.getExpected().toExpectedRate();
        return service.buy(auth.resolve(authorization), req.getReceiptId(), expected, req.getRecipient()).join();
    }

    @PostMapping("/sell")
    public ExchangeResult sell(@RequestHeader(name = AuthContextResolver.HEADER, required = false) String authorization,
                               @Validated @RequestBody SellRequest req) {
        ExpectedRate expected = req.getExpected() == null ? null : req.getExpected().toExpectedRate();
        return service.sell(auth.resolve(authorization), req.getStableAmount(), expected).join();
    }

    @GetMapping("/predict-buy")
    public ExchangeQuote predictBuy(@RequestParam BigInteger amount,
                                    @RequestParam BigInteger multiplier,
                                    @RequestParam int decimals) {
        return service.predictBuy(amount, multiplier, decimals).join();
    }

    @GetMapping("/predict-sell")
    public ExchangeQuote predictSell(@RequestParam BigInteger amount,
                                     @RequestParam BigInteger multiplier,
                                     @RequestParam int decimals) {
        return service.predictSell(amount, multiplier, decimals).join();
    }

    @GetMapping("/spread")
    public Map<String, Long> spread() {
        return Map.of("spreadPpm", service.spreadPpm().join());
    }
}
