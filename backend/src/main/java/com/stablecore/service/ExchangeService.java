package com.stablecore.service;

import com.stablecore.auth.AuthContext;
import com.stablecore.auth.Role;
import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.exchange.CommissionBook;
import com.stablecore.exchange.ExchangeQuote;
import com.stablecore.exchange.ExchangeQuoteEngine;
import com.stablecore.exchange.ExchangeResult;
import com.stablecore.exchange.ExpectedRate;
import com.stablecore.exchange.SpreadCalculator;
import com.stablecore.exchange.SpreadConfig;
import com.stablecore.ledger.TokenLedger;
import com.stablecore.model.PendingAction;
import com.stablecore.model.PendingActionType;
import com.stablecore.oracle.OraclePriceAdapter;
import com.stablecore.oracle.PriceQuote;
import com.stablecore.util.AccountIdUtil;
import com.stablecore.web3.TransferGateway;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Mint and redeem of the stable asset against the native coin.
 *
 * <pre>
 *   buy:  native deposit claimed from the venue -> oracle -> core: price, slippage, mint
 *         any failure after the claim           -> claimed native refunded (DEPOSIT_REFUND marker)
 *   sell: oracle -> core: price, slippage, burn, EXCHANGE_SELL marker -> native payout
 *         payout failed        -> burned stable and commission restored
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExchangeService {

    private final ExchangeQuoteEngine engine;
    private final SpreadCalculator spread;
    private final CommissionBook commission;
    private final TokenLedger tokens;
    private final OraclePriceAdapter oracle;
    private final TransferGateway gateway;
    private final DepositIntake intake;
    private final SagaCoordinator saga;
    private final LedgerEventPublisher events;
    private final CoreExecutor executor;
    private final AppProps props;
    private final Clock clock;

    private static final class Pending {
        final ExchangeQuote quote;
        final PendingAction marker;

        Pending(ExchangeQuote quote, PendingAction marker) {
            this.quote = quote;
            this.marker = marker;
        }
    }

    @PostConstruct
    void registerSagaHandlers() {
        saga.register(PendingActionType.EXCHANGE_SELL, new SagaCoordinator.Handler() {
            @Override
            public void complete(PendingAction action) {
                log.info("[exchange] paid {} native to {}", action.getAmount(), action.getAccountId());
            }

            @Override
            public void compensate(PendingAction action) {
                restoreSell(action);
            }
        });
    }

    // ---------------------------- buy ----------------------------

    /** Exchanges the native coin of a venue deposit, identified by its receipt, for stable. */
    public CompletableFuture<ExchangeResult> buy(AuthContext caller, String receiptId,
                                                 ExpectedRate expected, String recipient) {
        String payer = caller.getAccountId();
        String nativeId = nativeId();
        return intake.receive(receiptId, payer, nativeId, receipt -> oracle.fetch(List.of(nativeId))
                .thenCompose(prices -> executor.submit(() ->
                        applyBuy(payer, receiver(payer, recipient), receipt.getAmount(), expected, prices.require(nativeId)))));
    }

    ExchangeResult applyBuy(String payer, String receiver, BigInteger nativeAmount, ExpectedRate expected, PriceQuote rate) {
        long now = clock.millis();
        String nativeId = nativeId();
        ExchangeQuote q = engine.quoteBuy(nativeAmount, rate.getMultiplier(), rate.getDecimals(),
                spread.spreadPpm(now), commission.rates(nativeId).getDepositPpm());
        if (expected != null) engine.checkSlippage(rate.getMultiplier(), rate.getDecimals(), expected);

        tokens.credit(receiver, q.getAmountOut());
        commission.collect(nativeId, q.getCommission());
        spread.recordTrade(engine.notional(q.getGross()), now);

        events.publish("buy", LedgerEventPublisher.data(
                "account_id", payer, "receiver_id", receiver, "native_amount", nativeAmount,
                "stable_amount", q.getAmountOut(), "spread_ppm", q.getSpreadPpm(), "commission", q.getCommission()));
        events.publish("mint", LedgerEventPublisher.data("owner_id", receiver, "amount", q.getAmountOut()));
        log.info("[exchange] {} bought {} stable for {} native (spread {}ppm)", payer, q.getAmountOut(), nativeAmount, q.getSpreadPpm());
        return ExchangeResult.of(receiver, q, null);
    }

    // ---------------------------- sell ----------------------------

    public CompletableFuture<ExchangeResult> sell(AuthContext caller, BigInteger stableAmount, ExpectedRate expected) {
        if (stableAmount == null || stableAmount.signum() <= 0) {
            return CompletableFuture.failedFuture(new CoreException(ErrorCode.INVALID_REQUEST, "stable amount must be positive"));
        }
        String accountId = caller.getAccountId();
        return oracle.fetch(List.of(nativeId()))
                .thenCompose(prices -> executor.submit(() -> applySell(accountId, stableAmount, expected, prices.require(nativeId()))))
                .thenCompose(p -> saga.await(p.marker, () -> gateway.transfer(nativeId(), accountId, p.quote.getAmountOut()))
                        .thenApply(m -> ExchangeResult.of(accountId, p.quote, m.getId())));
    }

    private Pending applySell(String accountId, BigInteger stableAmount, ExpectedRate expected, PriceQuote rate) {
        long now = clock.millis();
        String nativeId = nativeId();
        ExchangeQuote q = engine.quoteSell(stableAmount, rate.getMultiplier(), rate.getDecimals(),
                spread.spreadPpm(now), commission.rates(nativeId).getWithdrawPpm());
        if (expected != null) engine.checkSlippage(rate.getMultiplier(), rate.getDecimals(), expected);

        tokens.debit(accountId, stableAmount);
        commission.collect(nativeId, q.getCommission());
        spread.recordTrade(engine.notional(stableAmount), now);

        Map<String, String> details = new LinkedHashMap<>();
        details.put("stable_amount", stableAmount.toString());
        details.put("commission", q.getCommission().toString());
        PendingAction marker = saga.open(PendingActionType.EXCHANGE_SELL, accountId, nativeId, q.getAmountOut(), details);

        events.publish("sell", LedgerEventPublisher.data(
                "account_id", accountId, "stable_amount", stableAmount, "native_amount", q.getAmountOut(),
                "spread_ppm", q.getSpreadPpm(), "commission", q.getCommission()));
        events.publish("burn", LedgerEventPublisher.data("owner_id", accountId, "amount", stableAmount));
        return new Pending(q, marker);
    }

    /** Compensation of a failed native payout. The spread accumulator keeps the trade. */
    private void restoreSell(PendingAction action) {
        BigInteger stableAmount = new BigInteger(action.getDetails().get("stable_amount"));
        BigInteger fee = new BigInteger(action.getDetails().getOrDefault("commission", "0"));
        commission.release(action.getAssetId(), fee);
        tokens.credit(action.getAccountId(), stableAmount);
        events.publish("mint", LedgerEventPublisher.data(
                "owner_id", action.getAccountId(), "amount", stableAmount, "memo", "sell payout failed"));
        log.warn("[exchange] payout to {} failed, {} stable restored", action.getAccountId(), stableAmount);
    }

    // ---------------------------- predictions ----------------------------

    /** Same arithmetic as {@link #buy} at an explicit candidate rate; mutates nothing. */
    public CompletableFuture<ExchangeQuote> predictBuy(BigInteger nativeAmount, BigInteger multiplier, int decimals) {
        return executor.submit(() -> engine.quoteBuy(nativeAmount, multiplier, decimals,
                spread.spreadPpm(clock.millis()), commission.rates(nativeId()).getDepositPpm()));
    }

    public CompletableFuture<ExchangeQuote> predictSell(BigInteger stableAmount, BigInteger multiplier, int decimals) {
        return executor.submit(() -> engine.quoteSell(stableAmount, multiplier, decimals,
                spread.spreadPpm(clock.millis()), commission.rates(nativeId()).getWithdrawPpm()));
    }

    public CompletableFuture<Long> spreadPpm() {
        return executor.submit(() -> spread.spreadPpm(clock.millis()));
    }

    // ---------------------------- owner ----------------------------

    /**
     * Owner mint against a native deposit at a chosen collateral ratio (percent). Non-owners are
     * turned away before their deposit is claimed.
     */
    public CompletableFuture<BigInteger> mintByNative(AuthContext caller, String receiptId, int collateralRatio) {
        if (!caller.has(Role.OWNER)) {
            return CompletableFuture.failedFuture(new CoreException(ErrorCode.UNAUTHORIZED, caller.getAccountId() + " lacks role [OWNER]"));
        }
        String owner = caller.getAccountId();
        String nativeId = nativeId();
        return intake.receive(receiptId, owner, nativeId, receipt -> oracle.fetch(List.of(nativeId))
                .thenCompose(prices -> executor.submit(() -> {
                    PriceQuote rate = prices.require(nativeId);
                    BigInteger nativeAmount = receipt.getAmount();
                    BigInteger amount = engine.mintByCollateralRatio(nativeAmount, rate.getMultiplier(), rate.getDecimals(), collateralRatio);
                    tokens.credit(owner, amount);
                    events.publish("mint", LedgerEventPublisher.data(
                            "owner_id", owner, "amount", amount, "memo", "collateral ratio " + collateralRatio + "%"));
                    log.info("[exchange] owner minted {} stable for {} native at {}%", amount, nativeAmount, collateralRatio);
                    return amount;
                })));
    }

    public CompletableFuture<Void> transferCommission(AuthContext caller, String assetId, String receiver, BigInteger amount) {
        return executor.run(() -> {
            caller.requireAny(Role.OWNER);
            CoreException.require(amount != null && amount.signum() > 0, "amount must be positive");
            String to = AccountIdUtil.normalize(receiver);
            commission.release(assetId, amount);
            tokens.credit(to, amount);
            events.publish("mint", LedgerEventPublisher.data("owner_id", to, "amount", amount, "memo", "commission of " + assetId));
        });
    }

    public CompletableFuture<Void> setSpread(AuthContext caller, SpreadConfig next) {
        return executor.run(() -> spread.configure(caller, next));
    }

    public CompletableFuture<Void> setCommission(AuthContext caller, String assetId, long depositPpm, long withdrawPpm) {
        return executor.run(() -> commission.setRates(caller, assetId, depositPpm, withdrawPpm));
    }

    public CompletableFuture<Map<String, BigInteger>> collectedCommission() {
        return executor.submit(commission::collectedAll);
    }

    // ---------------------------- helpers ----------------------------

    private String receiver(String payer, String recipient) {
        return recipient == null || recipient.isBlank() ? payer : AccountIdUtil.normalize(recipient);
    }

    private String nativeId() {
        return props.getExchange().getNativeAssetId();
    }
}
