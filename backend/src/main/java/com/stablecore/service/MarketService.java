package com.stablecore.service;

import com.stablecore.auth.AuthContext;
import com.stablecore.auth.Role;
import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.ledger.TokenLedger;
import com.stablecore.market.*;
import com.stablecore.model.PendingAction;
import com.stablecore.model.PendingActionType;
import com.stablecore.oracle.OraclePriceAdapter;
import com.stablecore.oracle.Prices;
import com.stablecore.util.AccountIdUtil;
import com.stablecore.util.FixedPoint;
import com.stablecore.web3.DepositReceipt;
import com.stablecore.web3.TransferGateway;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Entry point of the money market. A batch of actions runs as one transition on the core
 * thread; batches that need prices fetch them first and run in the oracle continuation.
 * SUPPLY credits venue deposits claimed before the batch runs; a batch that fails sends them back.
 * Withdrawals leave through the transfer venue after the batch committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketService {

    private final AssetRegistry registry;
    private final PositionLedger ledger;
    private final InterestAccrualEngine accrual;
    private final HealthEvaluator health;
    private final LiquidationEngine liquidation;
    private final StableBorrowPath stablePath;
    private final TokenLedger tokens;
    private final OraclePriceAdapter oracle;
    private final TransferGateway gateway;
    private final DepositIntake intake;
    private final SagaCoordinator saga;
    private final LedgerEventPublisher events;
    private final CoreExecutor executor;
    private final AppProps props;
    private final Clock clock;

    @PostConstruct
    void registerSagaHandlers() {
        saga.register(PendingActionType.MARKET_WITHDRAW, new SagaCoordinator.Handler() {
            @Override
            public void complete(PendingAction action) {
                events.publish("withdraw_succeeded", LedgerEventPublisher.data(
                        "account_id", action.getAccountId(), "token_id", action.getAssetId(), "amount", action.getAmount()));
            }

            @Override
            public void compensate(PendingAction action) {
                restoreSupplied(action.getAccountId(), action.getAssetId(), new BigInteger(action.getAmount()));
            }
        });
    }

    public CompletableFuture<MarketResult> execute(AuthContext caller, List<Action> actions) {
        if (actions == null || actions.isEmpty()) {
            return CompletableFuture.failedFuture(new CoreException(ErrorCode.INVALID_REQUEST, "no actions"));
        }
        Map<String, String> deposits = new LinkedHashMap<>();
        for (Action a : actions) {
            if (a == null || a.getType() == null) {
                return CompletableFuture.failedFuture(new CoreException(ErrorCode.INVALID_REQUEST, "action type is required"));
            }
            if (a.getType() != Action.Type.SUPPLY) continue;
            if (a.getReceiptId() == null || a.getReceiptId().isBlank()) {
                return CompletableFuture.failedFuture(new CoreException(ErrorCode.INVALID_REQUEST, "SUPPLY needs a deposit receipt"));
            }
            if (a.getAsset() == null || a.getAsset().getAssetId() == null) {
                return CompletableFuture.failedFuture(new CoreException(ErrorCode.INVALID_REQUEST, "SUPPLY needs an asset"));
            }
            if (deposits.put(a.getReceiptId(), a.getAsset().getAssetId()) != null) {
                return CompletableFuture.failedFuture(new CoreException(ErrorCode.INVALID_REQUEST,
                        "deposit " + a.getReceiptId() + " is supplied twice"));
            }
        }
        CompletableFuture<Applied> applied = deposits.isEmpty()
                ? applyBatch(caller, actions, Map.of())
                : intake.receiveAll(deposits, caller.getAccountId(), received -> applyBatch(caller, actions, received));
        return applied.thenCompose(this::sendWithdrawals);
    }

    private CompletableFuture<Applied> applyBatch(AuthContext caller, List<Action> actions, Map<String, DepositReceipt> received) {
        boolean needsPrices = actions.stream().anyMatch(a -> a.getType().needsPrices());
        if (!needsPrices) {
            return executor.submit(() -> apply(caller, actions, null, received));
        }
        return executor.submit(() -> priceIds(caller.getAccountId(), actions))
                .thenCompose(oracle::fetch)
                .thenCompose(prices -> executor.submit(() -> apply(caller, actions, prices, received)));
    }

    private static final class Applied {
        final MarketResult result;
        final List<PendingAction> withdrawals;
        /** Set when a withdrawal marker could not be recorded; the batch reports it after the opened ones are sent. */
        final CoreException markerFailure;

        Applied(MarketResult result, List<PendingAction> withdrawals, CoreException markerFailure) {
            this.result = result;
            this.withdrawals = withdrawals;
            this.markerFailure = markerFailure;
        }
    }

    Applied apply(AuthContext caller, List<Action> actions, Prices prices, Map<String, DepositReceipt> received) {
        String accountId = caller.getAccountId();
        MarketSession s = newSession();
        List<AssetAmount> withdrawals = new ArrayList<>();
        boolean checkHealth = false;

        for (Action action : actions) {
            switch (action.getType()) {
                case SUPPLY -> supply(s, accountId, requireAsset(action), received.get(action.getReceiptId()));
                case WITHDRAW -> {
                    AssetAmount req = requireAsset(action);
                    BigInteger amount = withdraw(s, accountId, req);
                    withdrawals.add(AssetAmount.of(req.getAssetId(), amount));
                }
                case INCREASE_COLLATERAL -> increaseCollateral(s, accountId, requireAsset(action));
                case DECREASE_COLLATERAL -> decreaseCollateral(s, accountId, requireAsset(action));
                case BORROW -> borrow(s, accountId, requireAsset(action));
                case REPAY -> repay(s, accountId, requireAsset(action));
                case BORROW_STABLE -> {
                    AssetAmount req = requireAsset(action);
                    CoreException.require(req.getAmount() != null, "borrow needs an amount");
                    stablePath.borrow(s, accountId, req.getAmount());
                    s.event("borrow", LedgerEventPublisher.data(
                            "account_id", accountId, "token_id", s.stableAssetId(), "amount", req.getAmount()));
                }
                case REPAY_STABLE -> {
                    AssetAmount req = requireAsset(action);
                    BigInteger requested = req.getAmount() != null ? req.getAmount() : req.getMaxAmount();
                    PositionLedger.Movement m = stablePath.repay(s, accountId, accountId, requested);
                    s.event("repay", LedgerEventPublisher.data(
                            "account_id", accountId, "token_id", s.stableAssetId(), "amount", m.getAmount()));
                }
                case LIQUIDATE -> {
                    CoreException.require(action.getAccount() != null, "liquidation needs a target account");
                    liquidation.liquidate(s, accountId, AccountIdUtil.normalize(action.getAccount()),
                            action.getInAssets(), action.getOutAssets(), prices);
                }
                case FORCE_CLOSE -> {
                    caller.requireAny(Role.OWNER, Role.LIQUIDATOR);
                    CoreException.require(action.getAccount() != null, "force close needs a target account");
                    liquidation.forceClose(s, AccountIdUtil.normalize(action.getAccount()), prices);
                }
                default -> throw new CoreException(ErrorCode.INVALID_REQUEST, "unsupported action " + action.getType());
            }
            checkHealth |= action.getType().needsHealthCheck();
        }

        if (checkHealth) {
            health.requireHealthy(s.position(accountId), s::asset, prices);
        }

        List<MarketEvent> committed = s.commit();
        events.publishAll(committed);

        // the batch is committed: every debited withdrawal either gets a marker or goes back to supply
        List<PendingAction> markers = new ArrayList<>();
        CoreException markerFailure = null;
        for (AssetAmount w : withdrawals) {
            if (markerFailure != null) {
                restoreSupplied(accountId, w.getAssetId(), w.getAmount());
                continue;
            }
            try {
                markers.add(saga.open(PendingActionType.MARKET_WITHDRAW, accountId, w.getAssetId(), w.getAmount(), Map.of()));
            } catch (CoreException e) {
                // open() already returned this withdrawal to supply
                markerFailure = e;
            }
        }
        MarketResult result = MarketResult.builder()
                .accountId(accountId)
                .events(committed.stream().map(MarketEvent::getName).collect(Collectors.toList()))
                .pendingActionIds(markers.stream().map(PendingAction::getId).collect(Collectors.toList()))
                .build();
        return new Applied(result, markers, markerFailure);
    }

    private CompletableFuture<MarketResult> sendWithdrawals(Applied applied) {
        CompletableFuture<?>[] transfers = applied.withdrawals.stream()
                .map(m -> saga.await(m, () -> gateway.transfer(m.getAssetId(), m.getAccountId(), new BigInteger(m.getAmount()))))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(transfers).thenApply(v -> {
            if (applied.markerFailure != null) throw applied.markerFailure;
            return applied.result;
        });
    }

    // ---------------------------- actions ----------------------------

    /** Credits exactly the claimed deposit; a stated amount must match it. */
    private void supply(MarketSession s, String accountId, AssetAmount req, DepositReceipt receipt) {
        AssetRecord a = s.asset(req.getAssetId());
        if (a.isStable()) {
            throw new CoreException(ErrorCode.INVALID_REQUEST, "the stable asset can be borrowed but not supplied");
        }
        requireEnabled(a);
        if (!a.getConfig().isCanDeposit()) throw new CoreException(ErrorCode.ASSET_DISABLED, "deposits of " + a.getAssetId() + " are off");
        if (receipt == null) throw new CoreException(ErrorCode.INVALID_REQUEST, "SUPPLY needs a claimed deposit");
        BigInteger amount = receipt.getAmount();
        if (req.getAmount() != null && req.getAmount().compareTo(amount) != 0) {
            throw CoreException.of(ErrorCode.INVALID_REQUEST, "supply of %s does not match deposit %s of %s",
                    req.getAmount(), receipt.getReceiptId(), amount);
        }
        s.ledger().increaseSupplied(s.position(accountId), a, amount);
        s.event("deposit", LedgerEventPublisher.data("account_id", accountId, "token_id", a.getAssetId(), "amount", amount));
    }

    private BigInteger withdraw(MarketSession s, String accountId, AssetAmount req) {
        AssetRecord a = s.asset(req.getAssetId());
        CoreException.require(!a.isStable(), "the stable asset is never held in the supplied role");
        if (!a.getConfig().isCanWithdraw()) throw new CoreException(ErrorCode.ASSET_DISABLED, "withdrawals of " + a.getAssetId() + " are off");
        BigInteger available = a.available();
        PositionLedger.Movement m = s.ledger().decreaseSupplied(s.position(accountId), a, req);
        if (m.getAmount().compareTo(available) > 0) {
            throw CoreException.of(ErrorCode.INSUFFICIENT_BALANCE,
                    "only %s %s is available for withdrawal, requested %s", available, a.getAssetId(), m.getAmount());
        }
        s.event("withdraw_started", LedgerEventPublisher.data("account_id", accountId, "token_id", a.getAssetId(), "amount", m.getAmount()));
        return m.getAmount();
    }

    private void increaseCollateral(MarketSession s, String accountId, AssetAmount req) {
        AssetRecord a = s.asset(req.getAssetId());
        requireEnabled(a);
        if (!a.getConfig().isCanUseAsCollateral()) {
            throw new CoreException(ErrorCode.ASSET_DISABLED, a.getAssetId() + " is not accepted as collateral");
        }
        PositionLedger.Movement m = s.ledger().increaseCollateral(s.position(accountId), a, req);
        s.event("increase_collateral", LedgerEventPublisher.data("account_id", accountId, "token_id", a.getAssetId(), "amount", m.getAmount()));
    }

    private void decreaseCollateral(MarketSession s, String accountId, AssetAmount req) {
        AssetRecord a = s.asset(req.getAssetId());
        PositionLedger.Movement m = s.ledger().decreaseCollateral(s.position(accountId), a, req);
        s.event("decrease_collateral", LedgerEventPublisher.data("account_id", accountId, "token_id", a.getAssetId(), "amount", m.getAmount()));
    }

    private void borrow(MarketSession s, String accountId, AssetAmount req) {
        AssetRecord a = s.asset(req.getAssetId());
        CoreException.require(!a.isStable(), "use BORROW_STABLE for the stable asset");
        requireEnabled(a);
        if (!a.getConfig().isCanBorrow()) throw new CoreException(ErrorCode.ASSET_DISABLED, "borrowing of " + a.getAssetId() + " is off");
        CoreException.require(req.getAmount() != null, "borrow needs an amount");
        if (req.getAmount().compareTo(a.available()) > 0) {
            throw CoreException.of(ErrorCode.INSUFFICIENT_BALANCE,
                    "only %s %s is available to borrow", a.available(), a.getAssetId());
        }
        AccountPosition p = s.position(accountId);
        s.ledger().increaseBorrowed(p, a, req.getAmount());
        s.ledger().increaseSupplied(p, a, req.getAmount());
        s.event("borrow", LedgerEventPublisher.data("account_id", accountId, "token_id", a.getAssetId(), "amount", req.getAmount()));
    }

    private void repay(MarketSession s, String accountId, AssetAmount req) {
        AssetRecord a = s.asset(req.getAssetId());
        CoreException.require(!a.isStable(), "use REPAY_STABLE for the stable asset");
        AccountPosition p = s.position(accountId);
        BigInteger funds = PositionLedger.suppliedAmount(p, a);
        BigInteger requested = req.getAmount() != null ? req.getAmount() : req.getMaxAmount();
        PositionLedger.Movement m = s.ledger().decreaseBorrowed(p, a, requested, funds);
        AssetAmount spend = m.getAmount().equals(funds) ? AssetAmount.all(a.getAssetId()) : AssetAmount.of(a.getAssetId(), m.getAmount());
        s.ledger().decreaseSupplied(p, a, spend);
        s.event("repay", LedgerEventPublisher.data("account_id", accountId, "token_id", a.getAssetId(), "amount", m.getAmount()));
    }

    /** A withdrawal that will not leave: the amount goes back to the supplied role. */
    private void restoreSupplied(String accountId, String assetId, BigInteger amount) {
        MarketSession s = newSession();
        AssetRecord a = s.asset(assetId);
        s.ledger().increaseSupplied(s.position(accountId), a, amount);
        s.event("withdraw_failed", LedgerEventPublisher.data(
                "account_id", accountId, "token_id", assetId, "amount", amount));
        events.publishAll(s.commit());
        log.warn("[market] withdrawal of {} {} for {} returned to supplied", amount, assetId, accountId);
    }

    // ---------------------------- views ----------------------------

    public CompletableFuture<List<AssetView>> assets() {
        return executor.submit(() -> {
            MarketSession s = newSession();
            return registry.ids().stream().map(id -> AssetView.of(s.asset(id))).collect(Collectors.toList());
        });
    }

    public CompletableFuture<AssetView> asset(String assetId) {
        return executor.submit(() -> AssetView.of(newSession().asset(assetId)));
    }

    public CompletableFuture<AccountView> account(String rawAccountId) {
        String accountId = AccountIdUtil.normalize(rawAccountId);
        return executor.submit(() -> {
                    AccountPosition p = ledger.get(accountId);
                    Set<String> ids = new LinkedHashSet<>(p.getCollateral().keySet());
                    ids.addAll(p.getBorrowed().keySet());
                    return ids;
                })
                .thenCompose(ids -> ids.isEmpty()
                        ? CompletableFuture.completedFuture((Prices) null)
                        : oracle.fetch(ids))
                .thenCompose(prices -> executor.submit(() -> view(accountId, prices)));
    }

    private AccountView view(String accountId, Prices prices) {
        MarketSession s = newSession();
        AccountPosition p = s.position(accountId);
        AccountView.AccountViewBuilder b = AccountView.builder()
                .accountId(accountId)
                .supplied(balances(s, p.getSupplied(), false))
                .collateral(balances(s, p.getCollateral(), false))
                .borrowed(balances(s, p.getBorrowed(), true))
                .stableBalance(tokens.balanceOf(accountId).toString())
                .healthy(true);
        if (prices != null && prices.covers(p.getCollateral().keySet()) && prices.covers(p.getBorrowed().keySet())) {
            BigDecimal factor = health.healthFactor(p, s::asset, prices);
            b.borrowingPower(FixedPoint.normalize(health.borrowingPower(p, s::asset, prices)).toPlainString())
                    .debtValue(FixedPoint.normalize(health.debtValue(p, s::asset, prices)).toPlainString())
                    .healthFactor(factor == null ? null : FixedPoint.normalize(factor).toPlainString())
                    .healthy(health.isHealthy(p, s::asset, prices));
        }
        return b.build();
    }

    private static List<AccountView.Balance> balances(MarketSession s, Map<String, BigInteger> role, boolean debt) {
        List<AccountView.Balance> out = new ArrayList<>();
        role.forEach((id, shares) -> {
            AssetRecord a = s.asset(id);
            BigInteger amount = debt ? a.getBorrowed().sharesToAmount(shares, true) : a.getSupplied().sharesToAmount(shares, false);
            out.add(new AccountView.Balance(id, shares.toString(), amount.toString()));
        });
        return out;
    }

    // ---------------------------- helpers ----------------------------

    MarketSession newSession() {
        return new MarketSession(registry, ledger, accrual, tokens, clock.millis(), props.getMarket().getMaxAssetsPerAccount());
    }

    /** Assets whose prices the batch may read: the caller's and any target's positions plus every named asset. */
    private Set<String> priceIds(String accountId, List<Action> actions) {
        Set<String> ids = new LinkedHashSet<>();
        addPositionAssets(ids, accountId);
        for (Action a : actions) {
            if (a.getAsset() != null && a.getAsset().getAssetId() != null) ids.add(a.getAsset().getAssetId());
            if (a.getAccount() != null) addPositionAssets(ids, AccountIdUtil.normalize(a.getAccount()));
            if (a.getInAssets() != null) a.getInAssets().forEach(x -> ids.add(x.getAssetId()));
            if (a.getOutAssets() != null) a.getOutAssets().forEach(x -> ids.add(x.getAssetId()));
        }
        return ids;
    }

    private void addPositionAssets(Set<String> ids, String accountId) {
        AccountPosition p = ledger.get(accountId);
        ids.addAll(p.getCollateral().keySet());
        ids.addAll(p.getBorrowed().keySet());
    }

    private static AssetAmount requireAsset(Action action) {
        if (action.getAsset() == null || action.getAsset().getAssetId() == null) {
            throw new CoreException(ErrorCode.INVALID_REQUEST, action.getType() + " needs an asset");
        }
        return action.getAsset();
    }

    private static void requireEnabled(AssetRecord a) {
        if (!a.isEnabled()) throw new CoreException(ErrorCode.ASSET_DISABLED, "asset " + a.getAssetId() + " is disabled");
    }
}
