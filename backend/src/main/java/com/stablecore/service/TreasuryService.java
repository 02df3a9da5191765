package com.stablecore.service;

import com.stablecore.auth.AuthContext;
import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.exchange.CommissionBook;
import com.stablecore.exchange.StableTreasury;
import com.stablecore.ledger.TokenLedger;
import com.stablecore.model.PendingAction;
import com.stablecore.model.PendingActionType;
import com.stablecore.util.FixedPoint;
import com.stablecore.web3.TransferGateway;
import jakarta.annotation.PostConstruct;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 1:1 conversion between accepted stable tokens and the stable asset, minus commission.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TreasuryService {

    private final StableTreasury treasury;
    private final CommissionBook commission;
    private final TokenLedger tokens;
    private final TransferGateway gateway;
    private final DepositIntake intake;
    private final SagaCoordinator saga;
    private final LedgerEventPublisher events;
    private final CoreExecutor executor;
    private final AppProps props;

    @Value
    @Builder
    public static class Result {
        String accountId;
        String tokenId;
        String tokenAmount;
        String stableAmount;
        String commission;
        String pendingActionId;
    }

    private static final class Pending {
        final Result result;
        final PendingAction marker;
        final BigInteger tokenAmount;

        Pending(Result result, PendingAction marker, BigInteger tokenAmount) {
            this.result = result;
            this.marker = marker;
            this.tokenAmount = tokenAmount;
        }
    }

    @PostConstruct
    void registerSagaHandlers() {
        saga.register(PendingActionType.TREASURY_WITHDRAW, new SagaCoordinator.Handler() {
            @Override
            public void complete(PendingAction action) {
                events.publish("withdraw_succeeded", LedgerEventPublisher.data(
                        "account_id", action.getAccountId(), "token_id", action.getAssetId(), "amount", action.getAmount()));
            }

            @Override
            public void compensate(PendingAction action) {
                restoreWithdraw(action);
            }
        });
    }

    /**
     * Converts a token deposit claimed from the venue and mints the stable to the depositor.
     * The token is whatever the receipt carries; a token the treasury refuses is sent back.
     */
    public CompletableFuture<Result> deposit(AuthContext caller, String receiptId) {
        String accountId = caller.getAccountId();
        return intake.receive(receiptId, accountId, null, receipt ->
                executor.submit(() -> applyDeposit(accountId, receipt.getAssetId(), receipt.getAmount())));
    }

    Result applyDeposit(String accountId, String tokenId, BigInteger amount) {
        CoreException.require(amount != null && amount.signum() > 0, "amount must be positive");
        StableTreasury.Token token = treasury.requireEnabled(tokenId);
        BigInteger stable = FixedPoint.convertDecimals(amount, token.getDecimals(), stableDecimals());
        BigInteger fee = commission.depositFee(tokenId, stable);
        BigInteger minted = stable.subtract(fee);
        if (minted.signum() <= 0) {
            throw CoreException.of(ErrorCode.BELOW_MINIMUM_EXCHANGE, "%s %s is too little to convert", amount, tokenId);
        }
        treasury.deposit(tokenId, amount);
        tokens.credit(accountId, minted);
        commission.collect(tokenId, fee);

        events.publish("deposit_to_reserve", LedgerEventPublisher.data(
                "account_id", accountId, "token_id", tokenId, "amount", amount, "commission", fee));
        events.publish("mint", LedgerEventPublisher.data("owner_id", accountId, "amount", minted));
        return Result.builder()
                .accountId(accountId)
                .tokenId(tokenId)
                .tokenAmount(amount.toString())
                .stableAmount(minted.toString())
                .commission(fee.toString())
                .build();
    }

    /** Burns stable and sends the converted token amount out through the venue. */
    public CompletableFuture<Result> withdraw(AuthContext caller, String tokenId, BigInteger stableAmount) {
        String accountId = caller.getAccountId();
        return executor.submit(() -> applyWithdraw(accountId, tokenId, stableAmount))
                .thenCompose(p -> saga.await(p.marker, () -> gateway.transfer(tokenId, accountId, p.tokenAmount))
                        .thenApply(m -> p.result));
    }

    private Pending applyWithdraw(String accountId, String tokenId, BigInteger stableAmount) {
        CoreException.require(stableAmount != null && stableAmount.signum() > 0, "amount must be positive");
        StableTreasury.Token token = treasury.requireEnabled(tokenId);
        BigInteger fee = commission.withdrawFee(tokenId, stableAmount);
        BigInteger tokenAmount = FixedPoint.convertDecimals(stableAmount.subtract(fee), stableDecimals(), token.getDecimals());
        if (tokenAmount.signum() <= 0) {
            throw CoreException.of(ErrorCode.BELOW_MINIMUM_EXCHANGE, "%s stable converts to no %s", stableAmount, tokenId);
        }
        BigInteger held = tokens.balanceOf(accountId);
        if (held.compareTo(stableAmount) < 0) {
            throw CoreException.of(ErrorCode.INSUFFICIENT_BALANCE, "%s holds %s stable, needs %s", accountId, held, stableAmount);
        }
        treasury.withdraw(tokenId, tokenAmount);
        tokens.debit(accountId, stableAmount);
        commission.collect(tokenId, fee);

        Map<String, String> details = new LinkedHashMap<>();
        details.put("stable_amount", stableAmount.toString());
        details.put("commission", fee.toString());
        PendingAction marker = saga.open(PendingActionType.TREASURY_WITHDRAW, accountId, tokenId, tokenAmount, details);

        events.publish("burn", LedgerEventPublisher.data("owner_id", accountId, "amount", stableAmount));
        events.publish("withdraw_started", LedgerEventPublisher.data(
                "account_id", accountId, "token_id", tokenId, "amount", tokenAmount, "commission", fee));
        Result result = Result.builder()
                .accountId(accountId)
                .tokenId(tokenId)
                .tokenAmount(tokenAmount.toString())
                .stableAmount(stableAmount.toString())
                .commission(fee.toString())
                .pendingActionId(marker.getId())
                .build();
        return new Pending(result, marker, tokenAmount);
    }

    private void restoreWithdraw(PendingAction action) {
        BigInteger stableAmount = new BigInteger(action.getDetails().get("stable_amount"));
        BigInteger fee = new BigInteger(action.getDetails().getOrDefault("commission", "0"));
        commission.release(action.getAssetId(), fee);
        treasury.deposit(action.getAssetId(), new BigInteger(action.getAmount()));
        tokens.credit(action.getAccountId(), stableAmount);
        events.publish("withdraw_failed", LedgerEventPublisher.data(
                "account_id", action.getAccountId(), "token_id", action.getAssetId(), "amount", action.getAmount()));
        events.publish("mint", LedgerEventPublisher.data("owner_id", action.getAccountId(), "amount", stableAmount));
        log.warn("[treasury] transfer of {} {} to {} failed, {} stable restored",
                action.getAmount(), action.getAssetId(), action.getAccountId(), stableAmount);
    }

    public CompletableFuture<List<StableTreasury.Token>> tokens() {
        return executor.submit(treasury::list);
    }

    public CompletableFuture<Void> addToken(AuthContext caller, String tokenId, int decimals) {
        return executor.run(() -> treasury.add(caller, tokenId, decimals));
    }

    public CompletableFuture<Void> setTokenEnabled(AuthContext caller, String tokenId, boolean enabled) {
        return executor.run(() -> {
            if (enabled) treasury.enable(caller, tokenId);
            else treasury.disable(caller, tokenId);
        });
    }

    private int stableDecimals() {
        return props.getExchange().getStableDecimals();
    }
}
