package com.stablecore.market;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.ledger.TokenLedger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Staging area for one atomic state transition. Records are loaded as detached, accrued copies;
 * nothing reaches the registry, the position ledger or the token ledger until {@link #commit()}.
 * Dropping the session discards every change.
 */
public class MarketSession {

    private final AssetRegistry registry;
    private final PositionLedger ledger;
    private final InterestAccrualEngine accrual;
    private final TokenLedger tokens;
    private final long nowMs;
    private final int maxAssetsPerAccount;

    private final Map<String, AssetRecord> assets = new LinkedHashMap<>();
    private final Map<String, AccountPosition> positions = new LinkedHashMap<>();
    private final Map<String, BigInteger> tokenDeltas = new LinkedHashMap<>();
    private final List<MarketEvent> events = new ArrayList<>();
    private boolean committed;

    public MarketSession(AssetRegistry registry, PositionLedger ledger, InterestAccrualEngine accrual,
                         TokenLedger tokens, long nowMs, int maxAssetsPerAccount) {
        this.registry = registry;
        this.ledger = ledger;
        this.accrual = accrual;
        this.tokens = tokens;
        this.nowMs = nowMs;
        this.maxAssetsPerAccount = maxAssetsPerAccount;
    }

    public AssetRecord asset(String assetId) {
        return assets.computeIfAbsent(assetId, id -> {
            AssetRecord r = registry.get(id);
            accrual.accrue(r, nowMs);
            return r;
        });
    }

    public AccountPosition position(String accountId) {
        return positions.computeIfAbsent(accountId, ledger::get);
    }

    public PositionLedger ledger() {
        return ledger;
    }

    public String stableAssetId() {
        return registry.stableAssetId();
    }

    public long nowMs() {
        return nowMs;
    }

    public BigInteger stableBalance(String accountId) {
        return tokens.balanceOf(accountId).add(tokenDeltas.getOrDefault(accountId, BigInteger.ZERO));
    }

    public void mintStable(String accountId, BigInteger amount) {
        tokenDeltas.merge(accountId, amount, BigInteger::add);
    }

    public void burnStable(String accountId, BigInteger amount) {
        BigInteger bal = stableBalance(accountId);
        if (bal.compareTo(amount) < 0) {
            throw CoreException.of(ErrorCode.INSUFFICIENT_BALANCE,
                    "%s holds %s stable, needs %s", accountId, bal, amount);
        }
        tokenDeltas.merge(accountId, amount.negate(), BigInteger::add);
    }

    public void event(String name, Map<String, Object> data) {
        events.add(new MarketEvent(name, data));
    }

    /** Validates every staged position, then writes everything back. Returns the staged events. */
    public List<MarketEvent> commit() {
        if (committed) throw new IllegalStateException("session already committed");
        for (AccountPosition p : positions.values()) {
            if (p.assetIds().size() > maxAssetsPerAccount) {
                throw CoreException.of(ErrorCode.INVALID_REQUEST,
                        "%s would hold %d assets, limit is %d", p.getAccountId(), p.assetIds().size(), maxAssetsPerAccount);
            }
        }
        assets.values().forEach(registry::commit);
        positions.values().forEach(ledger::commit);
        tokenDeltas.forEach((account, delta) -> {
            if (delta.signum() > 0) tokens.credit(account, delta);
            else if (delta.signum() < 0) tokens.debit(account, delta.negate());
        });
        committed = true;
        return List.copyOf(events);
    }
}
