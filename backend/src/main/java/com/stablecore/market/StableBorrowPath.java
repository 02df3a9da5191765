package com.stablecore.market;

import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Synthetic borrowing of the stable asset. Borrowing mints, repaying burns. The supplied pool of
 * the stable asset is held by the issuer account and mirrors the outstanding liability.
 */
@Component
@RequiredArgsConstructor
public class StableBorrowPath {

    private final AppProps props;

    public PositionLedger.Movement borrow(MarketSession s, String accountId, BigInteger amount) {
        AssetRecord a = stableAsset(s);
        if (!a.isEnabled()) throw new CoreException(ErrorCode.ASSET_DISABLED, "stable asset is disabled");
        if (!a.getConfig().isCanBorrow()) {
            throw new CoreException(ErrorCode.ASSET_DISABLED, "stable asset borrowing is switched off");
        }
        PositionLedger ledger = s.ledger();
        ledger.increaseSupplied(s.position(issuer()), a, amount);
        PositionLedger.Movement m = ledger.increaseBorrowed(s.position(accountId), a, amount);
        s.mintStable(accountId, amount);
        return m;
    }

    /**
     * Burns stable tokens of {@code payerId} to repay {@code debtorId}'s stable debt. The amount is
     * capped to what is owed and to the payer's balance; only the capped amount is burned.
     */
    public PositionLedger.Movement repay(MarketSession s, String payerId, String debtorId, BigInteger requested) {
        AssetRecord a = stableAsset(s);
        PositionLedger ledger = s.ledger();
        PositionLedger.Movement m = ledger.decreaseBorrowed(s.position(debtorId), a, requested, s.stableBalance(payerId));
        s.burnStable(payerId, m.getAmount());

        AccountPosition issuer = s.position(issuer());
        BigInteger backing = PositionLedger.suppliedAmount(issuer, a);
        if (backing.signum() > 0) {
            AssetAmount release = m.getAmount().compareTo(backing) >= 0
                    ? AssetAmount.all(a.getAssetId())
                    : AssetAmount.of(a.getAssetId(), m.getAmount());
            ledger.decreaseSupplied(issuer, a, release);
        }
        return m;
    }

    private AssetRecord stableAsset(MarketSession s) {
        return s.asset(s.stableAssetId());
    }

    private String issuer() {
        return props.getMarket().getIssuerAccount();
    }
}
