package com.stablecore.market;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Account balances per role, with valuation when the account holds collateral or debt. */
@Value
@Builder
public class AccountView {
    String accountId;
    List<Balance> supplied;
    List<Balance> collateral;
    List<Balance> borrowed;
    String stableBalance;
    String borrowingPower;
    String debtValue;
    /** Null when the account has no debt. */
    String healthFactor;
    boolean healthy;

    @Value
    public static class Balance {
        String assetId;
        String shares;
        String balance;
    }
}
