package com.stablecore.exchange;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExchangeResult {
    String accountId;
    String amountIn;
    String amountOut;
    String spreadFee;
    String commission;
    long spreadPpm;
    /** Set when a payout is still tracked by a pending-action marker. */
    String pendingActionId;

    public static ExchangeResult of(String accountId, ExchangeQuote q, String pendingActionId) {
        return ExchangeResult.builder()
                .accountId(accountId)
                .amountIn(q.getAmountIn().toString())
                .amountOut(q.getAmountOut().toString())
                .spreadFee(q.getSpreadFee().toString())
                .commission(q.getCommission().toString())
                .spreadPpm(q.getSpreadPpm())
                .pendingActionId(pendingActionId)
                .build();
    }
}
