package com.stablecore.market;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class MarketResult {
    String accountId;
    List<String> events;
    /** Withdrawal markers; the call completes once their transfers settled. */
    List<String> pendingActionIds;
}
