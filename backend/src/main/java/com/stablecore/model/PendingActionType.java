package com.stablecore.model;

public enum PendingActionType {
    /** Supplied asset debited, external token transfer in flight. */
    MARKET_WITHDRAW,
    /** Stable burned, native payout in flight. */
    EXCHANGE_SELL,
    /** A claimed deposit being returned to its sender after the operation it funded failed. */
    DEPOSIT_REFUND,
    /** Stable burned, treasury token transfer in flight. */
    TREASURY_WITHDRAW
}
