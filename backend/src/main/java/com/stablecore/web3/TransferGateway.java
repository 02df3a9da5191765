package com.stablecore.web3;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;

/**
 * The token venue: inbound deposits are claimed by receipt, outbound transfers cover external
 * tokens and the native coin. Futures fail when the venue rejects or cannot be reached.
 */
public interface TransferGateway {

    CompletableFuture<Void> transfer(String assetId, String receiverId, BigInteger amount);

    /**
     * Consumes a deposit the venue holds for {@code claimantId}. A receipt that is unknown,
     * already claimed or sent by someone else fails with INSUFFICIENT_BALANCE.
     */
    CompletableFuture<DepositReceipt> claimDeposit(String receiptId, String claimantId);
}
