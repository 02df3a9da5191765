package com.stablecore.web3;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/** Funds the venue received from {@code senderId}, claimed by the core exactly once. */
@Value
@Builder
public class DepositReceipt {
    String receiptId;
    String senderId;
    String assetId;
    BigInteger amount;
}
