package com.stablecore.ledger;

import java.math.BigInteger;

/**
 * Fungible balance ledger of the stable asset. Minting is a credit, burning a debit.
 */
public interface TokenLedger {

    void credit(String accountId, BigInteger amount);

    /** Fails with INSUFFICIENT_BALANCE when the debit would underflow. */
    void debit(String accountId, BigInteger amount);

    BigInteger balanceOf(String accountId);

    BigInteger totalSupply();
}
