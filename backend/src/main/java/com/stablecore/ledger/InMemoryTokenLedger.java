package com.stablecore.ledger;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class InMemoryTokenLedger implements TokenLedger {

    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
    private final AtomicReference<BigInteger> supply = new AtomicReference<>(BigInteger.ZERO);

    @Override
    public void credit(String accountId, BigInteger amount) {
        if (amount.signum() < 0) throw new CoreException(ErrorCode.INVALID_REQUEST, "negative credit");
        if (amount.signum() == 0) return;
        balances.merge(accountId, amount, BigInteger::add);
        supply.accumulateAndGet(amount, BigInteger::add);
    }

    @Override
    public void debit(String accountId, BigInteger amount) {
        if (amount.signum() < 0) throw new CoreException(ErrorCode.INVALID_REQUEST, "negative debit");
        if (amount.signum() == 0) return;
        balances.compute(accountId, (k, v) -> {
            BigInteger cur = v == null ? BigInteger.ZERO : v;
            if (cur.compareTo(amount) < 0) {
                throw CoreException.of(ErrorCode.INSUFFICIENT_BALANCE,
                        "%s holds %s, cannot debit %s", accountId, cur, amount);
            }
            BigInteger left = cur.subtract(amount);
            return left.signum() == 0 ? null : left;
        });
        supply.accumulateAndGet(amount, BigInteger::subtract);
    }

    @Override
    public BigInteger balanceOf(String accountId) {
        return balances.getOrDefault(accountId, BigInteger.ZERO);
    }

    @Override
    public BigInteger totalSupply() {
        return supply.get();
    }
}
