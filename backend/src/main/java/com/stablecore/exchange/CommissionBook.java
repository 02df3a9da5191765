package com.stablecore.exchange;

import com.stablecore.auth.AuthContext;
import com.stablecore.auth.Role;
import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.util.FixedPoint;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deposit/withdraw commission rates per accepted asset, and the commission collected so far
 * (in stable units).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommissionBook {

    /** 5%. */
    public static final long MAX_RATE_PPM = 50_000L;

    private final AppProps props;

    private final Map<String, Rates> rates = new ConcurrentHashMap<>();
    private final Map<String, BigInteger> collected = new ConcurrentHashMap<>();

    @Value
    public static class Rates {
        long depositPpm;
        long withdrawPpm;
    }

    @PostConstruct
    void init() {
        props.getExchange().getCommission().forEach((asset, r) -> {
            Rates parsed = new Rates(r.getDepositPpm(), r.getWithdrawPpm());
            validate(parsed);
            rates.put(asset, parsed);
        });
    }

    public Rates rates(String assetId) {
        Rates r = rates.get(assetId);
        if (r != null) return r;
        long d = props.getExchange().getDefaultCommissionPpm();
        return new Rates(d, d);
    }

    public void setRates(AuthContext auth, String assetId, long depositPpm, long withdrawPpm) {
        auth.requireAny(Role.OWNER);
        Rates next = new Rates(depositPpm, withdrawPpm);
        validate(next);
        rates.put(assetId, next);
        log.info("[exchange] commission for {} set to deposit={}ppm withdraw={}ppm", assetId, depositPpm, withdrawPpm);
    }

    public BigInteger depositFee(String assetId, BigInteger amount) {
        return FixedPoint.applyPpm(amount, rates(assetId).getDepositPpm());
    }

    public BigInteger withdrawFee(String assetId, BigInteger amount) {
        return FixedPoint.applyPpm(amount, rates(assetId).getWithdrawPpm());
    }

    public void collect(String assetId, BigInteger amount) {
        if (amount.signum() > 0) collected.merge(assetId, amount, BigInteger::add);
    }

    /** Removes collected commission: paid out by the owner, or reversed after a failed external step. */
    public void release(String assetId, BigInteger amount) {
        if (amount.signum() == 0) return;
        BigInteger cur = collected(assetId);
        if (cur.compareTo(amount) < 0) {
            throw CoreException.of(ErrorCode.INSUFFICIENT_BALANCE, "commission of %s is %s, cannot release %s", assetId, cur, amount);
        }
        collected.put(assetId, cur.subtract(amount));
    }

    public BigInteger collected(String assetId) {
        return collected.getOrDefault(assetId, BigInteger.ZERO);
    }

    public Map<String, BigInteger> collectedAll() {
        return Map.copyOf(collected);
    }

    private static void validate(Rates r) {
        if (r.getDepositPpm() < 0 || r.getDepositPpm() > MAX_RATE_PPM || r.getWithdrawPpm() < 0 || r.getWithdrawPpm() > MAX_RATE_PPM) {
            throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "commission rate cannot be more than 5%");
        }
    }
}
