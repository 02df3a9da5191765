package com.stablecore.exchange;

import com.stablecore.auth.AuthContext;
import com.stablecore.auth.Role;
import com.stablecore.config.AppProps;
import com.stablecore.util.FixedPoint;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Current exchange spread in parts per million.
 *
 * Adaptive mode keeps an accumulator of traded notional (reference units). It decays as
 * {@code acc * e^(-scaler * minutes)} and widens the spread by {@code (max - min) * acc / (acc + saturation)}.
 * The spread for a trade is read before that trade is added, so a prediction and the
 * trade itself see the same value.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpreadCalculator {

    private static final double MS_PER_MINUTE = 60_000d;

    private final AppProps props;

    private volatile SpreadConfig config;
    private double accumulator;
    private long lastTradeMs;

    @PostConstruct
    void init() {
        SpreadConfig initial = SpreadConfig.fromProps(props.getExchange().getSpread());
        initial.validate();
        config = initial;
        log.info("[exchange] spread mode {}", initial);
    }

    public SpreadConfig config() {
        return config;
    }

    /** Owner only. Validation failure leaves the active mode untouched. */
    public void configure(AuthContext auth, SpreadConfig next) {
        auth.requireAny(Role.OWNER);
        next.validate();
        config = next;
        log.info("[exchange] spread changed to {} by {}", next, auth.getAccountId());
    }

    public long spreadPpm(long nowMs) {
        SpreadConfig c = config;
        if (c instanceof SpreadConfig.Fixed f) {
            return f.getBps() * 100L;
        }
        SpreadConfig.Adaptive a = (SpreadConfig.Adaptive) c;
        double acc = decayed(a, nowMs);
        BigDecimal saturation = props.getExchange().getSpread().getSaturation();
        double weight = acc / (acc + saturation.doubleValue());
        BigDecimal spread = a.getMin().add(a.getMax().subtract(a.getMin()).multiply(BigDecimal.valueOf(weight)));
        if (spread.compareTo(a.getMax()) > 0) spread = a.getMax();
        if (spread.compareTo(a.getMin()) < 0) spread = a.getMin();
        return spread.multiply(BigDecimal.valueOf(FixedPoint.PPM)).setScale(0, RoundingMode.DOWN).longValueExact();
    }

    /** Adds a trade's notional after it has been priced. */
    public void recordTrade(BigDecimal notional, long nowMs) {
        SpreadConfig c = config;
        double base = c instanceof SpreadConfig.Adaptive a ? decayed(a, nowMs) : 0d;
        accumulator = base + notional.doubleValue();
        lastTradeMs = nowMs;
    }

    double decayed(SpreadConfig.Adaptive a, long nowMs) {
        if (accumulator == 0d) return 0d;
        long dt = Math.max(0L, nowMs - lastTradeMs);
        return accumulator * StrictMath.exp(-a.getScaler().doubleValue() * dt / MS_PER_MINUTE);
    }
}
