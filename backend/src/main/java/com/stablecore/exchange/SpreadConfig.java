package com.stablecore.exchange;

import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Active spread mode. Exactly one variant is in force at a time.
 */
public interface SpreadConfig {

    BigDecimal MAX_SPREAD = new BigDecimal("0.05");
    BigDecimal MAX_SCALER = new BigDecimal("0.4");

    /** Throws INVALID_CONFIGURATION when out of range. */
    void validate();

    /** Constant markdown in basis points, within [0, 500). */
    @Value
    class Fixed implements SpreadConfig {
        int bps;

        @Override
        public void validate() {
            if (bps < 0 || bps >= 500) {
                throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "fixed spread must be within [0, 500) bps: " + bps);
            }
        }
    }

    /** Volume-driven spread bounded to [min, max]; {@code scaler} sets the decay speed per minute. */
    @Value
    class Adaptive implements SpreadConfig {
        BigDecimal min;
        BigDecimal max;
        BigDecimal scaler;

        @Override
        public void validate() {
            if (min == null || max == null || scaler == null) {
                throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "adaptive spread needs min, max and scaler");
            }
            if (min.signum() < 0 || min.compareTo(MAX_SPREAD) >= 0 || max.signum() < 0 || max.compareTo(MAX_SPREAD) >= 0) {
                throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "spread bounds must be within [0, 0.05)");
            }
            if (min.compareTo(max) >= 0) {
                throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "spread min must be below max");
            }
            if (scaler.signum() <= 0 || scaler.compareTo(MAX_SCALER) > 0) {
                throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "spread scaler must be within (0, 0.4]");
            }
        }
    }

    static SpreadConfig fromProps(AppProps.Spread s) {
        String mode = s.getMode() == null ? "FIXED" : s.getMode().toUpperCase(Locale.ROOT);
        return switch (mode) {
            case "FIXED" -> new Fixed(s.getFixedBps());
            case "ADAPTIVE" -> new Adaptive(s.getMin(), s.getMax(), s.getScaler());
            default -> throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "unknown spread mode " + s.getMode());
        };
    }
}
