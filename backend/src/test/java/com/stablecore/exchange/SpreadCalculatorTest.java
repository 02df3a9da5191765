package com.stablecore.exchange;

import com.stablecore.auth.AuthContext;
import com.stablecore.auth.Role;
import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpreadCalculatorTest {

    private static final AuthContext OWNER = AuthContext.of("owner.test", Role.OWNER);
    private static final long MINUTE = 60_000L;

    private SpreadCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new SpreadCalculator(new AppProps());
        calculator.init();
    }

    private static SpreadConfig.Adaptive adaptive(String min, String max, String scaler) {
        return new SpreadConfig.Adaptive(new BigDecimal(min), new BigDecimal(max), new BigDecimal(scaler));
    }

    @Test
    @DisplayName("fixed mode returns the configured basis points as ppm")
    void fixedDefault() {
        assertThat(calculator.spreadPpm(0)).isEqualTo(1_000L);
        calculator.recordTrade(new BigDecimal("5000000"), 0);
        assertThat(calculator.spreadPpm(0)).isEqualTo(1_000L);
    }

    @Test
    @DisplayName("only the owner changes the spread mode")
    void ownerOnly() {
        assertThatThrownBy(() -> calculator.configure(AuthContext.of("user.test"), new SpreadConfig.Fixed(20)))
                .isInstanceOf(CoreException.class)
                .extracting("code").isEqualTo(ErrorCode.UNAUTHORIZED);
    }

    @Test
    @DisplayName("out-of-range settings are rejected and the active mode stays")
    void invalidSettingsRejected() {
        assertThatThrownBy(() -> calculator.configure(OWNER, new SpreadConfig.Fixed(500)))
                .extracting("code").isEqualTo(ErrorCode.INVALID_CONFIGURATION);
        assertThatThrownBy(() -> calculator.configure(OWNER, adaptive("0.004", "0.004", "0.1")))
                .extracting("code").isEqualTo(ErrorCode.INVALID_CONFIGURATION);
        assertThatThrownBy(() -> calculator.configure(OWNER, adaptive("0.001", "0.05", "0.1")))
                .extracting("code").isEqualTo(ErrorCode.INVALID_CONFIGURATION);
        assertThatThrownBy(() -> calculator.configure(OWNER, adaptive("0.001", "0.005", "0")))
                .extracting("code").isEqualTo(ErrorCode.INVALID_CONFIGURATION);
        assertThatThrownBy(() -> calculator.configure(OWNER, adaptive("0.001", "0.005", "0.41")))
                .extracting("code").isEqualTo(ErrorCode.INVALID_CONFIGURATION);

        assertThat(calculator.config()).isEqualTo(new SpreadConfig.Fixed(10));
    }

    @Test
    @DisplayName("adaptive spread widens with volume and decays back to min")
    void adaptiveVolumeAndDecay() {
        calculator.configure(OWNER, adaptive("0.001", "0.005", "0.1"));
        assertThat(calculator.spreadPpm(0)).isEqualTo(1_000L);

        // saturation volume: half of max - min
        calculator.recordTrade(new BigDecimal("1000000"), 0);
        assertThat(calculator.spreadPpm(0)).isEqualTo(3_000L);

        // ten minutes at scaler 0.1 leave e^-1 of the volume
        assertThat(calculator.spreadPpm(10 * MINUTE)).isEqualTo(2_075L);

        assertThat(calculator.spreadPpm(24 * 60 * MINUTE)).isEqualTo(1_000L);
    }

    @Test
    @DisplayName("the spread of a trade is read before the trade is recorded")
    void spreadReadBeforeTrade() {
        calculator.configure(OWNER, adaptive("0.001", "0.005", "0.1"));

        long quoted = calculator.spreadPpm(MINUTE);
        calculator.recordTrade(new BigDecimal("250000"), MINUTE);

        assertThat(quoted).isEqualTo(1_000L);
        assertThat(calculator.spreadPpm(MINUTE)).isGreaterThan(quoted);
    }
}
