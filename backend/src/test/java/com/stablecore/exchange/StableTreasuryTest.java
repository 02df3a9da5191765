package com.stablecore.exchange;

import com.stablecore.auth.AuthContext;
import com.stablecore.auth.Role;
import com.stablecore.config.AppProps;
import com.stablecore.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StableTreasuryTest {

    private static final AuthContext OWNER = AuthContext.of("owner.test", Role.OWNER);

    private StableTreasury treasury;

    @BeforeEach
    void setUp() {
        AppProps props = new AppProps();
        AppProps.TreasuryToken usdt = new AppProps.TreasuryToken();
        usdt.setId("usdt");
        usdt.setDecimals(6);
        props.getExchange().getTreasuryTokens().add(usdt);
        treasury = new StableTreasury(props);
        treasury.bootstrap();
    }

    @Test
    @DisplayName("configured tokens are accepted from startup")
    void bootstrapFromProps() {
        assertThat(treasury.list())
                .singleElement()
                .satisfies(t -> {
                    assertThat(t.getId()).isEqualTo("usdt");
                    assertThat(t.getDecimals()).isEqualTo(6);
                    assertThat(t.isEnabled()).isTrue();
                    assertThat(t.getBalance()).isEqualTo(BigInteger.ZERO);
                });
    }

    @Test
    @DisplayName("adding a token checks owner, duplicates and decimal bounds")
    void addToken() {
        treasury.add(OWNER, "usdc", 6);
        assertThat(treasury.list()).extracting(StableTreasury.Token::getId).containsExactly("usdt", "usdc");

        assertThatThrownBy(() -> treasury.add(OWNER, "usdc", 6))
                .extracting("code").isEqualTo(ErrorCode.INVALID_CONFIGURATION);
        assertThatThrownBy(() -> treasury.add(OWNER, "dai", 0))
                .extracting("code").isEqualTo(ErrorCode.INVALID_CONFIGURATION);
        assertThatThrownBy(() -> treasury.add(OWNER, "dai", 38))
                .extracting("code").isEqualTo(ErrorCode.INVALID_CONFIGURATION);
        assertThatThrownBy(() -> treasury.add(AuthContext.of("user.test"), "dai", 18))
                .extracting("code").isEqualTo(ErrorCode.UNAUTHORIZED);
    }

    @Test
    @DisplayName("disabled and unknown tokens are refused, toggling to the same state is an error")
    void enableDisable() {
        treasury.disable(OWNER, "usdt");
        assertThatThrownBy(() -> treasury.requireEnabled("usdt"))
                .extracting("code").isEqualTo(ErrorCode.ASSET_DISABLED);
        assertThatThrownBy(() -> treasury.disable(OWNER, "usdt"))
                .extracting("code").isEqualTo(ErrorCode.INVALID_REQUEST);

        treasury.enable(OWNER, "usdt");
        assertThat(treasury.requireEnabled("usdt").isEnabled()).isTrue();

        assertThatThrownBy(() -> treasury.requireEnabled("dai"))
                .extracting("code").isEqualTo(ErrorCode.UNKNOWN_ASSET);
    }

    @Test
    @DisplayName("the treasury never releases more than it holds")
    void balances() {
        treasury.deposit("usdt", BigInteger.valueOf(5_000_000));
        treasury.withdraw("usdt", BigInteger.valueOf(2_000_000));

        assertThatThrownBy(() -> treasury.withdraw("usdt", BigInteger.valueOf(3_000_001)))
                .extracting("code").isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);
        assertThat(treasury.requireEnabled("usdt").getBalance()).isEqualTo(BigInteger.valueOf(3_000_000));
    }

    @Test
    @DisplayName("the returned token is a copy")
    void copies() {
        StableTreasury.Token copy = treasury.requireEnabled("usdt");
        copy.setBalance(BigInteger.TEN);
        assertThat(treasury.requireEnabled("usdt").getBalance()).isEqualTo(BigInteger.ZERO);
    }
}
