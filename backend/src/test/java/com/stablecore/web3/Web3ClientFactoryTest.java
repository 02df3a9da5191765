package com.stablecore.web3;

import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.web3.exception.RetryableRpcException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Web3ClientFactoryTest {

    private static final String RPC_A = "http://rpc-a.invalid";
    private static final String RPC_B = "http://rpc-b.invalid";

    private AppProps.Network network;
    private Web3ClientFactory factory;
    private final List<String> calls = new ArrayList<>();

    @BeforeEach
    void setUp() {
        network = new AppProps.Network();
        network.setRpcUrls(List.of(RPC_A, RPC_B));
        network.setBackoffMs(0);
        network.setMaxBackoffMs(0);
        AppProps props = new AppProps();
        props.setNetwork(Map.of("testnet", network));
        factory = new Web3ClientFactory(props, Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("a rate-limited endpoint hands over to the next one")
    void failsOver() {
        String out = factory.executeWithFailover("testnet", (web3, endpoint) -> {
            calls.add(endpoint);
            if (endpoint.equals(RPC_A)) throw new RetryableRpcException(endpoint, "429 too many requests");
            return "quote";
        });

        assertThat(out).isEqualTo("quote");
        assertThat(calls).containsExactly(RPC_A, RPC_B);
    }

    @Test
    @DisplayName("an endpoint that failed sits out its penalty window")
    void penalizedEndpointSkipped() {
        factory.executeWithFailover("testnet", (web3, endpoint) -> {
            if (endpoint.equals(RPC_A)) throw new RetryableRpcException(endpoint, "rate limit");
            return "first";
        });
        calls.clear();

        for (int i = 0; i < 3; i++) {
            factory.executeWithFailover("testnet", (web3, endpoint) -> {
                calls.add(endpoint);
                return "again";
            });
        }

        assertThat(calls).containsOnly(RPC_B);
    }

    @Test
    @DisplayName("a non-transport failure is not retried")
    void nonRetryable() {
        assertThatThrownBy(() -> factory.executeWithFailover("testnet", (web3, endpoint) -> {
            calls.add(endpoint);
            throw new IllegalStateException("execution reverted");
        }))
                .isInstanceOf(CoreException.class)
                .extracting("code").isEqualTo(ErrorCode.EXTERNAL_CALL_FAILED);
        assertThat(calls).hasSize(1);
    }

    @Test
    @DisplayName("running out of endpoints fails the call")
    void allFail() {
        assertThatThrownBy(() -> factory.executeWithFailover("testnet", (web3, endpoint) -> {
            calls.add(endpoint);
            throw new java.io.IOException("connection refused");
        }))
                .isInstanceOf(CoreException.class)
                .hasMessageContaining("all RPC endpoints failed");
        assertThat(calls).containsExactlyInAnyOrder(RPC_A, RPC_B);
    }

    @Test
    @DisplayName("transport hints and backoff growth")
    void helpers() {
        assertThat(Web3ClientFactory.isRetryableTransport("Read timeout")).isTrue();
        assertThat(Web3ClientFactory.isRetryableTransport(null)).isTrue();
        assertThat(Web3ClientFactory.isRetryableTransport("invalid opcode")).isFalse();

        AppProps.Network cfg = new AppProps.Network();
        assertThat(Web3ClientFactory.backoff(cfg, 0)).isEqualTo(Duration.ofMillis(400));
        assertThat(Web3ClientFactory.backoff(cfg, 2)).isEqualTo(Duration.ofMillis(1600));
        assertThat(Web3ClientFactory.backoff(cfg, 9)).isEqualTo(Duration.ofMillis(5000));
    }
}
