package com.stablecore.web3;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablecore.config.AppProps;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpTransferGatewayTest {

    private MockRestServiceServer server;
    private HttpTransferGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate rest = new RestTemplate();
        server = MockRestServiceServer.bindTo(rest).build();
        AppProps props = new AppProps();
        props.getVenue().setBaseUrl("http://venue.test");
        gateway = new HttpTransferGateway(rest, props, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        gateway.destroy();
    }

    @Test
    @DisplayName("posts the transfer with the amount as a decimal string")
    void transfer() {
        server.expect(requestTo("http://venue.test/transfers"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.asset_id").value("usdt"))
                .andExpect(jsonPath("$.receiver_id").value("alice.test"))
                .andExpect(jsonPath("$.amount").value("1000000000000000000000000"))
                .andRespond(withSuccess());

        gateway.transfer("usdt", "alice.test", new BigInteger("1000000000000000000000000")).join();

        server.verify();
    }

    @Test
    @DisplayName("a venue error fails the transfer future")
    void venueError() {
        server.expect(requestTo("http://venue.test/transfers")).andRespond(withServerError());

        Throwable err = catchThrowable(() -> gateway.transfer("native", "alice.test", BigInteger.TEN).join());

        assertThat(CoreException.unwrap(err).getCode()).isEqualTo(ErrorCode.EXTERNAL_CALL_FAILED);
        assertThat(err.getCause()).isInstanceOf(CoreException.class);
    }

    @Test
    @DisplayName("claiming a deposit returns the receipt the venue consumed")
    void claimDeposit() {
        server.expect(requestTo("http://venue.test/deposits/dep-7f3a/claim"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.claimant_id").value("alice.test"))
                .andRespond(withSuccess("{\"receipt_id\":\"dep-7f3a\",\"sender_id\":\"alice.test\","
                        + "\"asset_id\":\"native\",\"amount\":\"10000000000000000000000000\"}", MediaType.APPLICATION_JSON));

        DepositReceipt receipt = gateway.claimDeposit("dep-7f3a", "alice.test").join();

        assertThat(receipt.getReceiptId()).isEqualTo("dep-7f3a");
        assertThat(receipt.getSenderId()).isEqualTo("alice.test");
        assertThat(receipt.getAssetId()).isEqualTo("native");
        assertThat(receipt.getAmount()).isEqualTo(new BigInteger("10000000000000000000000000"));
        server.verify();
    }

    @Test
    @DisplayName("an unknown or already claimed deposit is an insufficient balance")
    void nothingToClaim() {
        server.expect(requestTo("http://venue.test/deposits/dep-made-up/claim")).andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo("http://venue.test/deposits/dep-used/claim")).andRespond(withStatus(HttpStatus.CONFLICT));

        Throwable unknown = catchThrowable(() -> gateway.claimDeposit("dep-made-up", "alice.test").join());
        Throwable used = catchThrowable(() -> gateway.claimDeposit("dep-used", "alice.test").join());

        assertThat(CoreException.unwrap(unknown).getCode()).isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);
        assertThat(CoreException.unwrap(used).getCode()).isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);
    }

    @Test
    @DisplayName("a receipt without an amount fails the claim")
    void incompleteReceipt() {
        server.expect(requestTo("http://venue.test/deposits/dep-1/claim"))
                .andRespond(withSuccess("{\"receipt_id\":\"dep-1\",\"sender_id\":\"alice.test\",\"asset_id\":\"usdt\"}",
                        MediaType.APPLICATION_JSON));

        Throwable err = catchThrowable(() -> gateway.claimDeposit("dep-1", "alice.test").join());

        assertThat(CoreException.unwrap(err).getCode()).isEqualTo(ErrorCode.EXTERNAL_CALL_FAILED);
    }
}
