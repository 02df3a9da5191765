package com.stablecore.service;

import com.stablecore.auth.AuthContext;
import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.exchange.ExchangeQuote;
import com.stablecore.exchange.ExchangeResult;
import com.stablecore.exchange.ExpectedRate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ExchangeServiceTest {

    private static final AuthContext ALICE = AuthContext.of("alice.test");
    /** 10 native at 24 decimals. */
    private static final BigInteger TEN_NATIVE = new BigInteger("10000000000000000000000000");
    /** 111.439 stable minus 10 bps spread and 1 bp commission. */
    private static final BigInteger BOUGHT = new BigInteger("111316417100000000000");

    private final ServiceTestSupport t = new ServiceTestSupport();

    @AfterEach
    void tearDown() {
        t.close();
    }

    @Test
    @DisplayName("buy mints the quoted stable to the payer and keeps the commission")
    void buy() {
        ExchangeResult result = t.exchange.buy(ALICE, aliceNative(), null, null).join();

        assertThat(result.getAmountOut()).isEqualTo(BOUGHT.toString());
        assertThat(result.getSpreadFee()).isEqualTo("111439000000000000");
        assertThat(result.getCommission()).isEqualTo("11143900000000000");
        assertThat(result.getSpreadPpm()).isEqualTo(1_000L);
        assertThat(t.tokens.balanceOf("alice.test")).isEqualTo(BOUGHT);
        assertThat(t.commission.collected("native")).isEqualTo(new BigInteger("11143900000000000"));
        verify(t.gateway, never()).transfer(any(), any(), any());
    }

    @Test
    @DisplayName("buy can mint to another recipient")
    void buyForRecipient() {
        ExchangeResult result = t.exchange.buy(ALICE, aliceNative(), null, "Bob.Test").join();

        assertThat(result.getAccountId()).isEqualTo("bob.test");
        assertThat(t.tokens.balanceOf("bob.test")).isEqualTo(BOUGHT);
        assertThat(t.tokens.balanceOf("alice.test")).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("a buy without a matching venue deposit mints nothing and sends nothing back")
    void buyWithoutDeposit() {
        Throwable err = catchThrowable(() -> t.exchange.buy(ALICE, "dep-made-up", null, null).join());

        assertThat(CoreException.unwrap(err).getCode()).isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);
        assertThat(t.tokens.totalSupply()).isEqualTo(BigInteger.ZERO);
        verify(t.gateway, never()).transfer(any(), any(), any());
    }

    @Test
    @DisplayName("a deposit funds one buy only")
    void depositSpentOnce() {
        String receipt = aliceNative();
        t.exchange.buy(ALICE, receipt, null, null).join();

        Throwable err = catchThrowable(() -> t.exchange.buy(ALICE, receipt, null, null).join());

        assertThat(CoreException.unwrap(err).getCode()).isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);
        assertThat(t.tokens.balanceOf("alice.test")).isEqualTo(BOUGHT);
    }

    @Test
    @DisplayName("someone else's deposit cannot pay for a buy")
    void foreignDeposit() {
        String bobs = t.deposit("bob.test", "native", TEN_NATIVE);

        Throwable err = catchThrowable(() -> t.exchange.buy(ALICE, bobs, null, null).join());

        assertThat(CoreException.unwrap(err).getCode()).isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);
        assertThat(t.tokens.totalSupply()).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("a deposit of another asset is sent back untouched")
    void wrongAssetDeposit() {
        BigInteger oneUsdt = BigInteger.valueOf(1_000_000);
        String receipt = t.deposit("alice.test", "usdt", oneUsdt);

        Throwable err = catchThrowable(() -> t.exchange.buy(ALICE, receipt, null, null).join());

        assertThat(CoreException.unwrap(err).getCode()).isEqualTo(ErrorCode.INVALID_REQUEST);
        verify(t.gateway).transfer("usdt", "alice.test", oneUsdt);
        assertThat(t.tokens.totalSupply()).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("a buy outside the slippage window refunds the claimed native")
    void buySlippageRefunds() {
        ExpectedRate expected = new ExpectedRate(BigInteger.valueOf(120000), BigInteger.valueOf(100), 28);

        Throwable err = catchThrowable(() -> t.exchange.buy(ALICE, aliceNative(), expected, null).join());

        assertThat(CoreException.unwrap(err).getCode()).isEqualTo(ErrorCode.SLIPPAGE_EXCEEDED);
        verify(t.gateway).transfer("native", "alice.test", TEN_NATIVE);
        assertThat(t.tokens.totalSupply()).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("a refund that cannot be delivered still reports the failure that triggered it")
    void failedRefund() {
        t.failTransfers();
        ExpectedRate expected = new ExpectedRate(BigInteger.valueOf(120000), BigInteger.ZERO, 28);

        Throwable err = catchThrowable(() -> t.exchange.buy(ALICE, aliceNative(), expected, null).join());

        assertThat(CoreException.unwrap(err).getCode()).isEqualTo(ErrorCode.SLIPPAGE_EXCEEDED);
        verify(t.gateway).transfer("native", "alice.test", TEN_NATIVE);
    }

    @Test
    @DisplayName("sell burns stable and pays out native through the venue")
    void sell() {
        t.tokens.credit("alice.test", BOUGHT);
        ExchangeQuote expected = t.engine.quoteSell(BOUGHT, ServiceTestSupport.NATIVE_RATE, 28, 1_000, 100);

        ExchangeResult result = t.exchange.sell(ALICE, BOUGHT, null).join();

        assertThat(result.getAmountOut()).isEqualTo(expected.getAmountOut().toString());
        assertThat(result.getPendingActionId()).isNotNull();
        assertThat(t.tokens.balanceOf("alice.test")).isEqualTo(BigInteger.ZERO);
        verify(t.gateway).transfer("native", "alice.test", expected.getAmountOut());
    }

    @Test
    @DisplayName("a failed payout restores the burned stable and the commission")
    void sellCompensated() {
        t.tokens.credit("alice.test", BOUGHT);
        t.failTransfers();

        Throwable err = catchThrowable(() -> t.exchange.sell(ALICE, BOUGHT, null).join());

        assertThat(CoreException.unwrap(err).getCode()).isEqualTo(ErrorCode.EXTERNAL_CALL_FAILED);
        assertThat(t.tokens.balanceOf("alice.test")).isEqualTo(BOUGHT);
        assertThat(t.commission.collected("native")).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("selling more than held fails before anything leaves")
    void sellBeyondBalance() {
        Throwable err = catchThrowable(() -> t.exchange.sell(ALICE, BOUGHT, null).join());

        assertThat(CoreException.unwrap(err).getCode()).isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);
        verify(t.gateway, never()).transfer(any(), any(), any());
    }

    @Test
    @DisplayName("owner mint by collateral ratio, a non-owner's deposit is left unclaimed")
    void mintByNative() {
        String ownerDeposit = t.deposit("owner.test", "native", TEN_NATIVE);
        BigInteger minted = t.exchange.mintByNative(ServiceTestSupport.OWNER, ownerDeposit, 210).join();
        assertThat(minted).isEqualTo(new BigInteger("53066190476190476190"));
        assertThat(t.tokens.balanceOf("owner.test")).isEqualTo(minted);

        String aliceDeposit = aliceNative();
        Throwable err = catchThrowable(() -> t.exchange.mintByNative(ALICE, aliceDeposit, 210).join());
        assertThat(CoreException.unwrap(err).getCode()).isEqualTo(ErrorCode.UNAUTHORIZED);
        verify(t.gateway, never()).claimDeposit(eq(aliceDeposit), any());
        verify(t.gateway, never()).transfer(any(), any(), any());
    }

    @Test
    @DisplayName("predictions quote at the current spread without touching balances")
    void predict() {
        ExchangeQuote q = t.exchange.predictBuy(TEN_NATIVE, ServiceTestSupport.NATIVE_RATE, 28).join();

        assertThat(q.getAmountOut()).isEqualTo(BOUGHT);
        assertThat(t.tokens.totalSupply()).isEqualTo(BigInteger.ZERO);
        assertThat(t.commission.collectedAll()).isEmpty();
    }

    @Test
    @DisplayName("collected commission is paid out by the owner only")
    void transferCommission() {
        t.exchange.buy(ALICE, aliceNative(), null, null).join();
        BigInteger fee = new BigInteger("11143900000000000");

        Throwable err = catchThrowable(() -> t.exchange.transferCommission(ALICE, "native", "alice.test", fee).join());
        assertThat(CoreException.unwrap(err).getCode()).isEqualTo(ErrorCode.UNAUTHORIZED);

        t.exchange.transferCommission(ServiceTestSupport.OWNER, "native", "treasury.test", fee).join();
        assertThat(t.tokens.balanceOf("treasury.test")).isEqualTo(fee);
        assertThat(t.commission.collected("native")).isEqualTo(BigInteger.ZERO);
    }

    private String aliceNative() {
        return t.deposit("alice.test", "native", TEN_NATIVE);
    }
}
