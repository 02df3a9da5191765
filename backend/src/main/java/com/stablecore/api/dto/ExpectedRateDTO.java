package com.stablecore.api.dto;

import com.stablecore.exchange.ExpectedRate;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

/** Rate the caller priced against: {@code multiplier * 10^-decimals}, tolerance in the same decimals. */
@Data
public class ExpectedRateDTO {
    @NotNull
    private BigInteger multiplier;
    @NotNull
    private BigInteger slippage;
    @Min(0)
    @Max(77)
    private int decimals;

    public ExpectedRate toExpectedRate() {
        return new ExpectedRate(multiplier, slippage, decimals);
    }
}
