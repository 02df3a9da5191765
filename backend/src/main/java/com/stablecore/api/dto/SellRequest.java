package com.stablecore.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigInteger;

@Data
public class SellRequest {
    @NotNull
    @Positive
    private BigInteger stableAmount;

    @Valid
    private ExpectedRateDTO expected;
}
