package com.stablecore.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigInteger;

/** Withdraw: the token to receive and the stable amount to burn. */
@Data
public class TreasuryRequest {
    @NotBlank
    private String tokenId;

    @NotNull
    @Positive
    private BigInteger amount;
}
