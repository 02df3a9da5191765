package com.stablecore.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigInteger;

@Data
public class CommissionTransferRequest {
    @NotBlank
    private String assetId;
    @NotBlank
    private String accountId;
    @NotNull
    @Positive
    private BigInteger amount;
}
