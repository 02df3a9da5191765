package com.stablecore.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TreasuryTokenRequest {
    @NotBlank
    private String tokenId;
    private int decimals;
}
