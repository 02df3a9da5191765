package com.stablecore.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MintByNativeRequest {
    /** Venue receipt of the native deposit backing the mint. */
    @NotBlank
    private String receiptId;

    /** Percent, e.g. 210 for 210%. */
    private int collateralRatio;
}
