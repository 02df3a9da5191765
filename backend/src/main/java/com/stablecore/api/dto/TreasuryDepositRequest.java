package com.stablecore.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/** A token deposit the venue already holds; the receipt names token and amount. */
@Data
public class TreasuryDepositRequest {
    @NotBlank
    private String receiptId;
}
