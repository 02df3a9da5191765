package com.stablecore.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Native coin the caller already sent to the venue, named by the venue's deposit receipt.
 * - {@code recipient} defaults to the caller.
 * - Without {@code expected} no slippage check runs.
 */
@Data
public class BuyRequest {
    @NotBlank
    private String receiptId;

    @Valid
    private ExpectedRateDTO expected;

    private String recipient;
}
