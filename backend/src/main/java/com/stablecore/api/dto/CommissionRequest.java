package com.stablecore.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

/** Rates in parts per million; 50000 is 5%. */
@Data
public class CommissionRequest {
    @Min(0)
    @Max(50_000)
    private long depositPpm;

    @Min(0)
    @Max(50_000)
    private long withdrawPpm;
}
