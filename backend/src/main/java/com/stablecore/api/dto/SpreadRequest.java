package com.stablecore.api.dto;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import com.stablecore.exchange.SpreadConfig;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * FIXED uses {@code bps}; ADAPTIVE uses {@code min}, {@code max} and {@code scaler}.
 */
@Data
public class SpreadRequest {
    @NotBlank
    private String mode;

    private Integer bps;

    private BigDecimal min;
    private BigDecimal max;
    private BigDecimal scaler;

    public SpreadConfig toConfig() {
        return switch (mode.toUpperCase(Locale.ROOT)) {
            case "FIXED" -> {
                if (bps == null) throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "fixed spread needs bps");
                yield new SpreadConfig.Fixed(bps);
            }
            case "ADAPTIVE" -> new SpreadConfig.Adaptive(min, max, scaler);
            default -> throw new CoreException(ErrorCode.INVALID_CONFIGURATION, "unknown spread mode " + mode);
        };
    }
}
