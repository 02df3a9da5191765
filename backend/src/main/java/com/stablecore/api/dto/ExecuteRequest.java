package com.stablecore.api.dto;

import com.stablecore.market.Action;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/** Market actions applied in order as one batch. */
@Data
public class ExecuteRequest {
    @NotEmpty
    private List<Action> actions;
}
