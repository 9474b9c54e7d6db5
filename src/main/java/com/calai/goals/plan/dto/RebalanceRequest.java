package com.calai.goals.plan.dto;

import com.calai.goals.macro.common.Macro;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.Set;

public record RebalanceRequest(
        @NotNull(message = "Carbs is required") @Min(0) @Max(100) Integer carbs,
        @NotNull(message = "Protein is required") @Min(0) @Max(100) Integer protein,
        @NotNull(message = "Fat is required") @Min(0) @Max(100) Integer fat,
        @NotNull(message = "Moved macro is required") Macro moved,
        @NotNull(message = "Value is required") @Min(0) @Max(100) Integer value,
        Set<Macro> locked
) {}
