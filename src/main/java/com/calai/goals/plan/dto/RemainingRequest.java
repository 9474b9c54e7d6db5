package com.calai.goals.plan.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 設定欄位沒帶就用 goals.adjustment.* 的預設；超出範圍的值會被夾回並回 warning。
 */
public record RemainingRequest(
        @NotNull(message = "Goal is required") @PositiveOrZero Double goalKcal,
        Double tdeeKcal,
        @NotNull(message = "Eaten is required") @PositiveOrZero Double eatenKcal,
        @PositiveOrZero Double burnedKcal,
        Double partialDayBurnKcal,
        Double elapsedDayFraction,

        String mode,
        Double exerciseCaloriePercentage,
        Double exerciseCalorieGoal,
        Boolean allowNegativeAdjustment
) {}
