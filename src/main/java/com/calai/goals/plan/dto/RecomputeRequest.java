package com.calai.goals.plan.dto;

import com.calai.goals.plan.common.GoalField;
import com.calai.goals.plan.common.GoalSnapshot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.Set;

/**
 * 換演算法後只重算受影響的類別，其他欄位（包含使用者手動改過的）維持 previous 的值。
 */
public record RecomputeRequest(
        @NotNull(message = "Previous goals are required") GoalSnapshot previous,
        Set<GoalField> userEdited,
        @Valid AlgorithmSelectionRequest before,
        @NotNull(message = "New algorithm selection is required") @Valid AlgorithmSelectionRequest after,

        @NotNull(message = "Age is required") @Min(value = 1, message = "Age must be greater than 0") Integer age,
        @NotNull(message = "Gender is required") String gender,
        @DecimalMax(value = "800", message = "Weight must be at most 800 kg") Double weightKg,
        @DecimalMax(value = "1000", message = "Weight must be at most 1000 lbs") Double weightLbs,
        @NotNull(message = "Calories is required") @PositiveOrZero Double kcal,
        @NotNull(message = "Fat is required") @PositiveOrZero Double fatG,
        @PositiveOrZero Double carbsG,
        String exerciseLevel
) {}
