package com.calai.goals.nutrient.common;

import com.calai.goals.common.ActivityLevel;
import com.calai.goals.common.Sex;

/**
 * 進階營養素計算的輸入。kcal 是換單位之前的值；totalFatG / carbsG 是 MacroAllocator 算出的克數。
 */
public record NutrientInputs(
        int ageYears,
        Sex sex,
        double weightKg,
        double kcal,
        double totalFatG,
        double carbsG,
        ActivityLevel activityLevel
) {}
