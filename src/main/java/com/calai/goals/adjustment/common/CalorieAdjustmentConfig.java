package com.calai.goals.adjustment.common;

import com.calai.goals.common.Units;

/**
 * @param exerciseCaloriePercentage 只在 PERCENTAGE 用（0..100）
 * @param exerciseCalorieGoal       只在 SMART 用
 * @param allowNegativeAdjustment   只在 DEVICE_PROJECTION 用
 * @param minElapsedFraction        低於這個比例不外推，直接用目前消耗
 */
public record CalorieAdjustmentConfig(
        CalorieAdjustmentMode mode,
        double exerciseCaloriePercentage,
        double exerciseCalorieGoal,
        boolean allowNegativeAdjustment,
        double minElapsedFraction
) {
    public static final double DEFAULT_MIN_ELAPSED_FRACTION = 0.05;
    public static final double MAX_EXERCISE_CALORIE_GOAL = 5000;

    public CalorieAdjustmentConfig {
        if (mode == null) mode = CalorieAdjustmentMode.FIXED;
    }

    public CalorieAdjustmentConfig(CalorieAdjustmentMode mode,
                                   double exerciseCaloriePercentage,
                                   double exerciseCalorieGoal,
                                   boolean allowNegativeAdjustment) {
        this(mode, exerciseCaloriePercentage, exerciseCalorieGoal, allowNegativeAdjustment,
                DEFAULT_MIN_ELAPSED_FRACTION);
    }

    public static CalorieAdjustmentConfig of(CalorieAdjustmentMode mode) {
        return new CalorieAdjustmentConfig(mode, 100, 0, false);
    }

    public boolean isInRange() {
        return inRange(exerciseCaloriePercentage, 0, 100)
                && inRange(exerciseCalorieGoal, 0, MAX_EXERCISE_CALORIE_GOAL)
                && inRange(minElapsedFraction, 0, 1);
    }

    /** 嚴格版：任何一個值超出範圍就丟 ConfigOutOfRangeException */
    public CalorieAdjustmentConfig requireInRange() {
        require("exerciseCaloriePercentage", exerciseCaloriePercentage, 0, 100);
        require("exerciseCalorieGoal", exerciseCalorieGoal, 0, MAX_EXERCISE_CALORIE_GOAL);
        require("minElapsedFraction", minElapsedFraction, 0, 1);
        return this;
    }

    /** 寬鬆版：夾回範圍內（NaN 視為 0） */
    public CalorieAdjustmentConfig clamped() {
        return new CalorieAdjustmentConfig(
                mode,
                clamp(exerciseCaloriePercentage, 0, 100),
                clamp(exerciseCalorieGoal, 0, MAX_EXERCISE_CALORIE_GOAL),
                allowNegativeAdjustment,
                clamp(minElapsedFraction, 0, 1)
        );
    }

    private static double clamp(double v, double min, double max) {
        if (Double.isNaN(v)) return min;
        return Units.clamp(v, min, max);
    }

    private static boolean inRange(double v, double min, double max) {
        return !Double.isNaN(v) && v >= min && v <= max;
    }

    private static void require(String field, double v, double min, double max) {
        if (!inRange(v, min, max)) throw new ConfigOutOfRangeException(field, v, min, max);
    }
}
