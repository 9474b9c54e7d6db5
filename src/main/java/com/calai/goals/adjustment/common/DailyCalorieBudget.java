package com.calai.goals.adjustment.common;

/**
 * @param mode                實際套用的模式（裝置推估沒有資料時會是 FIXED）
 * @param remainingKcal       今天還能吃多少；可以是負的
 * @param exerciseCreditedKcal 因為運動多給的熱量
 * @param progressPercent     已用掉目標的百分比（不小於 0）
 * @param projectedBurnKcal   推估的全天消耗；沒推估時為 null
 * @param adjustmentKcal      推估消耗 − TDEE（clamp 之後）；沒推估時為 null
 */
public record DailyCalorieBudget(
        CalorieAdjustmentMode mode,
        double remainingKcal,
        double exerciseCreditedKcal,
        double progressPercent,
        Double projectedBurnKcal,
        Double adjustmentKcal,
        boolean projectionApplied
) {}
