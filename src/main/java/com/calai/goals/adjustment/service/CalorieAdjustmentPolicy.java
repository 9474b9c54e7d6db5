package com.calai.goals.adjustment.service;

import com.calai.goals.adjustment.common.ActivityEnergyRecord;
import com.calai.goals.adjustment.common.CalorieAdjustmentConfig;
import com.calai.goals.adjustment.common.CalorieAdjustmentMode;
import com.calai.goals.adjustment.common.DailyCalorieBudget;
import org.springframework.stereotype.Component;

/**
 * 依模式算出「今天還剩多少熱量」。
 * 設定值要在邊界先檢查 / clamp 過；這裡只有 PERCENTAGE 的百分比會再夾一次。
 */
@Component
public class CalorieAdjustmentPolicy {

    /**
     * @param tdee DEVICE_PROJECTION 才用到；null 視同沒有推估資料，退回 FIXED
     */
    public DailyCalorieBudget evaluate(double goal, Double tdee,
                                       ActivityEnergyRecord record, CalorieAdjustmentConfig config) {
        CalorieAdjustmentConfig cfg = (config == null)
                ? CalorieAdjustmentConfig.of(CalorieAdjustmentMode.FIXED)
                : config;

        double eaten = record.eatenKcal();
        double burned = record.burnedKcal();
        double base = goal - eaten;

        return switch (cfg.mode()) {
            case FIXED -> budget(CalorieAdjustmentMode.FIXED, goal, base, base, null, null);
            case DYNAMIC -> budget(CalorieAdjustmentMode.DYNAMIC, goal, base, base + burned, null, null);
            case PERCENTAGE -> {
                double pct = Math.max(0, Math.min(100, cfg.exerciseCaloriePercentage()));
                yield budget(CalorieAdjustmentMode.PERCENTAGE, goal, base, base + burned * pct / 100.0, null, null);
            }
            case SMART -> {
                double surplus = Math.max(0, burned - cfg.exerciseCalorieGoal());
                yield budget(CalorieAdjustmentMode.SMART, goal, base, base + surplus, null, null);
            }
            case DEVICE_PROJECTION -> deviceProjection(goal, tdee, base, record, cfg);
        };
    }

    /** 一天剛開始（比例很小）時不外推，直接把目前的消耗當全天 */
    public static double projectFullDayBurn(double partialBurn, double elapsedFraction, double minElapsedFraction) {
        double f = Math.min(1.0, elapsedFraction);
        if (f < minElapsedFraction) return partialBurn;
        return partialBurn / f;
    }

    private DailyCalorieBudget deviceProjection(double goal, Double tdee, double base,
                                                ActivityEnergyRecord record, CalorieAdjustmentConfig cfg) {
        // 還沒有可用的樣本或沒有 TDEE：退回 FIXED
        if (!record.hasProjectionSample() || tdee == null || !Double.isFinite(tdee)) {
            return budget(CalorieAdjustmentMode.FIXED, goal, base, base, null, null);
        }
        double projected = projectFullDayBurn(
                record.partialDayBurnKcal(), record.elapsedDayFraction(), cfg.minElapsedFraction());
        double adjustment = projected - tdee;
        if (!cfg.allowNegativeAdjustment()) adjustment = Math.max(0, adjustment);

        return budget(CalorieAdjustmentMode.DEVICE_PROJECTION, goal, base, base + adjustment, projected, adjustment);
    }

    private static DailyCalorieBudget budget(CalorieAdjustmentMode mode, double goal, double base,
                                             double remaining, Double projected, Double adjustment) {
        double credited = Math.max(0, remaining - base);
        return new DailyCalorieBudget(
                mode,
                remaining,
                credited,
                progressPercent(goal, remaining),
                projected,
                adjustment,
                projected != null
        );
    }

    static double progressPercent(double goal, double remaining) {
        if (goal <= 0) return 0;
        return Math.max(0, (goal - remaining) / goal * 100.0);
    }
}
