package com.calai.goals.adjustment.common;

/**
 * 當天的進食與消耗（kcal）。partialDayBurnKcal / elapsedDayFraction 只有裝置推估模式會用到。
 */
public record ActivityEnergyRecord(
        double eatenKcal,
        double burnedKcal,
        Double partialDayBurnKcal,
        Double elapsedDayFraction
) {
    public static ActivityEnergyRecord of(double eatenKcal, double burnedKcal) {
        return new ActivityEnergyRecord(eatenKcal, burnedKcal, null, null);
    }

    public boolean hasProjectionSample() {
        return partialDayBurnKcal != null && Double.isFinite(partialDayBurnKcal)
                && elapsedDayFraction != null && Double.isFinite(elapsedDayFraction)
                && elapsedDayFraction > 0;
    }

    /** 嚴格版：經過比例必須在 (0, 1] */
    public ActivityEnergyRecord requireValidElapsedFraction() {
        double f = (elapsedDayFraction == null) ? Double.NaN : elapsedDayFraction;
        if (!(f > 0 && f <= 1)) {
            throw new ConfigOutOfRangeException("elapsedDayFraction", f, 0, 1);
        }
        return this;
    }
}
