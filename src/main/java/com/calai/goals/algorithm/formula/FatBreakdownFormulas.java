package com.calai.goals.algorithm.formula;

import com.calai.goals.algorithm.model.FatBreakdown;
import com.calai.goals.common.Units;

/**
 * 脂肪細項：飽和 / 反式依熱量比例給上限，多元不飽和取 AMDR 上緣（10% 熱量），
 * 剩下的都是單元不飽和。每一項都先跟「剩餘脂肪」取 min，再捨去到 0.1 g，所以加總不會超過總脂肪。
 */
public final class FatBreakdownFormulas {
    private FatBreakdownFormulas() {}

    private static final double KCAL_PER_G_FAT = 9.0;

    // AHA：飽和脂肪 5–6% 熱量，取 6%
    static final double AHA_SATURATED_PCT = 0.06;
    // 2020–2025 Dietary Guidelines：飽和脂肪 < 10% 熱量
    static final double DGA_SATURATED_PCT = 0.10;
    // 反式脂肪：WHO / AHA 皆為 < 1% 熱量
    static final double TRANS_PCT = 0.01;
    // NASEM AMDR：n-6 多元不飽和 5–10% 熱量
    static final double POLY_PCT = 0.10;

    public static FatBreakdown ahaGuidelines(double kcal, double totalFatG) {
        return split(kcal, totalFatG, AHA_SATURATED_PCT);
    }

    public static FatBreakdown dietaryGuidelines(double kcal, double totalFatG) {
        return split(kcal, totalFatG, DGA_SATURATED_PCT);
    }

    private static FatBreakdown split(double kcal, double totalFatG, double saturatedPct) {
        double total = Math.max(0, totalFatG);
        double safeKcal = Math.max(0, kcal);

        double sat = Units.floor(Math.min(total, safeKcal * saturatedPct / KCAL_PER_G_FAT), 1);
        double left = total - sat;

        double trans = Units.floor(Math.min(left, safeKcal * TRANS_PCT / KCAL_PER_G_FAT), 1);
        left -= trans;

        double poly = Units.floor(Math.min(left, safeKcal * POLY_PCT / KCAL_PER_G_FAT), 1);
        left -= poly;

        double mono = Units.floor(Math.max(0, left), 1);
        return new FatBreakdown(sat, trans, poly, mono);
    }
}
