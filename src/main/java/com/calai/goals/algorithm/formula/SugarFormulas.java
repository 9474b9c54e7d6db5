package com.calai.goals.algorithm.formula;

import com.calai.goals.common.Sex;

public final class SugarFormulas {
    private SugarFormulas() {}

    // AHA 添加糖上限（g/day）
    static final int AHA_MALE_G = 36;
    static final int AHA_FEMALE_G = 25;

    /**
     * WHO free sugars 上限（一般建議 &lt;10% energy）
     * Sugar_G = kcal × 0.10 ÷ 4
     * ✅ 用 floor：避免因四捨五入導致 &gt;10%
     */
    public static int whoGuidelines(Sex sex, double kcal) {
        return percentOfEnergy(kcal, 0.10);
    }

    /** WHO 條件式建議：&lt;5% energy */
    public static int whoStrict(Sex sex, double kcal) {
        return percentOfEnergy(kcal, 0.05);
    }

    /** AHA：男 36 g / 女 25 g，但低熱量時不超過 10% energy */
    public static int ahaAddedSugar(Sex sex, double kcal) {
        int aha = sex.isMale() ? AHA_MALE_G : AHA_FEMALE_G;
        return Math.min(aha, percentOfEnergy(kcal, 0.10));
    }

    private static int percentOfEnergy(double kcal, double pct) {
        double safe = Math.max(0, kcal);
        return (int) Math.floor(safe * pct / 4.0d);
    }
}
