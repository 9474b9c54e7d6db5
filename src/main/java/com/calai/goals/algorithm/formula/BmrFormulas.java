package com.calai.goals.algorithm.formula;

import com.calai.goals.common.Sex;

public final class BmrFormulas {
    private BmrFormulas() {}

    /** Mifflin-St Jeor（1990）：預設公式 */
    public static double mifflinStJeor(Sex sex, double weightKg, double heightCm, int ageYears) {
        double s = sex.isMale() ? 5.0 : -161.0;
        return 10.0 * weightKg
                + 6.25 * heightCm
                - 5.0 * ageYears
                + s;
    }

    /** Harris-Benedict，Roza &amp; Shizgal（1984）修正版 */
    public static double harrisBenedict(Sex sex, double weightKg, double heightCm, int ageYears) {
        if (sex.isMale()) {
            return 88.362 + 13.397 * weightKg + 4.799 * heightCm - 5.677 * ageYears;
        }
        return 447.593 + 9.247 * weightKg + 3.098 * heightCm - 4.330 * ageYears;
    }

    /** Owen（1986 女性 / 1987 男性）：只看體重 */
    public static double owen(Sex sex, double weightKg, double heightCm, int ageYears) {
        return sex.isMale()
                ? 879.0 + 10.2 * weightKg
                : 795.0 + 7.18 * weightKg;
    }
}
