package com.calai.goals.algorithm.formula;

import com.calai.goals.algorithm.model.BodyMeasurements;
import com.calai.goals.common.Sex;

public final class BodyFatFormulas {
    private BodyFatFormulas() {}

    /**
     * U.S. Navy 圍度法（Hodgdon &amp; Beckett，公制）。
     * 男：腰、頸、身高；女：另需臀圍。
     */
    public static Double usNavy(Sex sex, BodyMeasurements m) {
        if (m == null || !positive(m.heightCm()) || !positive(m.waistCm()) || !positive(m.neckCm())) return null;

        double density;
        if (sex.isMale()) {
            double girth = m.waistCm() - m.neckCm();
            if (girth <= 0) return null;
            density = 1.0324 - 0.19077 * Math.log10(girth) + 0.15456 * Math.log10(m.heightCm());
        } else {
            if (!positive(m.hipCm())) return null;
            double girth = m.waistCm() + m.hipCm() - m.neckCm();
            if (girth <= 0) return null;
            density = 1.29579 - 0.35004 * Math.log10(girth) + 0.22100 * Math.log10(m.heightCm());
        }
        return sane(495.0 / density - 450.0);
    }

    /** Deurenberg（1991）：1.2×BMI + 0.23×年齡 − 10.8×(男=1) − 5.4 */
    public static Double bmiDeurenberg(Sex sex, BodyMeasurements m) {
        if (m == null || !positive(m.heightCm()) || !positive(m.weightKg()) || m.ageYears() == null) return null;
        double meters = m.heightCm() / 100.0;
        double bmi = m.weightKg() / (meters * meters);
        double maleFlag = sex.isMale() ? 1.0 : 0.0;
        return sane(1.2 * bmi + 0.23 * m.ageYears() - 10.8 * maleFlag - 5.4);
    }

    private static boolean positive(Double v) {
        return v != null && Double.isFinite(v) && v > 0;
    }

    private static Double sane(double pct) {
        if (!Double.isFinite(pct) || pct <= 0) return null;
        return Math.round(pct * 10.0) / 10.0;
    }
}
