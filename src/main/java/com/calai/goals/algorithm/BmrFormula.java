package com.calai.goals.algorithm;

import com.calai.goals.common.Sex;

@FunctionalInterface
public interface BmrFormula {

    /** @return kcal/day */
    double bmr(Sex sex, double weightKg, double heightCm, int ageYears);
}
