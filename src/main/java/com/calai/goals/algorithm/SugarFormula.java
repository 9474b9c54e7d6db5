package com.calai.goals.algorithm;

import com.calai.goals.common.Sex;

@FunctionalInterface
public interface SugarFormula {

    /** @return 每日糖上限（g）；不得超過 kcal / 4 */
    int maxGrams(Sex sex, double kcal);
}
