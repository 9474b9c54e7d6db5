package com.calai.goals.algorithm;

import com.calai.goals.algorithm.model.VitaminTargets;
import com.calai.goals.common.Sex;

@FunctionalInterface
public interface VitaminFormula {

    VitaminTargets targets(Sex sex, int ageYears);
}
