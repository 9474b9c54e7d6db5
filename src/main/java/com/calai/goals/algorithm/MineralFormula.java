package com.calai.goals.algorithm;

import com.calai.goals.algorithm.model.MineralTargets;
import com.calai.goals.common.Sex;

@FunctionalInterface
public interface MineralFormula {

    MineralTargets targets(Sex sex, int ageYears);
}
