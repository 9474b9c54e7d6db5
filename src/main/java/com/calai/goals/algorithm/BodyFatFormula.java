package com.calai.goals.algorithm;

import com.calai.goals.algorithm.model.BodyMeasurements;
import com.calai.goals.common.Sex;

@FunctionalInterface
public interface BodyFatFormula {

    /** @return 體脂 %；量測不足以計算時回 null */
    Double percent(Sex sex, BodyMeasurements m);
}
