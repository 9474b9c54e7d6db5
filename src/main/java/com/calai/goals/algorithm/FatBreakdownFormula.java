package com.calai.goals.algorithm;

import com.calai.goals.algorithm.model.FatBreakdown;

@FunctionalInterface
public interface FatBreakdownFormula {

    /** 細項加總不得超過 totalFatG */
    FatBreakdown split(double kcal, double totalFatG);
}
