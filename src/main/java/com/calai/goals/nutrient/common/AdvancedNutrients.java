package com.calai.goals.nutrient.common;

import com.calai.goals.algorithm.model.FatBreakdown;
import com.calai.goals.algorithm.model.MineralTargets;
import com.calai.goals.algorithm.model.VitaminTargets;

public record AdvancedNutrients(
        FatBreakdown fat,
        MineralTargets minerals,
        VitaminTargets vitamins,
        int sugarG
) {}
