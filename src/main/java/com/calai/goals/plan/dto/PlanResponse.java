package com.calai.goals.plan.dto;

import com.calai.goals.algorithm.AlgorithmSelection;
import com.calai.goals.energy.common.BmiClass;
import com.calai.goals.energy.common.EnergyBudget;
import com.calai.goals.macro.common.MacroSplit;
import com.calai.goals.plan.common.GoalPatch;
import com.calai.goals.plan.common.GoalWarning;

import java.util.List;

/**
 * ready=false 時只有 missingFields 有意義，其他欄位為 null。
 * bodyFatPercent：圍度不足時為 null。
 */
public record PlanResponse(
        boolean ready,
        List<String> missingFields,
        EnergyBudget energy,
        Double bmi,
        BmiClass bmiClass,
        Double bodyFatPercent,
        MacroSplit macroSplit,
        AlgorithmSelection algorithms,
        GoalPatch goals,
        List<GoalWarning> warnings
) {
    public static PlanResponse unready(List<String> missingFields) {
        return new PlanResponse(false, missingFields, null, null, null, null, null, null, null, List.of());
    }
}
