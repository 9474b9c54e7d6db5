package com.calai.goals.plan.dto;

import com.calai.goals.adjustment.common.DailyCalorieBudget;
import com.calai.goals.plan.common.GoalWarning;

import java.util.List;

public record RemainingResponse(
        DailyCalorieBudget budget,
        List<GoalWarning> warnings
) {}
