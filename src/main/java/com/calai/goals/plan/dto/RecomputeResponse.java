package com.calai.goals.plan.dto;

import com.calai.goals.plan.common.GoalCategory;
import com.calai.goals.plan.common.GoalSnapshot;

import java.util.Set;

public record RecomputeResponse(
        Set<GoalCategory> recomputed,
        GoalSnapshot goals
) {}
