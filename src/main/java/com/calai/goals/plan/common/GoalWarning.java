package com.calai.goals.plan.common;

public enum GoalWarning {
    MACRO_SPLIT_IMBALANCED,
    EARN_BACK_PERCENT_CLAMPED,
    EXERCISE_GOAL_CLAMPED,
    ELAPSED_FRACTION_CLAMPED,
    UNKNOWN_ADJUSTMENT_MODE,
    TDEE_UNAVAILABLE
}
