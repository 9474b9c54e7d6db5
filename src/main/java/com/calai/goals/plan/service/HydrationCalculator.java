package com.calai.goals.plan.service;

import com.calai.goals.common.Sex;
import com.calai.goals.common.Units;
import com.calai.goals.config.GoalsProperties;
import com.calai.goals.plan.common.GoalField;
import com.calai.goals.plan.common.GoalPatch;
import org.springframework.stereotype.Component;

/**
 * 喝水目標與每日運動目標（HYDRATION / EXERCISE 兩類）。
 */
@Component
public class HydrationCalculator {

    static final int MAX_EXERCISE_KCAL = 5000;

    private final GoalsProperties props;

    public HydrationCalculator(GoalsProperties props) {
        this.props = props;
    }

    /** ✅ AUTO 水量：round(kg * 35) 並套性別上限；性別不明用較保守的女性上限 */
    public int waterGoalMl(Sex sex, double weightKg) {
        GoalsProperties.Water w = props.getWater();
        int base = (int) Math.round(weightKg * w.getMlPerKg());
        if (base < 0) base = 0;
        int cap = (sex == Sex.MALE) ? w.getMaleCapMl() : w.getFemaleCapMl();
        return Math.min(base, cap);
    }

    public int exerciseDurationMinutes() {
        return Math.max(0, props.getExercise().getDurationMinutes());
    }

    public int exerciseCaloriesBurned() {
        return Units.clamp(props.getExercise().getCaloriesBurned(), 0, MAX_EXERCISE_KCAL).intValue();
    }

    public GoalPatch targets(Sex sex, double weightKg) {
        return GoalPatch.builder()
                .put(GoalField.WATER_GOAL_ML, waterGoalMl(sex, weightKg))
                .put(GoalField.TARGET_EXERCISE_DURATION_MINUTES, exerciseDurationMinutes())
                .put(GoalField.TARGET_EXERCISE_CALORIES_BURNED, exerciseCaloriesBurned())
                .build();
    }
}
