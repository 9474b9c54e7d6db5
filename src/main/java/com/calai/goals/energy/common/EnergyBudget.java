package com.calai.goals.energy.common;

/** 全部 kcal；dailyCalorieGoal 已四捨五入到 10 kcal */
public record EnergyBudget(
        double bmr,
        double tdee,
        int dailyCalorieGoal
) {}
