package com.calai.goals.plan.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * 每日目標的欄位（key 與目標儲存服務用的名稱一致）。
 * 單位固定：熱量 kcal、巨量營養素 g、礦物質 mg、維生素 A mcg、水 ml。
 */
public enum GoalField {
    CALORIES("calories", GoalCategory.ENERGY),

    PROTEIN("protein", GoalCategory.MACROS),
    CARBS("carbs", GoalCategory.MACROS),
    FAT("fat", GoalCategory.MACROS),
    DIETARY_FIBER("dietary_fiber", GoalCategory.MACROS),

    SATURATED_FAT("saturated_fat", GoalCategory.FAT_BREAKDOWN),
    TRANS_FAT("trans_fat", GoalCategory.FAT_BREAKDOWN),
    POLYUNSATURATED_FAT("polyunsaturated_fat", GoalCategory.FAT_BREAKDOWN),
    MONOUNSATURATED_FAT("monounsaturated_fat", GoalCategory.FAT_BREAKDOWN),

    CHOLESTEROL("cholesterol", GoalCategory.MINERALS),
    SODIUM("sodium", GoalCategory.MINERALS),
    POTASSIUM("potassium", GoalCategory.MINERALS),
    CALCIUM("calcium", GoalCategory.MINERALS),
    IRON("iron", GoalCategory.MINERALS),

    SUGARS("sugars", GoalCategory.SUGAR),

    VITAMIN_A("vitamin_a", GoalCategory.VITAMINS),
    VITAMIN_C("vitamin_c", GoalCategory.VITAMINS),

    WATER_GOAL_ML("water_goal_ml", GoalCategory.HYDRATION),

    TARGET_EXERCISE_DURATION_MINUTES("target_exercise_duration_minutes", GoalCategory.EXERCISE),
    TARGET_EXERCISE_CALORIES_BURNED("target_exercise_calories_burned", GoalCategory.EXERCISE);

    private final String key;
    private final GoalCategory category;

    GoalField(String key, GoalCategory category) {
        this.key = key;
        this.category = category;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public GoalCategory category() {
        return category;
    }

    public static Set<GoalField> in(Set<GoalCategory> categories) {
        Set<GoalField> out = EnumSet.noneOf(GoalField.class);
        for (GoalField f : values()) {
            if (categories.contains(f.category)) out.add(f);
        }
        return out;
    }

    @JsonCreator
    public static GoalField fromKey(String raw) {
        if (raw == null) throw new IllegalArgumentException("goal field is required");
        String k = raw.trim();
        for (GoalField f : values()) {
            if (f.key.equalsIgnoreCase(k) || f.name().equalsIgnoreCase(k)) return f;
        }
        throw new IllegalArgumentException("Unknown goal field: " + raw);
    }
}
