package com.calai.goals.plan.common;

import com.calai.goals.algorithm.AlgorithmCategory;

import java.util.EnumSet;
import java.util.Set;

/**
 * 目標欄位的分組；重算時以「類別」為單位，只覆寫被重算的類別。
 */
public enum GoalCategory {
    ENERGY,
    MACROS,
    FAT_BREAKDOWN,
    MINERALS,
    VITAMINS,
    SUGAR,
    HYDRATION,
    EXERCISE;

    /** 換某個演算法後需要重算哪些類別 */
    public static Set<GoalCategory> affectedBy(AlgorithmCategory algorithm) {
        return switch (algorithm) {
            // 熱量變了要整份 plan 重算，這裡只標出直接受影響的類別
            case BMR -> EnumSet.of(ENERGY, MACROS);
            case BODY_FAT -> EnumSet.noneOf(GoalCategory.class);
            case FAT_BREAKDOWN -> EnumSet.of(FAT_BREAKDOWN);
            case MINERAL -> EnumSet.of(MINERALS);
            case VITAMIN -> EnumSet.of(VITAMINS);
            case SUGAR -> EnumSet.of(SUGAR);
        };
    }

    public static Set<GoalCategory> affectedBy(Set<AlgorithmCategory> algorithms) {
        Set<GoalCategory> out = EnumSet.noneOf(GoalCategory.class);
        for (AlgorithmCategory a : algorithms) out.addAll(affectedBy(a));
        return out;
    }
}
