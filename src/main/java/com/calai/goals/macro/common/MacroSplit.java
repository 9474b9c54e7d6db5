package com.calai.goals.macro.common;

import com.calai.goals.common.InvariantViolationException;

/**
 * 碳水 / 蛋白質 / 脂肪 的熱量百分比（整數），必須加總 100。
 */
public record MacroSplit(int carbsPct, int proteinPct, int fatPct) {

    public int sum() {
        return carbsPct + proteinPct + fatPct;
    }

    public boolean isBalanced() {
        return sum() == 100;
    }

    public int get(Macro m) {
        return switch (m) {
            case CARBS -> carbsPct;
            case PROTEIN -> proteinPct;
            case FAT -> fatPct;
        };
    }

    public MacroSplit with(Macro m, int value) {
        return switch (m) {
            case CARBS -> new MacroSplit(value, proteinPct, fatPct);
            case PROTEIN -> new MacroSplit(carbsPct, value, fatPct);
            case FAT -> new MacroSplit(carbsPct, proteinPct, value);
        };
    }

    public MacroSplit requireBalanced() {
        if (!isBalanced()) {
            throw new InvariantViolationException(
                    "Macro percentages must sum to 100 but were " + sum()
                            + " (carbs=" + carbsPct + ", protein=" + proteinPct + ", fat=" + fatPct + ")");
        }
        return this;
    }
}
