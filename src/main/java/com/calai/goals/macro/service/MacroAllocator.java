package com.calai.goals.macro.service;

import com.calai.goals.macro.common.Macro;
import com.calai.goals.macro.common.MacroSplit;
import com.calai.goals.macro.common.MacroTargets;
import org.springframework.stereotype.Component;

@Component
public class MacroAllocator {

    // 纖維：每 1000 kcal 14 g（Adequate Intake 的算法）
    static final double FIBER_G_PER_1000_KCAL = 14.0;

    public MacroTargets allocate(int kcal, MacroSplit split) {
        return new MacroTargets(
                grams(kcal, split.carbsPct(), Macro.CARBS),
                grams(kcal, split.proteinPct(), Macro.PROTEIN),
                grams(kcal, split.fatPct(), Macro.FAT),
                fiberGrams(kcal),
                split.isBalanced()
        );
    }

    /** 百分比不是 100 直接丟 InvariantViolationException */
    public MacroTargets allocateStrict(int kcal, MacroSplit split) {
        return allocate(kcal, split.requireBalanced());
    }

    static int grams(int kcal, int pct, Macro macro) {
        return (int) Math.round(kcal * (pct / 100.0) / macro.kcalPerGram());
    }

    static int fiberGrams(int kcal) {
        return (int) Math.round(kcal / 1000.0 * FIBER_G_PER_1000_KCAL);
    }
}
