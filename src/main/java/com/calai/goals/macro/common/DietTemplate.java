package com.calai.goals.macro.common;

import java.util.Locale;

/**
 * 預設飲食模板（碳水/蛋白質/脂肪）。CUSTOM 沒有固定值，由使用者滑桿決定。
 */
public enum DietTemplate {
    BALANCED(new MacroSplit(40, 30, 30)),
    CLASSIC(new MacroSplit(45, 25, 30)),
    HIGH_PROTEIN(new MacroSplit(45, 30, 25)),
    HEALTHY_EATING(new MacroSplit(50, 20, 30)),
    CUSTOM(null);

    private final MacroSplit split;

    DietTemplate(MacroSplit split) {
        this.split = split;
    }

    /**
     * @param custom CUSTOM 時使用；其他模板忽略
     */
    public MacroSplit resolve(MacroSplit custom) {
        if (this == CUSTOM) {
            return (custom != null) ? custom : BALANCED.split;
        }
        return split;
    }

    public static DietTemplate parseOrDefault(String raw) {
        if (raw == null || raw.isBlank()) return BALANCED;
        String k = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (DietTemplate t : values()) {
            if (t.name().equals(k)) return t;
        }
        return BALANCED;
    }
}
