package com.calai.goals.common;

import java.util.Locale;

/**
 * 活動量 → TDEE 乘數。
 */
public enum ActivityLevel {
    SEDENTARY(1.2),
    LIGHT(1.375),
    MODERATE(1.55),
    HEAVY(1.725);

    private final double multiplier;

    ActivityLevel(double multiplier) {
        this.multiplier = multiplier;
    }

    public double multiplier() {
        return multiplier;
    }

    /** "not_much" 是舊版 key，等同 sedentary；不認得回 null */
    public static ActivityLevel parseOrNull(String raw) {
        if (raw == null) return null;
        String s = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (s) {
            case "sedentary", "not_much" -> SEDENTARY;
            case "light" -> LIGHT;
            case "moderate" -> MODERATE;
            case "heavy" -> HEAVY;
            default -> null;
        };
    }
}
