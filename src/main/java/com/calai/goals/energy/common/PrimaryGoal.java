package com.calai.goals.energy.common;

import java.util.Locale;

public enum PrimaryGoal {
    LOSE,
    MAINTAIN,
    GAIN;

    /** 舊資料可能存 "lose_weight" / "gain_weight"；不認得一律 MAINTAIN */
    public static PrimaryGoal parseOrDefault(String raw) {
        String k = (raw == null) ? "" : raw.trim().toUpperCase(Locale.ROOT);
        return switch (k) {
            case "LOSE", "LOSE_WEIGHT" -> LOSE;
            case "GAIN", "GAIN_WEIGHT" -> GAIN;
            default -> MAINTAIN;
        };
    }
}
