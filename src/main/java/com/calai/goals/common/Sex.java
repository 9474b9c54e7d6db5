package com.calai.goals.common;

import java.util.Locale;

public enum Sex {
    MALE, FEMALE;

    /** 只認 "MALE"/"M" 與 "FEMALE"/"F"；其他一律 null，交給 readiness 檢查 */
    public static Sex parseOrNull(String raw) {
        if (raw == null) return null;
        String s = raw.trim().toUpperCase(Locale.ROOT);
        return switch (s) {
            case "MALE", "M" -> MALE;
            case "FEMALE", "F" -> FEMALE;
            default -> null;
        };
    }

    public boolean isMale() {
        return this == MALE;
    }
}
