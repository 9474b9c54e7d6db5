package com.calai.goals.adjustment.common;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 運動消耗怎麼「賺回」當天可吃的熱量。
 */
public enum CalorieAdjustmentMode {
    DYNAMIC("dynamic"),
    FIXED("fixed"),
    PERCENTAGE("percentage"),
    SMART("smart"),
    DEVICE_PROJECTION("device_projection");

    private final String key;

    CalorieAdjustmentMode(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * 不認得回 null（呼叫端決定要不要退回 FIXED 並記 warning）。
     * "tdee" 是舊版裝置推估模式的 key。
     */
    public static CalorieAdjustmentMode parseOrNull(String raw) {
        if (raw == null) return null;
        String k = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (k) {
            case "dynamic" -> DYNAMIC;
            case "fixed" -> FIXED;
            case "percentage" -> PERCENTAGE;
            case "smart" -> SMART;
            case "device_projection", "tdee" -> DEVICE_PROJECTION;
            default -> null;
        };
    }
}
