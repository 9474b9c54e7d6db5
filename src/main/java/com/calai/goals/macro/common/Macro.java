package com.calai.goals.macro.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 三個連動滑桿；宣告順序決定 rebalance 時誰先按比例分、誰拿餘數。
 */
public enum Macro {
    CARBS(4.0),
    PROTEIN(4.0),
    FAT(9.0);

    private final double kcalPerGram;

    Macro(double kcalPerGram) {
        this.kcalPerGram = kcalPerGram;
    }

    public double kcalPerGram() {
        return kcalPerGram;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Macro fromKey(String raw) {
        if (raw == null) throw new IllegalArgumentException("macro is required");
        return Macro.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
