package com.calai.goals.plan.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 某一天完整的目標值。不可變：merge 一律回傳新的 snapshot。
 */
public record GoalSnapshot(Map<GoalField, Double> values) {

    public GoalSnapshot {
        EnumMap<GoalField, Double> copy = new EnumMap<>(GoalField.class);
        if (values != null) {
            values.forEach((k, v) -> {
                if (k != null && v != null) copy.put(k, v);
            });
        }
        values = Collections.unmodifiableMap(copy);
    }

    public static GoalSnapshot empty() {
        return new GoalSnapshot(Map.of());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static GoalSnapshot fromJson(Map<String, Double> raw) {
        Map<GoalField, Double> out = new EnumMap<>(GoalField.class);
        if (raw != null) {
            raw.forEach((k, v) -> {
                if (v != null) out.put(GoalField.fromKey(k), v);
            });
        }
        return new GoalSnapshot(out);
    }

    public Double get(GoalField field) {
        return values.get(field);
    }

    /**
     * 把 patch 蓋上去，但 protectedFields（使用者手動改過、這次不該被覆寫的欄位）保留原值。
     * patch 沒帶到的欄位一律不動。
     */
    public GoalSnapshot merge(GoalPatch patch, Set<GoalField> protectedFields) {
        Map<GoalField, Double> out = new EnumMap<>(GoalField.class);
        out.putAll(values);
        if (patch == null) return new GoalSnapshot(out);

        Set<GoalField> keep = (protectedFields == null) ? Set.of() : protectedFields;
        patch.values().forEach((field, v) -> {
            if (keep.contains(field) && values.containsKey(field)) return;
            out.put(field, v);
        });
        return new GoalSnapshot(out);
    }

    @JsonValue
    public Map<String, Number> asJson() {
        return toJsonMap(values);
    }

    // 整數值輸出成整數（2210 而不是 2210.0）
    static Map<String, Number> toJsonMap(Map<GoalField, Double> values) {
        Map<String, Number> out = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            boolean whole = v == Math.rint(v) && Math.abs(v) < Long.MAX_VALUE;
            out.put(k.key(), whole ? (Number) v.longValue() : v);
        });
        return out;
    }
}
