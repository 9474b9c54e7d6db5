package com.calai.goals.plan.common;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 一次計算「只重算了哪些欄位」。怎麼蓋回使用者的目標由呼叫端決定（見 GoalSnapshot.merge）。
 */
public record GoalPatch(Map<GoalField, Double> values) {

    public GoalPatch {
        EnumMap<GoalField, Double> copy = new EnumMap<>(GoalField.class);
        if (values != null) {
            values.forEach((k, v) -> {
                if (k != null && v != null) copy.put(k, v);
            });
        }
        values = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Double get(GoalField field) {
        return values.get(field);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Set<GoalCategory> categories() {
        Set<GoalCategory> out = EnumSet.noneOf(GoalCategory.class);
        for (GoalField f : values.keySet()) out.add(f.category());
        return out;
    }

    /** other 的欄位優先 */
    public GoalPatch plus(GoalPatch other) {
        Map<GoalField, Double> out = new EnumMap<>(GoalField.class);
        out.putAll(values);
        if (other != null) out.putAll(other.values);
        return new GoalPatch(out);
    }

    @JsonValue
    public Map<String, Number> asJson() {
        return GoalSnapshot.toJsonMap(values);
    }

    public static final class Builder {
        private final Map<GoalField, Double> values = new EnumMap<>(GoalField.class);

        private Builder() {}

        public Builder put(GoalField field, double value) {
            values.put(field, value);
            return this;
        }

        public GoalPatch build() {
            return new GoalPatch(values);
        }
    }
}
