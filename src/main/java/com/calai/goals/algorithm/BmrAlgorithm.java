package com.calai.goals.algorithm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** BMR 公式；預設 Mifflin-St Jeor */
public enum BmrAlgorithm implements AlgorithmId {
    MIFFLIN_ST_JEOR("Mifflin-St Jeor"),
    HARRIS_BENEDICT("Harris-Benedict"),
    OWEN("Owen");

    private final String key;

    BmrAlgorithm(String key) {
        this.key = key;
    }

    @JsonValue
    @Override
    public String key() {
        return key;
    }

    @Override
    public AlgorithmCategory category() {
        return AlgorithmCategory.BMR;
    }

    @JsonCreator
    public static BmrAlgorithm fromKey(String raw) {
        return AlgorithmKeys.resolve(BmrAlgorithm.class, AlgorithmCategory.BMR, raw);
    }
}
