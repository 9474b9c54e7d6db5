package com.calai.goals.algorithm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** 糖上限；WHO 10% 為預設 */
public enum SugarAlgorithm implements AlgorithmId {
    WHO_GUIDELINES("WHO Guidelines"),
    WHO_STRICT("WHO Strict"),
    AHA_ADDED_SUGAR("AHA Added Sugar");

    private final String key;

    SugarAlgorithm(String key) {
        this.key = key;
    }

    @JsonValue
    @Override
    public String key() {
        return key;
    }

    @Override
    public AlgorithmCategory category() {
        return AlgorithmCategory.SUGAR;
    }

    @JsonCreator
    public static SugarAlgorithm fromKey(String raw) {
        return AlgorithmKeys.resolve(SugarAlgorithm.class, AlgorithmCategory.SUGAR, raw);
    }
}
