package com.calai.goals.algorithm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FatBreakdownAlgorithm implements AlgorithmId {
    AHA_GUIDELINES("AHA Guidelines"),
    DIETARY_GUIDELINES("Dietary Guidelines");

    private final String key;

    FatBreakdownAlgorithm(String key) {
        this.key = key;
    }

    @JsonValue
    @Override
    public String key() {
        return key;
    }

    @Override
    public AlgorithmCategory category() {
        return AlgorithmCategory.FAT_BREAKDOWN;
    }

    @JsonCreator
    public static FatBreakdownAlgorithm fromKey(String raw) {
        return AlgorithmKeys.resolve(FatBreakdownAlgorithm.class, AlgorithmCategory.FAT_BREAKDOWN, raw);
    }
}
