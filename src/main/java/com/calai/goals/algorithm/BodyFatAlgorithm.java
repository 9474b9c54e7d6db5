package com.calai.goals.algorithm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BodyFatAlgorithm implements AlgorithmId {
    US_NAVY("U.S. Navy"),
    BMI_DEURENBERG("BMI (Deurenberg)");

    private final String key;

    BodyFatAlgorithm(String key) {
        this.key = key;
    }

    @JsonValue
    @Override
    public String key() {
        return key;
    }

    @Override
    public AlgorithmCategory category() {
        return AlgorithmCategory.BODY_FAT;
    }

    @JsonCreator
    public static BodyFatAlgorithm fromKey(String raw) {
        return AlgorithmKeys.resolve(BodyFatAlgorithm.class, AlgorithmCategory.BODY_FAT, raw);
    }
}
