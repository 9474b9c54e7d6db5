package com.calai.goals.algorithm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum VitaminAlgorithm implements AlgorithmId {
    RDA_STANDARD("RDA Standard");

    private final String key;

    VitaminAlgorithm(String key) {
        this.key = key;
    }

    @JsonValue
    @Override
    public String key() {
        return key;
    }

    @Override
    public AlgorithmCategory category() {
        return AlgorithmCategory.VITAMIN;
    }

    @JsonCreator
    public static VitaminAlgorithm fromKey(String raw) {
        return AlgorithmKeys.resolve(VitaminAlgorithm.class, AlgorithmCategory.VITAMIN, raw);
    }
}
