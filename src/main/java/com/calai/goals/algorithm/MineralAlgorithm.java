package com.calai.goals.algorithm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 礦物質目標（膽固醇、鈉、鉀、鈣、鐵）。
 * 目前只有 NASEM DRI 一種，新增來源時在這裡加常數，再到 AlgorithmRegistry 補 switch 分支。
 */
public enum MineralAlgorithm implements AlgorithmId {
    RDA_STANDARD("RDA Standard");

    private final String key;

    MineralAlgorithm(String key) {
        this.key = key;
    }

    @JsonValue
    @Override
    public String key() {
        return key;
    }

    @Override
    public AlgorithmCategory category() {
        return AlgorithmCategory.MINERAL;
    }

    @JsonCreator
    public static MineralAlgorithm fromKey(String raw) {
        return AlgorithmKeys.resolve(MineralAlgorithm.class, AlgorithmCategory.MINERAL, raw);
    }
}
