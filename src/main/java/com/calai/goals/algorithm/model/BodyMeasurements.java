package com.calai.goals.algorithm.model;

/**
 * 體脂估算的輸入；各公式只用得到其中一部分，缺的欄位留 null。
 */
public record BodyMeasurements(
        Double heightCm,
        Double weightKg,
        Integer ageYears,
        Double waistCm,
        Double neckCm,
        Double hipCm
) {}
