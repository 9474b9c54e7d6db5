package com.calai.goals.algorithm.model;

public record FatBreakdown(
        double saturatedFatG,
        double transFatG,
        double polyunsaturatedFatG,
        double monounsaturatedFatG
) {
    public double total() {
        return saturatedFatG + transFatG + polyunsaturatedFatG + monounsaturatedFatG;
    }
}
