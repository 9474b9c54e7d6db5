package com.calai.goals.algorithm.model;

public record VitaminTargets(
        int vitaminAMcg, // mcg RAE
        int vitaminCMg
) {}
