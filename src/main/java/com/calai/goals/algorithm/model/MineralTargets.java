package com.calai.goals.algorithm.model;

/** 單位一律 mg */
public record MineralTargets(
        int cholesterolMg,
        int sodiumMg,
        int potassiumMg,
        int calciumMg,
        int ironMg
) {}
