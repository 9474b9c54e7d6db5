package com.calai.goals.plan.dto;

/**
 * 演算法 key（enum 名稱或顯示名稱都可以，例如 "Mifflin-St Jeor" / "HARRIS_BENEDICT"）。
 * 沒帶的類別用 goals.algorithms.* 的預設。
 */
public record AlgorithmSelectionRequest(
        String bmr,
        String bodyFat,
        String fatBreakdown,
        String mineral,
        String vitamin,
        String sugar
) {}
