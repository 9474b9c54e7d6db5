package com.calai.goals.plan.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.time.LocalDate;

public record PlanRequest(
        String gender,

        // 年齡：直接帶 age，或帶生日由伺服器依時區算整年
        @Min(value = 1, message = "Age must be greater than 0") Integer age,
        LocalDate birthDate,

        // 身高（兩制擇一帶；英制帶齊兩個欄位）
        @DecimalMax(value = "300", message = "Height must be at most 300 cm") Double heightCm,
        Short heightFeet,
        Short heightInches,

        // 體重（兩制擇一帶）
        @DecimalMax(value = "800", message = "Weight must be at most 800 kg") Double weightKg,
        @DecimalMax(value = "1000", message = "Weight must be at most 1000 lbs") Double weightLbs,

        // 圍度（選填，有帶才估體脂）
        Double waistCm,
        Double neckCm,
        Double hipCm,

        String exerciseLevel,
        String goal,

        // 飲食模板；CUSTOM 時用下面三個百分比
        String dietTemplate,
        @Min(0) @Max(100) Integer carbsPct,
        @Min(0) @Max(100) Integer proteinPct,
        @Min(0) @Max(100) Integer fatPct,

        @Valid AlgorithmSelectionRequest algorithms
) {}
