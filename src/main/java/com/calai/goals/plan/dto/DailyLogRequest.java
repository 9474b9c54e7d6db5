package com.calai.goals.plan.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/** 體重兩制擇一帶；沒量體重的日子兩個都不帶 */
public record DailyLogRequest(
        @NotNull(message = "Date is required") LocalDate date,
        Double weightKg,
        Double weightLbs,
        Double intakeKcal
) {}
