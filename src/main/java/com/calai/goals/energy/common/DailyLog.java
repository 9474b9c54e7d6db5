package com.calai.goals.energy.common;

import java.time.LocalDate;

/** 某一天的體重（可為 null）與總攝取熱量 */
public record DailyLog(
        LocalDate date,
        Double weightKg,
        Double intakeKcal
) {}
