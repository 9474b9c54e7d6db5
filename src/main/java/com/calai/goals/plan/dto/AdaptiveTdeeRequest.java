package com.calai.goals.plan.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;
import java.util.List;

/**
 * @param fallbackTdee 資料不足時回傳的值（通常是 BMR × 活動乘數）
 * @param today        沒帶就用伺服器（或 X-Client-Timezone）的今天
 */
public record AdaptiveTdeeRequest(
        @NotNull(message = "Fallback TDEE is required") @Positive Double fallbackTdee,
        LocalDate today,
        @NotNull(message = "Logs are required") List<@Valid DailyLogRequest> logs
) {}
