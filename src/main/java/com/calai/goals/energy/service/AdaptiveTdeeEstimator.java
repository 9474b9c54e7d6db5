package com.calai.goals.energy.service;

import com.calai.goals.energy.common.AdaptiveTdee;
import com.calai.goals.energy.common.AdaptiveTdee.Confidence;
import com.calai.goals.energy.common.DailyLog;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 用歷史體重 + 攝取熱量反推實際 TDEE。
 *
 * 流程：
 * 1) 35 天視窗，體重缺的日子線性內插（頭尾沿用最近一筆）
 * 2) 7 日 SMA 平滑體重
 * 3) 最後 28 天：平均攝取（只算 >= 200 kcal 的日子）− 每日體重變化 × 7700
 * 4) 結果夾在 fallback ± 1000（下限至少 1200）
 *
 * 資料不夠時回 fallback（BMR × 活動乘數），並附上原因。
 */
@Component
public class AdaptiveTdeeEstimator {

    static final int LOOKBACK_DAYS = 35;
    static final int WINDOW_DAYS = 28;
    static final int SMA_DAYS = 7;
    static final int MIN_WEIGHT_SPAN_DAYS = 7;
    static final int MIN_CALORIE_DAYS = 7;
    static final double MIN_LOGGED_KCAL = 200.0;
    // 1 kg 人體組織約 7700 kcal
    static final double KCAL_PER_KG = 7700.0;
    static final double MAX_DEVIATION_KCAL = 1000.0;
    static final double MIN_TDEE_KCAL = 1200.0;

    public AdaptiveTdee estimate(LocalDate today, double fallbackTdee, List<DailyLog> logs) {
        LocalDate start = today.minusDays(LOOKBACK_DAYS);

        // 同一天多筆：體重取最後一筆、熱量加總
        TreeMap<LocalDate, Double> weights = new TreeMap<>();
        Map<LocalDate, Double> intake = new HashMap<>();
        if (logs != null) {
            for (DailyLog log : logs) {
                if (log == null || log.date() == null) continue;
                if (log.date().isBefore(start) || log.date().isAfter(today)) continue;
                if (log.weightKg() != null && Double.isFinite(log.weightKg()) && log.weightKg() > 0) {
                    weights.put(log.date(), log.weightKg());
                }
                if (log.intakeKcal() != null && Double.isFinite(log.intakeKcal())) {
                    intake.merge(log.date(), log.intakeKcal(), Double::sum);
                }
            }
        }

        if (weights.size() < 2) {
            return AdaptiveTdee.fallback(fallbackTdee, "Insufficient weight entries (need at least 2)");
        }

        long span = ChronoUnit.DAYS.between(weights.firstKey(), weights.lastKey());
        if (span < MIN_WEIGHT_SPAN_DAYS) {
            return AdaptiveTdee.fallback(fallbackTdee, "Weight entries span less than 7 days");
        }

        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(today); d = d.plusDays(1)) days.add(d);

        double[] interpolated = new double[days.size()];
        for (int i = 0; i < days.size(); i++) {
            interpolated[i] = interpolate(weights, days.get(i));
        }

        double[] trend = new double[days.size()];
        for (int i = 0; i < days.size(); i++) {
            if (i < SMA_DAYS - 1) {
                trend[i] = interpolated[i];
                continue;
            }
            double sum = 0;
            for (int j = i - SMA_DAYS + 1; j <= i; j++) sum += interpolated[j];
            trend[i] = sum / SMA_DAYS;
        }

        int from = days.size() - WINDOW_DAYS;
        List<Double> counted = new ArrayList<>();
        for (int i = from; i < days.size(); i++) {
            double kcal = intake.getOrDefault(days.get(i), 0.0);
            if (kcal >= MIN_LOGGED_KCAL) counted.add(kcal);
        }

        if (counted.size() < MIN_CALORIE_DAYS) {
            return AdaptiveTdee.fallback(fallbackTdee,
                    "Insufficient calorie logs (need at least 7 days with > 200 kcal)");
        }

        double avgIntake = counted.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double endTrend = trend[days.size() - 1];
        double dailyChange = (endTrend - trend[from]) / WINDOW_DAYS;

        double raw = avgIntake - dailyChange * KCAL_PER_KG;
        double max = fallbackTdee + MAX_DEVIATION_KCAL;
        double min = Math.max(MIN_TDEE_KCAL, fallbackTdee - MAX_DEVIATION_KCAL);
        double capped = Math.min(Math.max(raw, min), max);

        return new AdaptiveTdee(
                (int) Math.round(capped),
                confidence(counted.size(), weights.size(), span),
                false,
                null,
                Math.round(endTrend * 10.0) / 10.0,
                (int) Math.round(avgIntake),
                counted.size()
        );
    }

    static Confidence confidence(int calorieDays, int weightEntries, long daySpan) {
        if (calorieDays >= 21 && weightEntries >= 8 && daySpan >= 21) return Confidence.HIGH;
        if (calorieDays >= 14 && weightEntries >= 4 && daySpan >= 14) return Confidence.MEDIUM;
        return Confidence.LOW;
    }

    private static double interpolate(TreeMap<LocalDate, Double> weights, LocalDate day) {
        Double exact = weights.get(day);
        if (exact != null) return exact;

        Map.Entry<LocalDate, Double> prev = weights.lowerEntry(day);
        Map.Entry<LocalDate, Double> next = weights.higherEntry(day);
        if (prev != null && next != null) {
            long total = ChronoUnit.DAYS.between(prev.getKey(), next.getKey());
            long fromPrev = ChronoUnit.DAYS.between(prev.getKey(), day);
            return prev.getValue() + (next.getValue() - prev.getValue()) * ((double) fromPrev / total);
        }
        return (prev != null) ? prev.getValue() : next.getValue();
    }
}
