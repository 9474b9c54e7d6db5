package com.calai.goals.energy.service;

import com.calai.goals.energy.common.AdaptiveTdee;
import com.calai.goals.energy.common.AdaptiveTdee.Confidence;
import com.calai.goals.energy.common.DailyLog;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AdaptiveTdeeEstimatorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);
    private final AdaptiveTdeeEstimator estimator = new AdaptiveTdeeEstimator();

    @Test
    void stable_weight_returns_average_intake_with_high_confidence() {
        List<DailyLog> logs = new ArrayList<>();
        for (int i = 35; i >= 0; i--) {
            LocalDate d = TODAY.minusDays(i);
            Double w = (i % 3 == 0) ? 80.0 : null;
            logs.add(new DailyLog(d, w, 2500.0));
        }

        AdaptiveTdee out = estimator.estimate(TODAY, 2400, logs);

        assertThat(out.fallback()).isFalse();
        assertThat(out.tdee()).isEqualTo(2500);
        assertThat(out.avgIntakeKcal()).isEqualTo(2500);
        assertThat(out.daysOfData()).isEqualTo(28);
        assertThat(out.weightTrendKg()).isEqualTo(80.0);
        assertThat(out.confidence()).isEqualTo(Confidence.HIGH);
    }

    @Test
    void losing_weight_means_tdee_above_intake() {
        List<DailyLog> logs = new ArrayList<>();
        for (int i = 35; i >= 0; i--) {
            // 每天 -0.05 kg
            double w = 80.0 - 0.05 * (35 - i);
            logs.add(new DailyLog(TODAY.minusDays(i), w, 2000.0));
        }

        AdaptiveTdee out = estimator.estimate(TODAY, 2200, logs);

        // 趨勢線 27 天掉 1.35 kg，除以 28 天 × 7700
        assertThat(out.fallback()).isFalse();
        assertThat(out.tdee()).isCloseTo(2371, within(1));
    }

    @Test
    void result_is_capped_at_fallback_plus_1000() {
        List<DailyLog> logs = new ArrayList<>();
        for (int i = 30; i >= 0; i--) {
            logs.add(new DailyLog(TODAY.minusDays(i), 70.0, 5000.0));
        }
        assertThat(estimator.estimate(TODAY, 2000, logs).tdee()).isEqualTo(3000);
    }

    @Test
    void same_day_intake_is_summed_and_last_weight_wins() {
        List<DailyLog> logs = new ArrayList<>();
        for (int i = 20; i >= 0; i--) {
            LocalDate d = TODAY.minusDays(i);
            logs.add(new DailyLog(d, 90.0, 1000.0));
            logs.add(new DailyLog(d, 70.0, 1200.0));
        }

        AdaptiveTdee out = estimator.estimate(TODAY, 2000, logs);

        assertThat(out.avgIntakeKcal()).isEqualTo(2200);
        assertThat(out.weightTrendKg()).isEqualTo(70.0);
    }

    @Test
    void too_few_weights_falls_back() {
        List<DailyLog> logs = List.of(new DailyLog(TODAY, 80.0, 2000.0));

        AdaptiveTdee out = estimator.estimate(TODAY, 2345.6, logs);

        assertThat(out.fallback()).isTrue();
        assertThat(out.tdee()).isEqualTo(2346);
        assertThat(out.confidence()).isEqualTo(Confidence.LOW);
        assertThat(out.fallbackReason()).contains("at least 2");
    }

    @Test
    void short_weight_span_falls_back() {
        List<DailyLog> logs = List.of(
                new DailyLog(TODAY.minusDays(3), 80.0, null),
                new DailyLog(TODAY, 79.5, null)
        );
        assertThat(estimator.estimate(TODAY, 2000, logs).fallbackReason()).contains("less than 7 days");
    }

    @Test
    void too_few_calorie_days_falls_back() {
        List<DailyLog> logs = new ArrayList<>();
        for (int i = 20; i >= 0; i--) {
            // 只有 5 天 >= 200 kcal
            double kcal = (i < 5) ? 2000.0 : 150.0;
            logs.add(new DailyLog(TODAY.minusDays(i), 80.0, kcal));
        }
        AdaptiveTdee out = estimator.estimate(TODAY, 2000, logs);
        assertThat(out.fallback()).isTrue();
        assertThat(out.fallbackReason()).contains("calorie logs");
    }

    @Test
    void entries_outside_window_are_ignored() {
        List<DailyLog> logs = List.of(
                new DailyLog(TODAY.minusDays(60), 85.0, 2000.0),
                new DailyLog(TODAY.plusDays(1), 85.0, 2000.0),
                new DailyLog(TODAY, 80.0, 2000.0)
        );
        assertThat(estimator.estimate(TODAY, 2000, logs).fallback()).isTrue();
    }

    @Test
    void confidence_thresholds() {
        assertThat(AdaptiveTdeeEstimator.confidence(21, 8, 21)).isEqualTo(Confidence.HIGH);
        assertThat(AdaptiveTdeeEstimator.confidence(20, 8, 21)).isEqualTo(Confidence.MEDIUM);
        assertThat(AdaptiveTdeeEstimator.confidence(14, 4, 14)).isEqualTo(Confidence.MEDIUM);
        assertThat(AdaptiveTdeeEstimator.confidence(14, 3, 14)).isEqualTo(Confidence.LOW);
    }
}
