package com.calai.goals.adjustment.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CalorieAdjustmentConfigTest {

    @Test
    void mode_keys_including_legacy_tdee() {
        assertThat(CalorieAdjustmentMode.parseOrNull("tdee")).isEqualTo(CalorieAdjustmentMode.DEVICE_PROJECTION);
        assertThat(CalorieAdjustmentMode.parseOrNull("device-projection")).isEqualTo(CalorieAdjustmentMode.DEVICE_PROJECTION);
        assertThat(CalorieAdjustmentMode.parseOrNull(" Smart ")).isEqualTo(CalorieAdjustmentMode.SMART);
        assertThat(CalorieAdjustmentMode.parseOrNull("banana")).isNull();
        assertThat(CalorieAdjustmentMode.parseOrNull(null)).isNull();
    }

    @Test
    void strict_check_names_the_field() {
        CalorieAdjustmentConfig bad = new CalorieAdjustmentConfig(CalorieAdjustmentMode.PERCENTAGE, 120, 0, false);

        assertThat(bad.isInRange()).isFalse();
        assertThatThrownBy(bad::requireInRange)
                .isInstanceOfSatisfying(ConfigOutOfRangeException.class, e -> {
                    assertThat(e.getField()).isEqualTo("exerciseCaloriePercentage");
                    assertThat(e.getValue()).isEqualTo(120.0);
                    assertThat(e.getMax()).isEqualTo(100.0);
                });

        CalorieAdjustmentConfig ok = new CalorieAdjustmentConfig(CalorieAdjustmentMode.PERCENTAGE, 100, 450, false);
        assertThat(ok.requireInRange()).isSameAs(ok);
    }

    @Test
    void clamped_copy_pulls_values_into_range() {
        CalorieAdjustmentConfig c = new CalorieAdjustmentConfig(
                CalorieAdjustmentMode.SMART, Double.NaN, 9000, true, 2.0).clamped();

        assertThat(c.exerciseCaloriePercentage()).isZero();
        assertThat(c.exerciseCalorieGoal()).isEqualTo(5000.0);
        assertThat(c.minElapsedFraction()).isEqualTo(1.0);
        assertThat(c.allowNegativeAdjustment()).isTrue();
        assertThat(c.isInRange()).isTrue();
    }

    @Test
    void null_mode_defaults_to_fixed() {
        assertThat(new CalorieAdjustmentConfig(null, 100, 0, false).mode()).isEqualTo(CalorieAdjustmentMode.FIXED);
        assertThat(new CalorieAdjustmentConfig(null, 100, 0, false).minElapsedFraction()).isEqualTo(0.05);
    }

    @Test
    void strict_elapsed_fraction_check() {
        assertThatThrownBy(() -> new ActivityEnergyRecord(0, 0, 100.0, 0.0).requireValidElapsedFraction())
                .isInstanceOf(ConfigOutOfRangeException.class)
                .hasMessageContaining("elapsedDayFraction");
        assertThatThrownBy(() -> ActivityEnergyRecord.of(0, 0).requireValidElapsedFraction())
                .isInstanceOf(ConfigOutOfRangeException.class);

        ActivityEnergyRecord ok = new ActivityEnergyRecord(0, 0, 100.0, 0.5);
        assertThat(ok.requireValidElapsedFraction()).isSameAs(ok);
    }
}
