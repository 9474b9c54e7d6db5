package com.calai.goals.algorithm;

import com.calai.goals.algorithm.model.BodyMeasurements;
import com.calai.goals.algorithm.model.MineralTargets;
import com.calai.goals.algorithm.model.VitaminTargets;
import com.calai.goals.common.Sex;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.*;

class AlgorithmRegistryTest {

    private final AlgorithmRegistry registry = new AlgorithmRegistry();

    @Test
    void mifflin_reference_value_is_1780() {
        double bmr = registry.bmr(BmrAlgorithm.MIFFLIN_ST_JEOR).bmr(Sex.MALE, 80, 180, 30);
        assertThat(bmr).isEqualTo(1780.0);

        // 女性 -161
        assertThat(registry.bmr(BmrAlgorithm.fromKey("Mifflin-St Jeor")).bmr(Sex.FEMALE, 80, 180, 30)).isEqualTo(1614.0);
    }

    @Test
    void alternate_bmr_formulas() {
        assertThat(registry.bmr(BmrAlgorithm.HARRIS_BENEDICT).bmr(Sex.MALE, 80, 180, 30))
                .isCloseTo(1853.632, within(0.001));
        assertThat(registry.bmr(BmrAlgorithm.OWEN).bmr(Sex.MALE, 80, 180, 30))
                .isCloseTo(1695.0, within(0.001));
    }

    @Test
    void keys_accept_enum_name_or_display_name_case_insensitive() {
        assertThat(BmrAlgorithm.fromKey("harris_benedict")).isEqualTo(BmrAlgorithm.HARRIS_BENEDICT);
        assertThat(BmrAlgorithm.fromKey("mifflin-st jeor")).isEqualTo(BmrAlgorithm.MIFFLIN_ST_JEOR);
        assertThat(BodyFatAlgorithm.fromKey("U.S. Navy")).isEqualTo(BodyFatAlgorithm.US_NAVY);
        assertThat(BodyFatAlgorithm.fromKey("bmi (deurenberg)")).isEqualTo(BodyFatAlgorithm.BMI_DEURENBERG);
        assertThat(SugarAlgorithm.fromKey("WHO_STRICT")).isEqualTo(SugarAlgorithm.WHO_STRICT);
    }

    @Test
    void unknown_key_carries_category_and_identifier() {
        assertThatThrownBy(() -> BmrAlgorithm.fromKey("Katch-McArdle"))
                .isInstanceOfSatisfying(UnknownAlgorithmException.class, e -> {
                    assertThat(e.getCategory()).isEqualTo(AlgorithmCategory.BMR);
                    assertThat(e.getIdentifier()).isEqualTo("Katch-McArdle");
                });

        assertThatThrownBy(() -> MineralAlgorithm.fromKey(" "))
                .isInstanceOf(UnknownAlgorithmException.class)
                .hasMessageContaining("MINERAL");
    }

    @Test
    void body_fat_formulas_return_null_when_measurements_missing() {
        BodyMeasurements male = new BodyMeasurements(180.0, 80.0, 30, 85.0, 38.0, null);
        assertThat(registry.bodyFat(BodyFatAlgorithm.US_NAVY).percent(Sex.MALE, male)).isEqualTo(16.1);

        BodyMeasurements female = new BodyMeasurements(165.0, 60.0, 30, 75.0, 34.0, 100.0);
        assertThat(registry.bodyFat(BodyFatAlgorithm.US_NAVY).percent(Sex.FEMALE, female)).isEqualTo(28.9);

        // 女性沒有臀圍
        BodyMeasurements noHip = new BodyMeasurements(165.0, 60.0, 30, 75.0, 34.0, null);
        assertThat(registry.bodyFat(BodyFatAlgorithm.US_NAVY).percent(Sex.FEMALE, noHip)).isNull();

        assertThat(registry.bodyFat(BodyFatAlgorithm.BMI_DEURENBERG).percent(Sex.MALE, male)).isEqualTo(20.3);
        BodyMeasurements noAge = new BodyMeasurements(180.0, 80.0, null, null, null, null);
        assertThat(registry.bodyFat(BodyFatAlgorithm.BMI_DEURENBERG).percent(Sex.MALE, noAge)).isNull();
    }

    @Test
    void rda_targets_by_sex_and_age() {
        MineralTargets m = registry.mineral(MineralAlgorithm.RDA_STANDARD).targets(Sex.MALE, 30);
        assertThat(m).isEqualTo(new MineralTargets(300, 2300, 3400, 1000, 8));

        MineralTargets f = registry.mineral(MineralAlgorithm.RDA_STANDARD).targets(Sex.FEMALE, 30);
        assertThat(f.ironMg()).isEqualTo(18);
        assertThat(f.potassiumMg()).isEqualTo(2600);

        VitaminTargets v = registry.vitamin(VitaminAlgorithm.RDA_STANDARD).targets(Sex.FEMALE, 30);
        assertThat(v).isEqualTo(new VitaminTargets(700, 75));
    }

    @Test
    void sugar_strategies() {
        assertThat(registry.sugar(SugarAlgorithm.WHO_GUIDELINES).maxGrams(Sex.MALE, 2210)).isEqualTo(55);
        assertThat(registry.sugar(SugarAlgorithm.WHO_STRICT).maxGrams(Sex.MALE, 2210)).isEqualTo(27);
        assertThat(registry.sugar(SugarAlgorithm.AHA_ADDED_SUGAR).maxGrams(Sex.MALE, 2210)).isEqualTo(36);
        // 低熱量時不超過 10%
        assertThat(registry.sugar(SugarAlgorithm.AHA_ADDED_SUGAR).maxGrams(Sex.FEMALE, 800)).isEqualTo(20);
    }

    @Test
    void selection_reports_only_changed_categories() {
        AlgorithmSelection a = AlgorithmSelection.defaults();
        AlgorithmSelection b = a.withSugar(SugarAlgorithm.WHO_STRICT).withBmr(BmrAlgorithm.OWEN);

        assertThat(a.changedCategories(b)).containsExactlyInAnyOrder(AlgorithmCategory.SUGAR, AlgorithmCategory.BMR);
        assertThat(a.changedCategories(a)).isEmpty();
        assertThat(a.changedCategories(null)).isEqualTo(EnumSet.allOf(AlgorithmCategory.class));

        // null → 預設
        assertThat(new AlgorithmSelection(null, null, null, null, null, null)).isEqualTo(a);
    }
}
