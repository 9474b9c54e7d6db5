package com.calai.goals.nutrient.service;

import com.calai.goals.algorithm.AlgorithmRegistry;
import com.calai.goals.algorithm.AlgorithmSelection;
import com.calai.goals.algorithm.FatBreakdownAlgorithm;
import com.calai.goals.algorithm.MineralAlgorithm;
import com.calai.goals.algorithm.SugarAlgorithm;
import com.calai.goals.algorithm.VitaminAlgorithm;
import com.calai.goals.algorithm.model.FatBreakdown;
import com.calai.goals.algorithm.model.MineralTargets;
import com.calai.goals.algorithm.model.VitaminTargets;
import com.calai.goals.common.InvariantViolationException;
import com.calai.goals.nutrient.common.AdvancedNutrients;
import com.calai.goals.nutrient.common.NutrientInputs;
import com.calai.goals.plan.common.GoalCategory;
import com.calai.goals.plan.common.GoalField;
import com.calai.goals.plan.common.GoalPatch;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * 脂肪細項 / 礦物質 / 維生素 / 糖上限。
 * 每個結果都會檢查上限；超過就是該演算法的 bug，直接丟 InvariantViolationException，不幫忙修。
 */
@Component
public class AdvancedNutrientCalculator {

    // 脂肪細項已經 floor 到 0.1g，加總比較時留一點浮點誤差
    static final double EPSILON = 1e-6;
    static final double KCAL_PER_G_CARB = 4.0;

    private final AlgorithmRegistry registry;

    public AdvancedNutrientCalculator(AlgorithmRegistry registry) {
        this.registry = registry;
    }

    public AdvancedNutrients calculate(NutrientInputs in, AlgorithmSelection selection) {
        AlgorithmSelection sel = (selection == null) ? AlgorithmSelection.defaults() : selection;
        return new AdvancedNutrients(
                fatBreakdown(in, sel.fatBreakdown()),
                minerals(in, sel.mineral()),
                vitamins(in, sel.vitamin()),
                sugar(in, sel.sugar())
        );
    }

    /**
     * 只算 categories 裡屬於本元件的類別（FAT_BREAKDOWN / MINERALS / VITAMINS / SUGAR），
     * 其他類別直接忽略。
     */
    public GoalPatch recompute(NutrientInputs in, AlgorithmSelection selection, Set<GoalCategory> categories) {
        AlgorithmSelection sel = (selection == null) ? AlgorithmSelection.defaults() : selection;
        GoalPatch.Builder b = GoalPatch.builder();

        if (categories.contains(GoalCategory.FAT_BREAKDOWN)) {
            putFat(b, fatBreakdown(in, sel.fatBreakdown()));
        }
        if (categories.contains(GoalCategory.MINERALS)) {
            putMinerals(b, minerals(in, sel.mineral()));
        }
        if (categories.contains(GoalCategory.VITAMINS)) {
            putVitamins(b, vitamins(in, sel.vitamin()));
        }
        if (categories.contains(GoalCategory.SUGAR)) {
            b.put(GoalField.SUGARS, sugar(in, sel.sugar()));
        }
        return b.build();
    }

    public static GoalPatch toPatch(AdvancedNutrients n) {
        GoalPatch.Builder b = GoalPatch.builder();
        putFat(b, n.fat());
        putMinerals(b, n.minerals());
        putVitamins(b, n.vitamins());
        b.put(GoalField.SUGARS, n.sugarG());
        return b.build();
    }

    public FatBreakdown fatBreakdown(NutrientInputs in, FatBreakdownAlgorithm algorithm) {
        FatBreakdown fat = registry.fatBreakdown(algorithm).split(in.kcal(), in.totalFatG());
        checkFat(algorithm, fat, in.totalFatG());
        return fat;
    }

    public MineralTargets minerals(NutrientInputs in, MineralAlgorithm algorithm) {
        MineralTargets m = registry.mineral(algorithm).targets(in.sex(), in.ageYears());
        if (m.cholesterolMg() < 0 || m.sodiumMg() < 0 || m.potassiumMg() < 0
                || m.calciumMg() < 0 || m.ironMg() < 0) {
            throw new InvariantViolationException(
                    "Mineral strategy " + algorithm.key() + " produced a negative target: " + m);
        }
        return m;
    }

    public VitaminTargets vitamins(NutrientInputs in, VitaminAlgorithm algorithm) {
        VitaminTargets v = registry.vitamin(algorithm).targets(in.sex(), in.ageYears());
        if (v.vitaminAMcg() < 0 || v.vitaminCMg() < 0) {
            throw new InvariantViolationException(
                    "Vitamin strategy " + algorithm.key() + " produced a negative target: " + v);
        }
        return v;
    }

    /** 上限 = 碳水目標克數（也不會超過全部熱量都給碳水時的克數） */
    public int sugar(NutrientInputs in, SugarAlgorithm algorithm) {
        int g = registry.sugar(algorithm).maxGrams(in.sex(), in.kcal());
        double budget = carbBudgetG(in);
        if (g < 0 || g > budget + EPSILON) {
            throw new InvariantViolationException(
                    "Sugar strategy " + algorithm.key() + " produced " + g
                            + " g, outside [0, " + budget + "] g carbs for " + in.kcal() + " kcal");
        }
        return g;
    }

    static double carbBudgetG(NutrientInputs in) {
        double byKcal = Math.max(0, in.kcal()) / KCAL_PER_G_CARB;
        if (!Double.isFinite(in.carbsG()) || in.carbsG() < 0) return byKcal;
        return Math.min(in.carbsG(), byKcal);
    }

    static void checkFat(FatBreakdownAlgorithm algorithm, FatBreakdown fat, double totalFatG) {
        double limit = totalFatG + EPSILON;
        double[] parts = {
                fat.saturatedFatG(), fat.transFatG(), fat.polyunsaturatedFatG(), fat.monounsaturatedFatG()
        };
        for (double part : parts) {
            if (!Double.isFinite(part) || part < 0 || part > limit) {
                throw new InvariantViolationException(
                        "Fat breakdown strategy " + algorithm.key() + " produced " + fat
                                + " outside total fat " + totalFatG + " g");
            }
        }
        if (fat.total() > limit) {
            throw new InvariantViolationException(
                    "Fat breakdown strategy " + algorithm.key() + " sub-fractions sum to " + fat.total()
                            + " g, exceeding total fat " + totalFatG + " g");
        }
    }

    private static void putFat(GoalPatch.Builder b, FatBreakdown fat) {
        b.put(GoalField.SATURATED_FAT, fat.saturatedFatG())
                .put(GoalField.TRANS_FAT, fat.transFatG())
                .put(GoalField.POLYUNSATURATED_FAT, fat.polyunsaturatedFatG())
                .put(GoalField.MONOUNSATURATED_FAT, fat.monounsaturatedFatG());
    }

    private static void putMinerals(GoalPatch.Builder b, MineralTargets m) {
        b.put(GoalField.CHOLESTEROL, m.cholesterolMg())
                .put(GoalField.SODIUM, m.sodiumMg())
                .put(GoalField.POTASSIUM, m.potassiumMg())
                .put(GoalField.CALCIUM, m.calciumMg())
                .put(GoalField.IRON, m.ironMg());
    }

    private static void putVitamins(GoalPatch.Builder b, VitaminTargets v) {
        b.put(GoalField.VITAMIN_A, v.vitaminAMcg())
                .put(GoalField.VITAMIN_C, v.vitaminCMg());
    }
}
