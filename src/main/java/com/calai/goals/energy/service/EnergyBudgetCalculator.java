package com.calai.goals.energy.service;

import com.calai.goals.algorithm.AlgorithmRegistry;
import com.calai.goals.algorithm.BmrAlgorithm;
import com.calai.goals.energy.common.BmiClass;
import com.calai.goals.energy.common.EnergyBudget;
import com.calai.goals.energy.common.PrimaryGoal;
import com.calai.goals.energy.common.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * BMR → TDEE → 依目標調整後的每日熱量。
 * 資料不足時回 Optional.empty()（= 還不能顯示計畫），不丟例外、不產生 NaN。
 */
@Component
public class EnergyBudgetCalculator {

    static final double LOSE_FACTOR = 0.8;
    static final double GAIN_SURPLUS_KCAL = 500.0;
    // 800 kg、300 cm 加上最高活動量也到不了；超過視為輸入不合理
    static final double MAX_DAILY_KCAL = 30000.0;

    private final AlgorithmRegistry registry;
    private final Clock clock;

    public EnergyBudgetCalculator(AlgorithmRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    public Optional<EnergyBudget> compute(Profile p, BmrAlgorithm algorithm, PrimaryGoal goal) {
        return compute(p, algorithm, goal, today());
    }

    /** today：用使用者時區的日期算年齡 */
    public Optional<EnergyBudget> compute(Profile p, BmrAlgorithm algorithm, PrimaryGoal goal, LocalDate today) {
        if (!missingFields(p, today).isEmpty()) return Optional.empty();

        int age = p.ageAt(today);
        BmrAlgorithm alg = (algorithm == null) ? BmrAlgorithm.MIFFLIN_ST_JEOR : algorithm;
        double bmr = registry.bmr(alg).bmr(p.sex(), p.weightKg(), p.heightCm(), age);
        if (!Double.isFinite(bmr) || bmr <= 0) return Optional.empty();

        double tdee = bmr * p.activityLevel().multiplier();
        double adjusted = applyGoal(tdee, goal);
        if (!Double.isFinite(adjusted) || adjusted > MAX_DAILY_KCAL) return Optional.empty();

        int dailyGoal = roundToNearest10(adjusted);
        return Optional.of(new EnergyBudget(bmr, tdee, dailyGoal));
    }

    /** 回傳缺少或不合法的欄位名稱；空 list 表示可以計算 */
    public List<String> missingFields(Profile p) {
        return missingFields(p, today());
    }

    public List<String> missingFields(Profile p, LocalDate today) {
        List<String> missing = new ArrayList<>();
        if (p == null) {
            return List.of("sex", "age", "weightKg", "heightCm", "activityLevel");
        }
        if (p.sex() == null) missing.add("sex");

        Integer age = p.ageAt(today);
        if (age == null || age <= 0) missing.add("age");

        if (!finitePositive(p.weightKg())) missing.add("weightKg");
        if (!finitePositive(p.heightCm())) missing.add("heightCm");
        if (p.activityLevel() == null) missing.add("activityLevel");
        return missing;
    }

    public static double applyGoal(double tdee, PrimaryGoal goal) {
        if (goal == null) return tdee;
        return switch (goal) {
            case LOSE -> tdee * LOSE_FACTOR;
            case GAIN -> tdee + GAIN_SURPLUS_KCAL;
            case MAINTAIN -> tdee;
        };
    }

    /** 超出 int 範圍丟 ArithmeticException，不回繞成負數 */
    public static int roundToNearest10(double kcal) {
        return Math.toIntExact(Math.round(kcal / 10.0) * 10);
    }

    /** BMI（含最小高度保護） */
    public static double bmi(double weightKg, double heightCm) {
        double safeCm = Math.max(0.001, heightCm);
        double m = safeCm / 100.0;
        return weightKg / (m * m);
    }

    public static BmiClass classifyBmi(double bmi) {
        if (bmi < 18.5) return BmiClass.Underweight;
        if (bmi < 25.0) return BmiClass.Normal;
        if (bmi < 30.0) return BmiClass.Overweight;
        return BmiClass.Obesity;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private static boolean finitePositive(Double v) {
        return v != null && Double.isFinite(v) && v > 0;
    }
}
