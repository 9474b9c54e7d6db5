package com.calai.goals.plan.service;

import com.calai.goals.adjustment.common.ActivityEnergyRecord;
import com.calai.goals.adjustment.common.CalorieAdjustmentConfig;
import com.calai.goals.adjustment.common.CalorieAdjustmentMode;
import com.calai.goals.adjustment.common.DailyCalorieBudget;
import com.calai.goals.adjustment.service.CalorieAdjustmentPolicy;
import com.calai.goals.algorithm.AlgorithmCategory;
import com.calai.goals.algorithm.AlgorithmRegistry;
import com.calai.goals.algorithm.AlgorithmSelection;
import com.calai.goals.algorithm.BmrAlgorithm;
import com.calai.goals.algorithm.BodyFatAlgorithm;
import com.calai.goals.algorithm.FatBreakdownAlgorithm;
import com.calai.goals.algorithm.MineralAlgorithm;
import com.calai.goals.algorithm.SugarAlgorithm;
import com.calai.goals.algorithm.VitaminAlgorithm;
import com.calai.goals.algorithm.model.BodyMeasurements;
import com.calai.goals.common.ActivityLevel;
import com.calai.goals.common.Sex;
import com.calai.goals.common.Units;
import com.calai.goals.config.GoalsProperties;
import com.calai.goals.energy.common.AdaptiveTdee;
import com.calai.goals.energy.common.DailyLog;
import com.calai.goals.energy.common.EnergyBudget;
import com.calai.goals.energy.common.PrimaryGoal;
import com.calai.goals.energy.common.Profile;
import com.calai.goals.energy.service.AdaptiveTdeeEstimator;
import com.calai.goals.energy.service.EnergyBudgetCalculator;
import com.calai.goals.macro.common.DietTemplate;
import com.calai.goals.macro.common.MacroSplit;
import com.calai.goals.macro.common.MacroTargets;
import com.calai.goals.macro.service.MacroAllocator;
import com.calai.goals.macro.service.MacroRebalancer;
import com.calai.goals.nutrient.common.AdvancedNutrients;
import com.calai.goals.nutrient.common.NutrientInputs;
import com.calai.goals.nutrient.service.AdvancedNutrientCalculator;
import com.calai.goals.plan.common.GoalCategory;
import com.calai.goals.plan.common.GoalField;
import com.calai.goals.plan.common.GoalPatch;
import com.calai.goals.plan.common.GoalSnapshot;
import com.calai.goals.plan.common.GoalWarning;
import com.calai.goals.plan.dto.AdaptiveTdeeRequest;
import com.calai.goals.plan.dto.AlgorithmSelectionRequest;
import com.calai.goals.plan.dto.DailyLogRequest;
import com.calai.goals.plan.dto.PlanRequest;
import com.calai.goals.plan.dto.PlanResponse;
import com.calai.goals.plan.dto.RebalanceRequest;
import com.calai.goals.plan.dto.RecomputeRequest;
import com.calai.goals.plan.dto.RecomputeResponse;
import com.calai.goals.plan.dto.RemainingRequest;
import com.calai.goals.plan.dto.RemainingResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 把各個計算元件串起來：request（可能是英制）→ 公制 → 引擎 → GoalPatch / GoalSnapshot。
 * 不存任何狀態；存檔、快取、debounce 都是呼叫端的事。
 */
@Slf4j
@Service
public class GoalPlanService {

    private final AlgorithmRegistry registry;
    private final EnergyBudgetCalculator energy;
    private final MacroAllocator allocator;
    private final MacroRebalancer rebalancer;
    private final AdvancedNutrientCalculator nutrients;
    private final HydrationCalculator hydration;
    private final CalorieAdjustmentPolicy adjustment;
    private final AdaptiveTdeeEstimator adaptiveTdee;
    private final GoalsProperties props;
    private final Clock clock;

    public GoalPlanService(AlgorithmRegistry registry,
                           EnergyBudgetCalculator energy,
                           MacroAllocator allocator,
                           MacroRebalancer rebalancer,
                           AdvancedNutrientCalculator nutrients,
                           HydrationCalculator hydration,
                           CalorieAdjustmentPolicy adjustment,
                           AdaptiveTdeeEstimator adaptiveTdee,
                           GoalsProperties props,
                           Clock clock) {
        this.registry = registry;
        this.energy = energy;
        this.allocator = allocator;
        this.rebalancer = rebalancer;
        this.nutrients = nutrients;
        this.hydration = hydration;
        this.adjustment = adjustment;
        this.adaptiveTdee = adaptiveTdee;
        this.props = props;
        this.clock = clock;
    }

    // ===== 完整計畫 =====

    /**
     * @param zone 使用者時區（null = 伺服器時區），決定「今天」用來算年齡
     */
    public PlanResponse plan(PlanRequest req, ZoneId zone) {
        LocalDate today = today(zone);
        Profile profile = toProfile(req);

        List<String> missing = energy.missingFields(profile, today);
        if (!missing.isEmpty()) {
            log.debug("plan_unready missingFields={}", missing);
            return PlanResponse.unready(missing);
        }

        AlgorithmSelection selection = resolveSelection(req.algorithms());
        PrimaryGoal goal = PrimaryGoal.parseOrDefault(req.goal());

        Optional<EnergyBudget> budget = energy.compute(profile, selection.bmr(), goal, today);
        if (budget.isEmpty()) {
            // 欄位都有但算出來不合理（BMR <= 0 或每日熱量超過上限）
            log.debug("plan_unready reason=energy_out_of_range bmr={}", selection.bmr().key());
            return PlanResponse.unready(List.of("bmr"));
        }
        EnergyBudget eb = budget.get();
        int kcal = eb.dailyCalorieGoal();

        List<GoalWarning> warnings = new ArrayList<>();
        MacroSplit split = resolveSplit(req);
        MacroTargets macros = allocator.allocate(kcal, split);
        if (!macros.splitBalanced()) {
            warnings.add(GoalWarning.MACRO_SPLIT_IMBALANCED);
            log.info("plan_macro_split_imbalanced sum={} split={}", split.sum(), split);
        }

        int age = profile.ageAt(today);
        NutrientInputs inputs = new NutrientInputs(
                age, profile.sex(), profile.weightKg(), kcal, macros.fatG(), macros.carbsG(), profile.activityLevel());
        AdvancedNutrients advanced = nutrients.calculate(inputs, selection);

        GoalPatch goals = GoalPatch.builder()
                .put(GoalField.CALORIES, kcal)
                .put(GoalField.PROTEIN, macros.proteinG())
                .put(GoalField.CARBS, macros.carbsG())
                .put(GoalField.FAT, macros.fatG())
                .put(GoalField.DIETARY_FIBER, macros.fiberG())
                .build()
                .plus(AdvancedNutrientCalculator.toPatch(advanced))
                .plus(hydration.targets(profile.sex(), profile.weightKg()));

        double bmi = Units.round1(EnergyBudgetCalculator.bmi(profile.weightKg(), profile.heightCm()));
        Double bodyFat = registry.bodyFat(selection.bodyFat()).percent(profile.sex(), new BodyMeasurements(
                profile.heightCm(), profile.weightKg(), age, req.waistCm(), req.neckCm(), req.hipCm()));
        log.debug("plan_ready kcal={} bmr={} template={}", kcal, selection.bmr().key(), req.dietTemplate());

        return new PlanResponse(
                true,
                List.of(),
                eb,
                bmi,
                EnergyBudgetCalculator.classifyBmi(bmi),
                bodyFat,
                split,
                selection,
                goals,
                List.copyOf(warnings)
        );
    }

    // ===== 滑桿 =====

    public MacroSplit rebalance(RebalanceRequest req) {
        MacroSplit current = new MacroSplit(req.carbs(), req.protein(), req.fat());
        return rebalancer.rebalance(current, req.moved(), req.value(), req.locked());
    }

    // ===== 今天還剩多少 =====

    /**
     * 設定值超出範圍不丟錯：夾回範圍並記 warning。
     */
    public RemainingResponse remaining(RemainingRequest req) {
        List<GoalWarning> warnings = new ArrayList<>();
        GoalsProperties.Adjustment defaults = props.getAdjustment();

        CalorieAdjustmentMode mode;
        if (req.mode() == null || req.mode().isBlank()) {
            mode = defaults.modeOrFixed();
        } else {
            mode = CalorieAdjustmentMode.parseOrNull(req.mode());
            if (mode == null) {
                log.warn("unknown_adjustment_mode mode={} fallback=fixed", req.mode());
                warnings.add(GoalWarning.UNKNOWN_ADJUSTMENT_MODE);
                mode = CalorieAdjustmentMode.FIXED;
            }
        }

        CalorieAdjustmentConfig raw = new CalorieAdjustmentConfig(
                mode,
                orDefault(req.exerciseCaloriePercentage(), defaults.getExerciseCaloriePercentage()),
                orDefault(req.exerciseCalorieGoal(), defaults.getExerciseCalorieGoal()),
                (req.allowNegativeAdjustment() != null)
                        ? req.allowNegativeAdjustment()
                        : defaults.isAllowNegativeAdjustment(),
                defaults.getMinElapsedFraction()
        );
        CalorieAdjustmentConfig cfg = raw.clamped();
        if (cfg.exerciseCaloriePercentage() != raw.exerciseCaloriePercentage()) {
            warnings.add(GoalWarning.EARN_BACK_PERCENT_CLAMPED);
        }
        if (cfg.exerciseCalorieGoal() != raw.exerciseCalorieGoal()) {
            warnings.add(GoalWarning.EXERCISE_GOAL_CLAMPED);
        }

        Double fraction = req.elapsedDayFraction();
        if (fraction != null && Double.isFinite(fraction) && fraction > 1) {
            warnings.add(GoalWarning.ELAPSED_FRACTION_CLAMPED);
            fraction = 1.0;
        }
        // <= 0 不夾成 0：交給 policy 當作「還沒有推估資料」退回 FIXED

        ActivityEnergyRecord record = new ActivityEnergyRecord(
                req.eatenKcal(),
                orDefault(req.burnedKcal(), 0),
                req.partialDayBurnKcal(),
                fraction
        );
        if (mode == CalorieAdjustmentMode.DEVICE_PROJECTION && req.tdeeKcal() == null) {
            warnings.add(GoalWarning.TDEE_UNAVAILABLE);
        }

        DailyCalorieBudget result = adjustment.evaluate(req.goalKcal(), req.tdeeKcal(), record, cfg);
        if (!warnings.isEmpty()) {
            log.info("remaining_config_adjusted mode={} warnings={}", mode.key(), warnings);
        }
        return new RemainingResponse(result, List.copyOf(warnings));
    }

    // ===== 依歷史資料反推 TDEE =====

    public AdaptiveTdee adaptiveTdee(AdaptiveTdeeRequest req, ZoneId zone) {
        LocalDate today = (req.today() != null) ? req.today() : today(zone);
        List<DailyLog> logs = new ArrayList<>(req.logs().size());
        for (DailyLogRequest l : req.logs()) {
            logs.add(new DailyLog(l.date(), Units.toKg(pickWeight(l.weightKg(), l.weightLbs()), unitOf(l.weightKg())), l.intakeKcal()));
        }
        AdaptiveTdee out = adaptiveTdee.estimate(today, req.fallbackTdee(), logs);
        if (out.fallback()) {
            log.debug("adaptive_tdee_fallback reason={}", out.fallbackReason());
        }
        return out;
    }

    // ===== 換演算法 =====

    /**
     * 只重算「換掉的演算法」負責的類別；其他欄位一律保留 previous 的值。
     */
    public RecomputeResponse recompute(RecomputeRequest req) {
        AlgorithmSelection before = resolveSelection(req.before());
        AlgorithmSelection after = resolveSelection(req.after());

        Sex sex = Sex.parseOrNull(req.gender());
        if (sex == null) throw new IllegalArgumentException("gender must be MALE or FEMALE");
        Double kg = Units.toKg(pickWeight(req.weightKg(), req.weightLbs()), unitOf(req.weightKg()));

        NutrientInputs inputs = new NutrientInputs(
                req.age(),
                sex,
                (kg == null) ? 0 : kg,
                req.kcal(),
                req.fatG(),
                carbsFor(req),
                ActivityLevel.parseOrNull(req.exerciseLevel())
        );

        Set<GoalField> edited = (req.userEdited() == null) ? Set.of() : req.userEdited();
        GoalSnapshot merged = recomputeForAlgorithmChange(req.previous(), edited, before, after, inputs);
        Set<GoalCategory> recomputed = nutrientCategories(GoalCategory.affectedBy(before.changedCategories(after)));
        return new RecomputeResponse(recomputed, merged);
    }

    public GoalSnapshot recomputeForAlgorithmChange(GoalSnapshot previous,
                                                    Set<GoalField> userEdited,
                                                    AlgorithmSelection before,
                                                    AlgorithmSelection after,
                                                    NutrientInputs inputs) {
        Set<AlgorithmCategory> changed = before.changedCategories(after);
        if (changed.contains(AlgorithmCategory.BMR)) {
            log.info("algorithm_change_needs_full_plan changed={}", changed);
        }

        Set<GoalCategory> categories = nutrientCategories(GoalCategory.affectedBy(changed));
        GoalPatch patch = nutrients.recompute(inputs, after, categories);

        // 被重算的類別直接覆寫；其他類別本來就不在 patch 裡，手動改過的值自然保留
        Set<GoalField> keep = new HashSet<>(userEdited);
        keep.removeAll(GoalField.in(categories));

        GoalSnapshot base = (previous == null) ? GoalSnapshot.empty() : previous;
        if (patch.isEmpty()) return base;

        log.debug("algorithm_change_recompute changed={} categories={} keptEdited={}",
                changed, patch.categories(), keep);
        return base.merge(patch, keep);
    }

    // ===== helpers =====

    private Profile toProfile(PlanRequest req) {
        Sex sex = Sex.parseOrNull(req.gender());
        ActivityLevel level = ActivityLevel.parseOrNull(req.exerciseLevel());

        Double kg = Units.toKg(pickWeight(req.weightKg(), req.weightLbs()), unitOf(req.weightKg()));
        Double cm = (req.heightCm() != null)
                ? req.heightCm()
                : Units.feetInchesToCm(req.heightFeet(), req.heightInches());

        if (req.age() != null) return Profile.ofAge(sex, req.age(), kg, cm, level);
        return Profile.ofBirthDate(sex, req.birthDate(), kg, cm, level);
    }

    private MacroSplit resolveSplit(PlanRequest req) {
        DietTemplate template = (req.dietTemplate() == null || req.dietTemplate().isBlank())
                ? props.defaultDietTemplate()
                : DietTemplate.parseOrDefault(req.dietTemplate());

        MacroSplit custom = null;
        if (req.carbsPct() != null && req.proteinPct() != null && req.fatPct() != null) {
            custom = new MacroSplit(req.carbsPct(), req.proteinPct(), req.fatPct());
        }
        return template.resolve(custom);
    }

    /** 沒帶的類別用設定檔預設；帶了但不認得 → UnknownAlgorithmException */
    AlgorithmSelection resolveSelection(AlgorithmSelectionRequest req) {
        AlgorithmSelection d = props.defaultSelection();
        if (req == null) return d;
        return new AlgorithmSelection(
                isBlank(req.bmr()) ? d.bmr() : BmrAlgorithm.fromKey(req.bmr()),
                isBlank(req.bodyFat()) ? d.bodyFat() : BodyFatAlgorithm.fromKey(req.bodyFat()),
                isBlank(req.fatBreakdown()) ? d.fatBreakdown() : FatBreakdownAlgorithm.fromKey(req.fatBreakdown()),
                isBlank(req.mineral()) ? d.mineral() : MineralAlgorithm.fromKey(req.mineral()),
                isBlank(req.vitamin()) ? d.vitamin() : VitaminAlgorithm.fromKey(req.vitamin()),
                isBlank(req.sugar()) ? d.sugar() : SugarAlgorithm.fromKey(req.sugar())
        );
    }

    /** 沒帶 carbsG 就用 previous 的碳水目標；都沒有時用全部熱量換算 */
    private static double carbsFor(RecomputeRequest req) {
        if (req.carbsG() != null) return req.carbsG();
        Double previous = (req.previous() == null) ? null : req.previous().get(GoalField.CARBS);
        return (previous != null) ? previous : req.kcal() / 4.0;
    }

    // 本服務能只靠 NutrientInputs 重算的類別
    private static Set<GoalCategory> nutrientCategories(Set<GoalCategory> affected) {
        Set<GoalCategory> out = EnumSet.of(
                GoalCategory.FAT_BREAKDOWN, GoalCategory.MINERALS, GoalCategory.VITAMINS, GoalCategory.SUGAR);
        out.retainAll(affected);
        return out;
    }

    private LocalDate today(ZoneId zone) {
        return (zone == null) ? LocalDate.now(clock) : LocalDate.now(clock.withZone(zone));
    }

    /** 公制優先；只有 lbs 時回 lbs 的值（搭配 unitOf 換算） */
    private static Double pickWeight(Double kg, Double lbs) {
        return (kg != null) ? kg : lbs;
    }

    private static Units.WeightUnit unitOf(Double kg) {
        return (kg != null) ? Units.WeightUnit.KG : Units.WeightUnit.LBS;
    }

    private static double orDefault(Double v, double fallback) {
        return (v == null) ? fallback : v;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
