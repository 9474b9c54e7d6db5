package com.calai.goals.config;

import com.calai.goals.adjustment.common.CalorieAdjustmentConfig;
import com.calai.goals.adjustment.common.CalorieAdjustmentMode;
import com.calai.goals.algorithm.AlgorithmSelection;
import com.calai.goals.algorithm.BmrAlgorithm;
import com.calai.goals.algorithm.BodyFatAlgorithm;
import com.calai.goals.algorithm.FatBreakdownAlgorithm;
import com.calai.goals.algorithm.MineralAlgorithm;
import com.calai.goals.algorithm.SugarAlgorithm;
import com.calai.goals.algorithm.VitaminAlgorithm;
import com.calai.goals.macro.common.DietTemplate;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * goals.* 預設值；request 沒帶的欄位都從這裡補。
 */
@ConfigurationProperties(prefix = "goals")
public class GoalsProperties {

    private Algorithms algorithms = new Algorithms();

    /** 沒帶 dietTemplate 時用哪個模板 */
    private String dietTemplate = "BALANCED";

    private Water water = new Water();
    private Exercise exercise = new Exercise();
    private Adjustment adjustment = new Adjustment();

    public Algorithms getAlgorithms() { return algorithms; }
    public void setAlgorithms(Algorithms algorithms) { this.algorithms = algorithms; }

    public String getDietTemplate() { return dietTemplate; }
    public void setDietTemplate(String dietTemplate) { this.dietTemplate = dietTemplate; }

    public Water getWater() { return water; }
    public void setWater(Water water) { this.water = water; }

    public Exercise getExercise() { return exercise; }
    public void setExercise(Exercise exercise) { this.exercise = exercise; }

    public Adjustment getAdjustment() { return adjustment; }
    public void setAdjustment(Adjustment adjustment) { this.adjustment = adjustment; }

    public DietTemplate defaultDietTemplate() {
        return DietTemplate.parseOrDefault(dietTemplate);
    }

    /** key 寫錯會丟 UnknownAlgorithmException */
    public AlgorithmSelection defaultSelection() {
        return new AlgorithmSelection(
                BmrAlgorithm.fromKey(algorithms.bmr),
                BodyFatAlgorithm.fromKey(algorithms.bodyFat),
                FatBreakdownAlgorithm.fromKey(algorithms.fatBreakdown),
                MineralAlgorithm.fromKey(algorithms.mineral),
                VitaminAlgorithm.fromKey(algorithms.vitamin),
                SugarAlgorithm.fromKey(algorithms.sugar)
        );
    }

    public static class Algorithms {
        private String bmr = "Mifflin-St Jeor";
        private String bodyFat = "U.S. Navy";
        private String fatBreakdown = "AHA Guidelines";
        private String mineral = "RDA Standard";
        private String vitamin = "RDA Standard";
        private String sugar = "WHO Guidelines";

        public String getBmr() { return bmr; }
        public void setBmr(String bmr) { this.bmr = bmr; }

        public String getBodyFat() { return bodyFat; }
        public void setBodyFat(String bodyFat) { this.bodyFat = bodyFat; }

        public String getFatBreakdown() { return fatBreakdown; }
        public void setFatBreakdown(String fatBreakdown) { this.fatBreakdown = fatBreakdown; }

        public String getMineral() { return mineral; }
        public void setMineral(String mineral) { this.mineral = mineral; }

        public String getVitamin() { return vitamin; }
        public void setVitamin(String vitamin) { this.vitamin = vitamin; }

        public String getSugar() { return sugar; }
        public void setSugar(String sugar) { this.sugar = sugar; }
    }

    public static class Water {
        /** 每公斤體重幾 ml */
        private double mlPerKg = 35.0;
        private int maleCapMl = 3700;
        private int femaleCapMl = 2700;

        public double getMlPerKg() { return mlPerKg; }
        public void setMlPerKg(double mlPerKg) { this.mlPerKg = mlPerKg; }

        public int getMaleCapMl() { return maleCapMl; }
        public void setMaleCapMl(int maleCapMl) { this.maleCapMl = maleCapMl; }

        public int getFemaleCapMl() { return femaleCapMl; }
        public void setFemaleCapMl(int femaleCapMl) { this.femaleCapMl = femaleCapMl; }
    }

    public static class Exercise {
        private int durationMinutes = 30;
        /** 會被夾在 0..5000 */
        private int caloriesBurned = 450;

        public int getDurationMinutes() { return durationMinutes; }
        public void setDurationMinutes(int durationMinutes) { this.durationMinutes = durationMinutes; }

        public int getCaloriesBurned() { return caloriesBurned; }
        public void setCaloriesBurned(int caloriesBurned) { this.caloriesBurned = caloriesBurned; }
    }

    public static class Adjustment {
        private String mode = "dynamic";
        private double exerciseCaloriePercentage = 100;
        private double exerciseCalorieGoal = 450;
        private boolean allowNegativeAdjustment = false;
        /** 一天過了不到這個比例就不外推（0.05 ≈ 72 分鐘） */
        private double minElapsedFraction = CalorieAdjustmentConfig.DEFAULT_MIN_ELAPSED_FRACTION;

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public double getExerciseCaloriePercentage() { return exerciseCaloriePercentage; }
        public void setExerciseCaloriePercentage(double v) { this.exerciseCaloriePercentage = v; }

        public double getExerciseCalorieGoal() { return exerciseCalorieGoal; }
        public void setExerciseCalorieGoal(double v) { this.exerciseCalorieGoal = v; }

        public boolean isAllowNegativeAdjustment() { return allowNegativeAdjustment; }
        public void setAllowNegativeAdjustment(boolean v) { this.allowNegativeAdjustment = v; }

        public double getMinElapsedFraction() { return minElapsedFraction; }
        public void setMinElapsedFraction(double v) { this.minElapsedFraction = v; }

        /** 設定檔的 mode 不認得就退回 FIXED */
        public CalorieAdjustmentMode modeOrFixed() {
            CalorieAdjustmentMode m = CalorieAdjustmentMode.parseOrNull(mode);
            return (m == null) ? CalorieAdjustmentMode.FIXED : m;
        }
    }
}
