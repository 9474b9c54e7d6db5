package com.calai.goals.common;

/**
 * 單位換算：引擎內部永遠用 kg / cm / kcal / ml，
 * 只有邊界（request 進來、畫面要顯示）才換成使用者偏好的單位。
 */
public final class Units {
    private Units() {}

    // === 固定換算常數（與前端顯示一致，不用 0.45359237 的精確值） ===
    public static final double LBS_PER_KG = 2.20462d;
    public static final double CM_PER_INCH = 2.54d;
    public static final double KJ_PER_KCAL = 4.184d;
    public static final double ML_PER_OZ = 29.5735d;
    public static final double ML_PER_LITER = 1000d;

    public enum WeightUnit { KG, LBS }
    public enum EnergyUnit { KCAL, KJ }
    public enum VolumeUnit { ML, OZ, LITER }

    /**
     * 無條件捨去到指定小數位。
     * 用在「不能超過上限」的推導值（例如脂肪細項加總不能超過總脂肪）。
     */
    public static Double floor(Number v, int scale) {
        if (v == null) return null;
        if (scale < 0) throw new IllegalArgumentException("scale must be >= 0");
        double d = v.doubleValue();
        double factor = Math.pow(10d, scale);
        // + 1e-8: 避免 40.1 變成 40.0999999 這類浮點誤差被多捨 0.1
        return Math.floor(d * factor + 1e-8) / factor;
    }

    /** 只做 min/max 夾住，不動小數位。 */
    public static Double clamp(Number v, double min, double max) {
        if (v == null) return null;
        double d = v.doubleValue();
        if (d < min) return min;
        if (d > max) return max;
        return d;
    }

    public static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }

    // ===== 重量 =====

    public static double kgToLbs(double kg) {
        return kg * LBS_PER_KG;
    }

    public static double lbsToKg(double lbs) {
        return lbs / LBS_PER_KG;
    }

    public static Double toKg(Number value, WeightUnit from) {
        if (value == null) return null;
        double v = value.doubleValue();
        return (from == WeightUnit.LBS) ? lbsToKg(v) : v;
    }

    public static Double fromKg(Number kg, WeightUnit to) {
        if (kg == null) return null;
        double v = kg.doubleValue();
        return (to == WeightUnit.LBS) ? kgToLbs(v) : v;
    }

    // ===== 長度 =====

    /** feet+inches → cm（無條件捨去到 0.1 cm） */
    public static Double feetInchesToCm(Number feet, Number inches) {
        if (feet == null || inches == null) return null;
        double totalInches = feet.doubleValue() * 12.0d + inches.doubleValue();
        return floor(totalInches * CM_PER_INCH, 1);
    }

    // ===== 能量 =====

    public static double kcalToKj(double kcal) {
        return kcal * KJ_PER_KCAL;
    }

    public static double kjToKcal(double kj) {
        return kj / KJ_PER_KCAL;
    }

    public static double convertEnergy(double value, EnergyUnit from, EnergyUnit to) {
        if (from == to) return value;
        return (from == EnergyUnit.KCAL) ? kcalToKj(value) : kjToKcal(value);
    }

    // ===== 容量 =====

    public static double mlTo(double ml, VolumeUnit to) {
        return switch (to) {
            case OZ -> ml / ML_PER_OZ;
            case LITER -> ml / ML_PER_LITER;
            case ML -> ml;
        };
    }

    public static double toMl(double value, VolumeUnit from) {
        return switch (from) {
            case OZ -> value * ML_PER_OZ;
            case LITER -> value * ML_PER_LITER;
            case ML -> value;
        };
    }
}
