package com.calai.goals.energy.common;

import com.calai.goals.common.ActivityLevel;
import com.calai.goals.common.Sex;

import java.time.LocalDate;
import java.time.Period;

/**
 * 一次計算用的身體資料（已經是公制）。
 * 年齡優先用 ageYears，沒有才從 birthDate 推（整年截斷，不算小數）。
 */
public record Profile(
        Sex sex,
        LocalDate birthDate,
        Integer ageYears,
        Double weightKg,
        Double heightCm,
        ActivityLevel activityLevel
) {
    public static Profile ofBirthDate(Sex sex, LocalDate birthDate, Double weightKg, Double heightCm, ActivityLevel level) {
        return new Profile(sex, birthDate, null, weightKg, heightCm, level);
    }

    public static Profile ofAge(Sex sex, Integer ageYears, Double weightKg, Double heightCm, ActivityLevel level) {
        return new Profile(sex, null, ageYears, weightKg, heightCm, level);
    }

    public Integer ageAt(LocalDate today) {
        if (ageYears != null) return ageYears;
        if (birthDate == null || today == null) return null;
        return Period.between(birthDate, today).getYears();
    }
}
