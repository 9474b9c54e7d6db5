package com.calai.goals.algorithm.formula;

import com.calai.goals.algorithm.model.MineralTargets;
import com.calai.goals.common.Sex;

/**
 * NASEM Dietary Reference Intakes（RDA / AI），依年齡帶與性別。
 */
public final class MineralFormulas {
    private MineralFormulas() {}

    // 膽固醇：舊版 Dietary Guidelines 300 mg 上限
    public static final int DEFAULT_CHOLESTEROL_MG = 300;
    // 鈉：USDA 成人上限
    public static final int DEFAULT_SODIUM_MG = 2300;

    public static MineralTargets rdaStandard(Sex sex, int age) {
        return new MineralTargets(
                DEFAULT_CHOLESTEROL_MG,
                DEFAULT_SODIUM_MG,
                potassiumMg(sex, age),
                calciumMg(sex, age),
                ironMg(sex, age)
        );
    }

    /** 鉀 AI（2019 修訂） */
    static int potassiumMg(Sex sex, int age) {
        boolean male = sex.isMale();
        if (age <= 3) return 2000;
        if (age <= 8) return 2300;
        if (age <= 13) return male ? 2500 : 2300;
        if (age <= 18) return male ? 3000 : 2300;
        return male ? 3400 : 2600;
    }

    static int calciumMg(Sex sex, int age) {
        if (age <= 3) return 700;
        if (age <= 8) return 1000;
        if (age <= 18) return 1300;
        if (age <= 50) return 1000;
        if (age <= 70) return sex.isMale() ? 1000 : 1200;
        return 1200;
    }

    static int ironMg(Sex sex, int age) {
        boolean male = sex.isMale();
        if (age <= 3) return 7;
        if (age <= 8) return 10;
        if (age <= 13) return 8;
        if (age <= 18) return male ? 11 : 15;
        if (age <= 50) return male ? 8 : 18;
        return 8;
    }
}
