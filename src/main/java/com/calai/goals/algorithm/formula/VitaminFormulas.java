package com.calai.goals.algorithm.formula;

import com.calai.goals.algorithm.model.VitaminTargets;
import com.calai.goals.common.Sex;

public final class VitaminFormulas {
    private VitaminFormulas() {}

    /** NASEM RDA：維生素 A（mcg RAE）、維生素 C（mg） */
    public static VitaminTargets rdaStandard(Sex sex, int age) {
        return new VitaminTargets(vitaminAMcg(sex, age), vitaminCMg(sex, age));
    }

    static int vitaminAMcg(Sex sex, int age) {
        if (age <= 3) return 300;
        if (age <= 8) return 400;
        if (age <= 13) return 600;
        return sex.isMale() ? 900 : 700;
    }

    static int vitaminCMg(Sex sex, int age) {
        if (age <= 3) return 15;
        if (age <= 8) return 25;
        if (age <= 13) return 45;
        if (age <= 18) return sex.isMale() ? 75 : 65;
        return sex.isMale() ? 90 : 75;
    }
}
