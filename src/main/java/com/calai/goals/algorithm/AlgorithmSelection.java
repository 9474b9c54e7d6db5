package com.calai.goals.algorithm;

import java.util.EnumSet;
import java.util.Set;

/**
 * 六個互相獨立的演算法選擇；改其中一個不會動到其他五個。
 */
public record AlgorithmSelection(
        BmrAlgorithm bmr,
        BodyFatAlgorithm bodyFat,
        FatBreakdownAlgorithm fatBreakdown,
        MineralAlgorithm mineral,
        VitaminAlgorithm vitamin,
        SugarAlgorithm sugar
) {
    public AlgorithmSelection {
        if (bmr == null) bmr = BmrAlgorithm.MIFFLIN_ST_JEOR;
        if (bodyFat == null) bodyFat = BodyFatAlgorithm.US_NAVY;
        if (fatBreakdown == null) fatBreakdown = FatBreakdownAlgorithm.AHA_GUIDELINES;
        if (mineral == null) mineral = MineralAlgorithm.RDA_STANDARD;
        if (vitamin == null) vitamin = VitaminAlgorithm.RDA_STANDARD;
        if (sugar == null) sugar = SugarAlgorithm.WHO_GUIDELINES;
    }

    public static AlgorithmSelection defaults() {
        return new AlgorithmSelection(null, null, null, null, null, null);
    }

    public AlgorithmSelection withBmr(BmrAlgorithm v) {
        return new AlgorithmSelection(v, bodyFat, fatBreakdown, mineral, vitamin, sugar);
    }

    public AlgorithmSelection withBodyFat(BodyFatAlgorithm v) {
        return new AlgorithmSelection(bmr, v, fatBreakdown, mineral, vitamin, sugar);
    }

    public AlgorithmSelection withFatBreakdown(FatBreakdownAlgorithm v) {
        return new AlgorithmSelection(bmr, bodyFat, v, mineral, vitamin, sugar);
    }

    public AlgorithmSelection withMineral(MineralAlgorithm v) {
        return new AlgorithmSelection(bmr, bodyFat, fatBreakdown, v, vitamin, sugar);
    }

    public AlgorithmSelection withVitamin(VitaminAlgorithm v) {
        return new AlgorithmSelection(bmr, bodyFat, fatBreakdown, mineral, v, sugar);
    }

    public AlgorithmSelection withSugar(SugarAlgorithm v) {
        return new AlgorithmSelection(bmr, bodyFat, fatBreakdown, mineral, vitamin, v);
    }

    /** 跟 other 比，哪些類別的選擇不一樣 */
    public Set<AlgorithmCategory> changedCategories(AlgorithmSelection other) {
        Set<AlgorithmCategory> out = EnumSet.noneOf(AlgorithmCategory.class);
        if (other == null) return EnumSet.allOf(AlgorithmCategory.class);
        if (bmr != other.bmr) out.add(AlgorithmCategory.BMR);
        if (bodyFat != other.bodyFat) out.add(AlgorithmCategory.BODY_FAT);
        if (fatBreakdown != other.fatBreakdown) out.add(AlgorithmCategory.FAT_BREAKDOWN);
        if (mineral != other.mineral) out.add(AlgorithmCategory.MINERAL);
        if (vitamin != other.vitamin) out.add(AlgorithmCategory.VITAMIN);
        if (sugar != other.sugar) out.add(AlgorithmCategory.SUGAR);
        return out;
    }
}
