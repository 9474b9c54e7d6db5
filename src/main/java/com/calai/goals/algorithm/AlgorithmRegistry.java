package com.calai.goals.algorithm;

import com.calai.goals.algorithm.formula.BmrFormulas;
import com.calai.goals.algorithm.formula.BodyFatFormulas;
import com.calai.goals.algorithm.formula.FatBreakdownFormulas;
import com.calai.goals.algorithm.formula.MineralFormulas;
import com.calai.goals.algorithm.formula.SugarFormulas;
import com.calai.goals.algorithm.formula.VitaminFormulas;
import org.springframework.stereotype.Component;

/**
 * 演算法唯一的分派點：每個類別一個 switch expression。
 * 新增 enum 常數時 compiler 會逼你在這裡補分支，呼叫端完全不用改。
 */
@Component
public class AlgorithmRegistry {

    public BmrFormula bmr(BmrAlgorithm algorithm) {
        return switch (algorithm) {
            case MIFFLIN_ST_JEOR -> BmrFormulas::mifflinStJeor;
            case HARRIS_BENEDICT -> BmrFormulas::harrisBenedict;
            case OWEN -> BmrFormulas::owen;
        };
    }

    public BodyFatFormula bodyFat(BodyFatAlgorithm algorithm) {
        return switch (algorithm) {
            case US_NAVY -> BodyFatFormulas::usNavy;
            case BMI_DEURENBERG -> BodyFatFormulas::bmiDeurenberg;
        };
    }

    public FatBreakdownFormula fatBreakdown(FatBreakdownAlgorithm algorithm) {
        return switch (algorithm) {
            case AHA_GUIDELINES -> FatBreakdownFormulas::ahaGuidelines;
            case DIETARY_GUIDELINES -> FatBreakdownFormulas::dietaryGuidelines;
        };
    }

    public MineralFormula mineral(MineralAlgorithm algorithm) {
        return switch (algorithm) {
            case RDA_STANDARD -> MineralFormulas::rdaStandard;
        };
    }

    public VitaminFormula vitamin(VitaminAlgorithm algorithm) {
        return switch (algorithm) {
            case RDA_STANDARD -> VitaminFormulas::rdaStandard;
        };
    }

    public SugarFormula sugar(SugarAlgorithm algorithm) {
        return switch (algorithm) {
            case WHO_GUIDELINES -> SugarFormulas::whoGuidelines;
            case WHO_STRICT -> SugarFormulas::whoStrict;
            case AHA_ADDED_SUGAR -> SugarFormulas::ahaAddedSugar;
        };
    }
}
