package com.calai.goals.adjustment.common;

import lombok.Getter;

/**
 * 外部設定值超出範圍（賺回百分比不在 0..100、經過的一天比例不是正數…）。
 * 只有嚴格檢查會丟；一般流程在邊界 clamp 掉並回 warning。
 */
@Getter
public class ConfigOutOfRangeException extends RuntimeException {

    private final String field;
    private final double value;
    private final double min;
    private final double max;

    public ConfigOutOfRangeException(String field, double value, double min, double max) {
        super(field + " must be within [" + min + ", " + max + "] but was " + value);
        this.field = field;
        this.value = value;
        this.min = min;
        this.max = max;
    }
}
