package com.calai.goals.macro.common;

/**
 * splitBalanced=false 代表輸入的百分比沒加到 100；數字照算，但呼叫端要把警告顯示出來。
 */
public record MacroTargets(
        int carbsG,
        int proteinG,
        int fatG,
        int fiberG,
        boolean splitBalanced
) {}
