package com.calai.goals.energy.common;

public record AdaptiveTdee(
        int tdee,
        Confidence confidence,
        boolean fallback,
        String fallbackReason,
        Double weightTrendKg,
        Integer avgIntakeKcal,
        Integer daysOfData
) {
    public enum Confidence { LOW, MEDIUM, HIGH }

    public static AdaptiveTdee fallback(double tdee, String reason) {
        return new AdaptiveTdee((int) Math.round(tdee), Confidence.LOW, true, reason, null, null, null);
    }
}
