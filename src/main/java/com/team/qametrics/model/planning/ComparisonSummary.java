package com.team.qametrics.model.planning;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * 全體彙總。overEstimation 表示實際工時超過規劃（未四捨五入的 variancePercent > 0），
 * 規劃工時為 0 時一律為 false。
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ComparisonSummary {

    private int employeeCount;
    private double totalPlannedHours;
    private double totalActualHours;
    private double variance;
    private Double variancePercent;
    private Double estimationAccuracy;
    private String varianceBand;
    private String accuracyBand;
    private boolean overEstimation;
    private boolean insufficientData;
    private String note;

    public static ComparisonSummary from(ComparisonRecord totals, int employeeCount) {
        return ComparisonSummary.builder()
                .employeeCount(employeeCount)
                .totalPlannedHours(totals.getPlannedHours())
                .totalActualHours(totals.getActualHours())
                .variance(totals.getVariance())
                .variancePercent(totals.getVariancePercent())
                .estimationAccuracy(totals.getEstimationAccuracy())
                .varianceBand(totals.getVarianceBand())
                .accuracyBand(totals.getAccuracyBand())
                .overEstimation(totals.isOverrun())
                .insufficientData(totals.isInsufficientData())
                .note(totals.getNote())
                .build();
    }
}
