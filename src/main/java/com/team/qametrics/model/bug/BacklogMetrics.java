package com.team.qametrics.model.bug;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * 由 BugSummary 推導出的 backlog 比例（皆為 0~100 的百分比）。
 * totalBugs 為 0 時三個比例都是 0。
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BacklogMetrics {

    private int totalBugs;
    /** closed / total * 100 */
    private double closurePercentage;
    /** critical / total * 100 */
    private double criticalPercentage;
    /** open / total * 100 */
    private double openRatio;
}
