package com.team.qametrics.model.bug;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Critical 等級的 bug 數量。百分比由 RagScorer 依 totalBugs 推導。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CriticalMetric {

    private Integer criticalBugs;

    public static CriticalMetric of(int criticalBugs) {
        return new CriticalMetric(criticalBugs);
    }
}
