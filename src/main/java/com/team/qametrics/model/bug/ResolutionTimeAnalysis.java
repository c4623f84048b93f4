package com.team.qametrics.model.bug;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 已關閉 bug 從建立到關閉的天數分析。
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ResolutionTimeAnalysis {

    private double averageDays;
    private int medianDays;
    private int fastestDays;
    private int slowestDays;
    private int totalResolved;
    /** {"<1": n, "1-3": n, "3-7": n, "7-30": n, "30+": n}，順序固定 */
    private Map<String, Integer> timeBuckets;
}
