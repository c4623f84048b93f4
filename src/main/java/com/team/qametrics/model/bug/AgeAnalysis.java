package com.team.qametrics.model.bug;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 未關閉 bug 的存活天數分析。
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgeAnalysis {

    private double averageAgeDays;
    private int oldestAgeDays;
    private int totalOpenBugs;
    /** {"0-7": n, "7-30": n, "30-60": n, "60+": n}，順序固定 */
    private Map<String, Integer> ageBuckets;
}
