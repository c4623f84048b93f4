package com.team.qametrics.model.planning;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 多期估算準確度趨勢。averageAccuracy 只平均有定義的期間，全部無定義時為 null。
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AccuracyTrend {

    private List<TrendPoint> trends;
    private Double averageAccuracy;
    private int periodsWithData;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class TrendPoint {
        private String period;

        @JsonUnwrapped
        private ComparisonRecord comparison;
    }
}
