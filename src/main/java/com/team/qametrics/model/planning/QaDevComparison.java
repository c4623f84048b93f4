package com.team.qametrics.model.planning;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * QA 實際工時相對於 Dev 實際工時的比較。
 * 兩者任一不大於 0 時 differencePercent 與 direction 為 null，label 為 "Insufficient data"。
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QaDevComparison {

    private double qaHours;
    private double devHours;
    /** (qa - dev) / dev * 100 */
    private Double differencePercent;
    private Direction direction;
    private String label;

    public enum Direction {
        HIGHER, LOWER, EQUAL
    }
}
