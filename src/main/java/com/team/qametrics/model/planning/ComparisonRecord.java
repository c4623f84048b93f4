package com.team.qametrics.model.planning;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * 單一比較單位（員工、ticket 或整體）的規劃 vs 實際工時。
 *
 * plannedHours 為 0 時 variancePercent、estimationAccuracy 與兩個 band 都是 null，
 * insufficientData 為 true，note 為 "Insufficient data"。
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ComparisonRecord {

    public static final String INSUFFICIENT_DATA = "Insufficient data";

    private double plannedHours;
    private double actualHours;
    /** actual - planned */
    private double variance;
    private Double variancePercent;
    /** clamp(100 - |variancePercent|, 0, 100) */
    private Double estimationAccuracy;
    /** under_estimate / on_track / over_estimate */
    private String varianceBand;
    /** excellent / good / fair / poor */
    private String accuracyBand;
    private boolean insufficientData;
    private String note;

    /** 實際工時超過規劃（以未四捨五入的值判斷），只供彙總使用 */
    @JsonIgnore
    private boolean overrun;
}
