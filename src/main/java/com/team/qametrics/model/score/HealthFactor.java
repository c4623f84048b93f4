package com.team.qametrics.model.score;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 健康度計分中觸發的單一因素。
 * impact 為對分數的加減（資訊性因素為 0），message 由同一組數值產生。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealthFactor {

    private Kind kind;
    private double impact;
    private String message;

    public enum Kind {
        ETA,
        DEV_VARIANCE,
        QA_VARIANCE,
        QA_DEV_RATIO
    }
}
