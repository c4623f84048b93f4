package com.team.qametrics.model.score;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.team.qametrics.model.ticket.TicketStatusCategory;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 單一 ticket 的健康度評分結果。
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealthResult {

    /** 截斷到 [0, 100] 後的分數 */
    private double score;
    /** 畫面顯示用（四捨五入） */
    private long displayScore;
    /** 截斷前的累計分數，可能大於 100 或小於 0 */
    private double rawScore;

    private HealthStatus status;
    private String label;
    private String color;

    private List<HealthFactor> factors;

    private TicketStatusCategory statusCategory;
    /** 目前狀態負責的團隊，查不到為 Unknown */
    private String responsibleTeam;
}
