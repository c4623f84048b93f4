package com.team.qametrics.model.score;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.team.qametrics.model.bug.BacklogMetrics;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Backlog RAG 評分結果。score 不做下限截斷，可能為負值。
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RagResult {

    private RagStatus status;
    private String label;
    private String color;
    private int score;
    /** 觸發的扣分原因，依檢查順序排列 */
    private List<String> factors;
    private BacklogMetrics metrics;
}
