package com.team.qametrics.model.ticket;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Ticket 追蹤紀錄（後端 ticket-tracking 回應）。
 * 所有數值欄位皆可能缺漏，計分前由 MetricValues 轉為 0。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TicketTracking {

    private String ticketId;

    /** 自由文字狀態，例如 "QC Testing"、"Moved to Live" */
    private String status;

    private LocalDate eta;

    // ===== 開發工時 =====
    private Double devEstimateHours;
    private Double actualDevHours;
    /** actual - estimate，可為負值 */
    private Double devDeviation;

    // ===== QA 工時 =====
    private Double qaEstimateHours;
    private Double actualQaHours;
    private Double qaDeviation;

    // ===== 參與人員 =====
    private List<String> developers;
    private List<String> qcTesters;
    private String currentAssignee;
}
