package com.team.qametrics.model.planning;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 單一員工的規劃 vs 實際比較，附 ticket 層級明細與原始排定任務。
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EmployeeComparison {

    private String employeeName;
    /** DEV / QA / BIS Team / 主檔中的其他團隊 */
    private String team;

    @JsonUnwrapped
    private ComparisonRecord totals;

    private List<TicketComparison> tickets;
    private List<PlanningTask> plannedTasks;
}
