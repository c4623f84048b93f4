package com.team.qametrics.service.dashboard;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.team.qametrics.model.employee.TeamLeads;
import com.team.qametrics.model.employee.TeamMembers;
import com.team.qametrics.model.planning.QaDevComparison;
import com.team.qametrics.model.score.HealthResult;
import com.team.qametrics.model.score.RagResult;
import lombok.Builder;
import lombok.Data;

/**
 * 單一 ticket 儀表板需要的所有衍生指標。
 * 沒有 ticket 追蹤紀錄時 health、qaVsDev 為 null，主管與成員為空。
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TicketDashboardView {

    private String ticketId;

    private RagResult ragStatus;
    private HealthResult health;

    private TeamLeads teamLeads;
    private TeamMembers teamMembers;

    private String currentAssignee;
    private String currentAssigneeTeam;

    private QaDevComparison qaVsDev;
}
