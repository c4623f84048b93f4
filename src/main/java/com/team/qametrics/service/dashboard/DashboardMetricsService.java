package com.team.qametrics.service.dashboard;

import com.team.qametrics.model.bug.BugSummary;
import com.team.qametrics.model.bug.CriticalMetric;
import com.team.qametrics.model.bug.TeamBugCounts;
import com.team.qametrics.model.employee.EmployeeDirectory;
import com.team.qametrics.model.employee.TeamLeads;
import com.team.qametrics.model.employee.TeamMembers;
import com.team.qametrics.model.planning.AccuracyTrend;
import com.team.qametrics.model.planning.PlanComparisonReport;
import com.team.qametrics.model.score.HealthResult;
import com.team.qametrics.model.score.RagResult;
import com.team.qametrics.model.ticket.TicketTracking;
import com.team.qametrics.service.health.TicketHealthScorer;
import com.team.qametrics.service.rag.RagScorer;
import com.team.qametrics.service.team.TeamClassifier;
import com.team.qametrics.service.variance.VarianceAccuracyEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Map;

/**
 * 儀表板指標組裝服務。
 * UI 在所有後端回應都到齊後呼叫，每次呼叫只使用傳入的資料快照，不保留任何狀態。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DashboardMetricsService {

    private final RagScorer ragScorer;
    private final TicketHealthScorer healthScorer;
    private final TeamClassifier teamClassifier;
    private final VarianceAccuracyEngine varianceEngine;
    private final MetricsPayloadReader payloadReader;

    /**
     * 以時鐘的今天組裝單一 ticket 的儀表板指標。
     */
    public TicketDashboardView buildTicketView(BugSummary summary, CriticalMetric critical,
                                               TicketTracking ticket, EmployeeDirectory directory) {
        return buildTicketView(summary, critical, ticket, directory, null);
    }

    /**
     * 組裝單一 ticket 的儀表板指標。
     *
     * @param summary   bug 狀態計數
     * @param critical  critical bug 數量
     * @param ticket    ticket 追蹤紀錄，可為 null
     * @param directory 員工目錄
     * @param today     ETA 基準日，null 表示使用時鐘
     * @return 儀表板指標
     */
    public TicketDashboardView buildTicketView(BugSummary summary, CriticalMetric critical,
                                               TicketTracking ticket, EmployeeDirectory directory,
                                               LocalDate today) {
        RagResult rag = ragScorer.score(summary, critical);

        if (ticket == null) {
            log.info("沒有 ticket 追蹤紀錄，只計算 backlog RAG：{} ({})", rag.getStatus(), rag.getScore());
            return TicketDashboardView.builder()
                    .ragStatus(rag)
                    .teamLeads(TeamLeads.none())
                    .teamMembers(new TeamMembers())
                    .build();
        }

        HealthResult health = today != null
                ? healthScorer.score(ticket, today)
                : healthScorer.score(ticket);

        String assignee = ticket.getCurrentAssignee();
        String assigneeTeam = assignee == null || assignee.isBlank()
                ? null
                : teamClassifier.classifyPerson(assignee, directory);

        TicketDashboardView view = TicketDashboardView.builder()
                .ticketId(ticket.getTicketId())
                .ragStatus(rag)
                .health(health)
                .teamLeads(teamClassifier.deriveLeads(ticket, directory))
                .teamMembers(teamClassifier.segregateTicketMembers(ticket, directory))
                .currentAssignee(assignee)
                .currentAssigneeTeam(assigneeTeam)
                .qaVsDev(varianceEngine.compareQaToDev(ticket.getActualQaHours(), ticket.getActualDevHours()))
                .build();

        log.info("Ticket {} 指標：RAG={} ({})，健康度={} ({})，負責團隊={}",
                ticket.getTicketId(), rag.getStatus(), rag.getScore(),
                health.getDisplayScore(), health.getLabel(), health.getResponsibleTeam());

        return view;
    }

    /**
     * 直接使用後端 JSON 回應組裝單一 ticket 的儀表板指標。
     *
     * @param summaryJson   /bugs/summary 回應
     * @param criticalBugs  critical bug 數量
     * @param ticketJson    ticket 追蹤回應，可為空
     * @param employeesJson /employees 回應
     */
    public TicketDashboardView buildTicketView(String summaryJson, int criticalBugs,
                                               String ticketJson, String employeesJson) {
        return buildTicketView(
                payloadReader.readBugSummary(summaryJson),
                CriticalMetric.of(criticalBugs),
                payloadReader.readTicketTracking(ticketJson),
                payloadReader.readEmployeeDirectory(employeesJson));
    }

    /**
     * 直接使用後端 JSON 回應產生規劃比較報告。
     *
     * @param plansJson     規劃任務清單
     * @param timesheetJson 工時表紀錄清單
     * @param employeesJson 員工清單
     * @param team          ALL、DEV 或 QA
     */
    public PlanComparisonReport buildPlanComparison(String plansJson, String timesheetJson,
                                                    String employeesJson, String team) {
        return varianceEngine.compare(
                payloadReader.readPlanningTasks(plansJson),
                payloadReader.readTimesheetEntries(timesheetJson),
                payloadReader.readEmployeeDirectory(employeesJson),
                team);
    }

    /**
     * 直接使用後端 JSON 回應產生多期準確度趨勢。
     */
    public AccuracyTrend buildAccuracyTrend(String periodsJson) {
        return varianceEngine.summarizeTrend(payloadReader.readPeriodComparisons(periodsJson));
    }

    /**
     * 直接使用後端 JSON 回應產生依團隊彙總的 bug 計數。
     */
    public Map<String, TeamBugCounts> buildTeamSummary(String assigneeJson, String employeesJson) {
        return teamClassifier.summarizeByTeam(
                payloadReader.readAssigneeBreakdown(assigneeJson),
                payloadReader.readEmployeeDirectory(employeesJson));
    }
}
