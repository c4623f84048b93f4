package com.team.qametrics.service.dashboard;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.qametrics.config.StatusTeamMappingConfig.StatusTeamMapping;
import com.team.qametrics.config.TicketHealthConfig;
import com.team.qametrics.model.bug.BugSummary;
import com.team.qametrics.model.bug.CriticalMetric;
import com.team.qametrics.model.bug.TeamBugCounts;
import com.team.qametrics.model.employee.EmployeeDirectory;
import com.team.qametrics.model.employee.LeadInfo;
import com.team.qametrics.model.planning.AccuracyTrend;
import com.team.qametrics.model.planning.PlanComparisonReport;
import com.team.qametrics.model.score.HealthStatus;
import com.team.qametrics.model.score.RagStatus;
import com.team.qametrics.service.bucket.BucketClassifier;
import com.team.qametrics.service.health.TicketHealthScorer;
import com.team.qametrics.service.health.TicketStatusResolver;
import com.team.qametrics.service.rag.RagScorer;
import com.team.qametrics.service.team.TeamClassifier;
import com.team.qametrics.service.variance.VarianceAccuracyEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class DashboardMetricsServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    private static final String EMPLOYEES = """
            [
              {"employee_id": "E001", "name": "Asha", "team": "DEVELOPMENT", "email": "asha@example.com", "role": "Tech Lead"},
              {"employee_id": "E002", "name": "Ravi", "team": "DEVELOPMENT", "lead": "Asha"},
              {"employee_id": "E003", "name": "Meera", "team": "DEVELOPMENT", "lead": "Asha"},
              {"employee_id": "E004", "name": "Priya", "team": "QA", "lead": "Kiran"}
            ]
            """;

    private static final String TICKET = """
            {
              "ticket_id": "1987",
              "status": "QC Testing",
              "eta": "2026-10-14",
              "dev_estimate_hours": 40, "actual_dev_hours": 40, "dev_deviation": 20,
              "qa_estimate_hours": 12, "actual_qa_hours": 10, "qa_deviation": -2,
              "developers": ["Ravi", "Meera", "Client Bob"],
              "qc_testers": ["Priya"],
              "current_assignee": "Priya"
            }
            """;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private DashboardMetricsService service;

    @BeforeEach
    void setUp() {
        TicketHealthConfig config = new TicketHealthConfig();
        BucketClassifier buckets = new BucketClassifier();
        TeamClassifier teams = new TeamClassifier();
        Clock clock = Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        TicketHealthScorer healthScorer = new TicketHealthScorer(new TicketStatusResolver(config),
                new StatusTeamMapping(Map.of("QC Testing", "QA")), config, buckets, clock);

        service = new DashboardMetricsService(new RagScorer(buckets), healthScorer, teams,
                new VarianceAccuracyEngine(buckets, teams), new MetricsPayloadReader(objectMapper));
    }

    @Test
    void buildTicketView_fromBackendPayloads() {
        TicketDashboardView view = service.buildTicketView(
                "{\"total_bugs\": 100, \"open_bugs\": 80, \"closed_bugs\": 10}", 25, TICKET, EMPLOYEES);

        assertThat(view.getTicketId()).isEqualTo("1987");
        assertThat(view.getRagStatus().getStatus()).isEqualTo(RagStatus.RED);
        assertThat(view.getRagStatus().getScore()).isZero();

        assertThat(view.getHealth().getScore()).isEqualTo(87.5);
        assertThat(view.getHealth().getStatus()).isEqualTo(HealthStatus.EXCELLENT);
        assertThat(view.getHealth().getResponsibleTeam()).isEqualTo("QA");

        assertThat(view.getTeamLeads().getDevLeads()).extracting(LeadInfo::getName).containsExactly("Asha");
        assertThat(view.getTeamLeads().getQaLeads()).extracting(LeadInfo::getName).containsExactly("Kiran");
        assertThat(view.getTeamMembers().getDev()).containsExactly("Ravi", "Meera");
        assertThat(view.getTeamMembers().getBis()).containsExactly("Client Bob");

        assertThat(view.getCurrentAssigneeTeam()).isEqualTo("QA");
        assertThat(view.getQaVsDev().getLabel()).isEqualTo("75% lower than Dev");
    }

    @Test
    void buildTicketView_withoutTicketReturnsBacklogOnly() {
        TicketDashboardView view = service.buildTicketView("", 0, null, EMPLOYEES);

        assertThat(view.getRagStatus().getLabel()).isEqualTo("No Issues");
        assertThat(view.getHealth()).isNull();
        assertThat(view.getQaVsDev()).isNull();
        assertThat(view.getTeamLeads().getDevLeads()).isEmpty();
        assertThat(view.getTeamMembers().getBis()).isEmpty();
    }

    @Test
    void buildTicketView_withoutTicketNeverScoresHealth() {
        TicketHealthScorer healthScorer = mock(TicketHealthScorer.class);
        TeamClassifier teams = new TeamClassifier();
        DashboardMetricsService isolated = new DashboardMetricsService(
                new RagScorer(new BucketClassifier()), healthScorer, teams,
                new VarianceAccuracyEngine(new BucketClassifier(), teams),
                new MetricsPayloadReader(objectMapper));

        isolated.buildTicketView(new BugSummary(), CriticalMetric.of(0), null, EmployeeDirectory.empty(), TODAY);

        verifyNoInteractions(healthScorer);
    }

    @Test
    void ticketView_serializesWithSnakeCaseKeys() {
        TicketDashboardView view = service.buildTicketView(
                "{\"total_bugs\": 0}", 0, TICKET, EMPLOYEES);

        JsonNode json = objectMapper.valueToTree(view);

        assertThat(json.has("rag_status")).isTrue();
        assertThat(json.at("/health/display_score").asLong()).isEqualTo(88L);
        assertThat(json.at("/team_leads/qa_leads/0/name").asText()).isEqualTo("Kiran");
        assertThat(json.at("/team_leads/qa_leads/0").has("email")).isTrue();
        assertThat(json.at("/team_leads/qa_leads/0/email").isNull()).isTrue();
        assertThat(json.at("/qa_vs_dev/difference_percent").asDouble()).isEqualTo(-75.0);
    }

    @Test
    void buildPlanComparison_fromBackendPayloads() {
        PlanComparisonReport report = service.buildPlanComparison(
                """
                [{"employee_name": "Ravi", "ticket_id": "101", "planned_hours": 8},
                 {"employee_name": "Priya", "ticket_id": "101", "planned_hours": 4}]
                """,
                """
                [{"employee_name": "ravi", "ticket_id": "101", "hours": 10},
                 {"employee_name": "Priya", "ticket_id": "101", "hours": 4}]
                """,
                EMPLOYEES, "DEV");

        assertThat(report.getEmployees()).singleElement().satisfies(employee -> {
            assertThat(employee.getEmployeeName()).isEqualTo("Ravi");
            assertThat(employee.getTotals().getVariancePercent()).isEqualTo(25.0);
        });
        assertThat(report.getSummary().isOverEstimation()).isTrue();

        JsonNode json = objectMapper.valueToTree(report);
        assertThat(json.at("/summary/total_planned_hours").asDouble()).isEqualTo(8.0);
        assertThat(json.at("/employees/0/estimation_accuracy").asDouble()).isEqualTo(75.0);
        assertThat(json.at("/employees/0/tickets/0/ticket_id").asText()).isEqualTo("101");
    }

    @Test
    void buildAccuracyTrend_fromBackendPayload() {
        AccuracyTrend trend = service.buildAccuracyTrend("""
                [{"period": "2026-W41", "planned_hours": 40, "actual_hours": 36},
                 {"period": "2026-W42", "planned_hours": 0, "actual_hours": 12}]
                """);

        assertThat(trend.getAverageAccuracy()).isEqualTo(90.0);
        assertThat(trend.getPeriodsWithData()).isEqualTo(1);
    }

    @Test
    void buildTeamSummary_fromBackendPayloads() {
        Map<String, TeamBugCounts> summary = service.buildTeamSummary("""
                {"Ravi": {"total": 6, "open": 2, "closed": 4},
                 "Client Bob": {"total": 1, "open": 1, "closed": 0}}
                """, EMPLOYEES);

        assertThat(summary.keySet()).containsExactly("DEV", "QA", "BIS Team");
        assertThat(summary.get("DEV").getTotalBugs()).isEqualTo(6);
        assertThat(summary.get("BIS Team").getOpen()).isEqualTo(1);
    }
}
