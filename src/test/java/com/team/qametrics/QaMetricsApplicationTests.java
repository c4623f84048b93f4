package com.team.qametrics;

import com.team.qametrics.config.StatusTeamMappingConfig.StatusTeamMapping;
import com.team.qametrics.config.TicketHealthConfig;
import com.team.qametrics.service.dashboard.DashboardMetricsService;
import com.team.qametrics.service.dashboard.TicketDashboardView;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "metrics.time-zone=UTC")
class QaMetricsApplicationTests {

    @Autowired
    private DashboardMetricsService dashboardMetricsService;

    @Autowired
    private StatusTeamMapping statusTeamMapping;

    @Autowired
    private TicketHealthConfig ticketHealthConfig;

    @Autowired
    private Clock clock;

    @Test
    void contextLoads() {
        assertThat(statusTeamMapping.size()).isEqualTo(29);
        assertThat(ticketHealthConfig.getClosedStatusLabels())
                .containsExactly("closed", "moved to live", "completed");
        assertThat(ticketHealthConfig.getUrgentEtaDays()).isEqualTo(3);
        assertThat(clock.getZone().getId()).isEqualTo("UTC");
    }

    @Test
    void dashboardUsesBoundObjectMapper() {
        TicketDashboardView view = dashboardMetricsService.buildTicketView(
                "{\"total_bugs\": 10, \"open_bugs\": 2, \"closed_bugs\": 8, \"unexpected\": true}", 0,
                "{\"ticket_id\": \"77\", \"status\": \"Closed\", \"eta\": \"2020-01-01\"}",
                "[]");

        assertThat(view.getRagStatus().getFactors()).containsExactly("All metrics good");
        assertThat(view.getHealth().getScore()).isEqualTo(100.0);
        assertThat(view.getHealth().getResponsibleTeam()).isEqualTo("Completed");
    }
}
