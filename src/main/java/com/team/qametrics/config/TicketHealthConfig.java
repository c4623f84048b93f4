package com.team.qametrics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Ticket 健康度計分設定。
 */
@Configuration
@ConfigurationProperties(prefix = "metrics.ticket-health")
@Getter
@Setter
public class TicketHealthConfig {

    /** 狀態文字包含任一標籤（不分大小寫）即視為已結案 */
    private List<String> closedStatusLabels = new ArrayList<>(List.of("closed", "moved to live", "completed"));

    /** 距離 ETA 幾天內（含）視為緊急 */
    private int urgentEtaDays = 3;
}
