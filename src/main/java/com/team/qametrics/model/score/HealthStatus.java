package com.team.qametrics.model.score;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 單一 ticket 健康度等級。label 與 BucketScheme.TICKET_HEALTH 的標籤一致。
 */
@Getter
@RequiredArgsConstructor
public enum HealthStatus {
    EXCELLENT("Excellent", "green"),
    GOOD("Good", "blue"),
    FAIR("Fair", "amber"),
    POOR("Poor", "orange"),
    CRITICAL("Critical", "red");

    private final String label;
    private final String color;

    public static HealthStatus fromLabel(String label) {
        for (HealthStatus status : values()) {
            if (status.label.equals(label)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown health status label: " + label);
    }
}
