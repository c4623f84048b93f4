package com.team.qametrics.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 提供「今天」的時鐘，ETA 計算一律從這裡取日期。
 */
@Configuration
public class MetricsClockConfig {

    @Value("${metrics.time-zone:}")
    private String timeZone;

    @Bean
    public Clock metricsClock() {
        if (timeZone == null || timeZone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(timeZone));
    }
}
