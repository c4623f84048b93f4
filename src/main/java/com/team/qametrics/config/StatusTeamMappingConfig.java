package com.team.qametrics.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Ticket 狀態 → 負責團隊對照表讀取器。
 * 從 status-team-mapping.yml 讀取，例如 "QC Testing" → "QA"。
 */
@Configuration
@Slf4j
public class StatusTeamMappingConfig {

    static final String MAPPING_RESOURCE = "status-team-mapping.yml";

    /**
     * 從 classpath 載入 status-team-mapping.yml 並解析為唯讀的 StatusTeamMapping。
     */
    @Bean
    public StatusTeamMapping statusTeamMapping() {
        return load(MAPPING_RESOURCE);
    }

    StatusTeamMapping load(String resource) {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (inputStream == null) {
                log.warn("找不到 {}，所有狀態都將對應到 Unknown", resource);
                return StatusTeamMapping.empty();
            }

            Map<String, Object> raw = new Yaml().load(inputStream);
            return parseMapping(raw);

        } catch (Exception e) {
            log.error("載入 {} 失敗：{}", resource, e.getMessage());
            return StatusTeamMapping.empty();
        }
    }

    /**
     * 將 YAML 原始 Map 的 statuses 區塊解析為 StatusTeamMapping。
     */
    @SuppressWarnings("unchecked")
    StatusTeamMapping parseMapping(Map<String, Object> raw) {
        if (raw == null || !(raw.get("statuses") instanceof Map)) {
            log.warn("狀態對照表缺少 statuses 區塊，使用空白對照");
            return StatusTeamMapping.empty();
        }

        Map<String, Object> statuses = (Map<String, Object>) raw.get("statuses");
        Map<String, String> entries = new LinkedHashMap<>();
        statuses.forEach((status, team) -> {
            if (status != null && team != null) {
                entries.put(status, String.valueOf(team));
            }
        });

        log.info("已載入 {} 筆狀態對照", entries.size());
        return new StatusTeamMapping(entries);
    }

    // ========== 內部資料類別 ==========

    /**
     * 唯讀的狀態 → 團隊對照。查詢時忽略前後空白與大小寫。
     */
    public static class StatusTeamMapping {

        public static final String UNKNOWN_TEAM = "Unknown";

        private final Map<String, String> teamsByStatus;

        public StatusTeamMapping(Map<String, String> entries) {
            Map<String, String> normalized = new LinkedHashMap<>();
            entries.forEach((status, team) ->
                    normalized.putIfAbsent(normalize(status), team));
            this.teamsByStatus = Collections.unmodifiableMap(normalized);
        }

        public static StatusTeamMapping empty() {
            return new StatusTeamMapping(Map.of());
        }

        public String teamFor(String status) {
            if (status == null || status.isBlank()) {
                return UNKNOWN_TEAM;
            }
            return teamsByStatus.getOrDefault(normalize(status), UNKNOWN_TEAM);
        }

        public int size() {
            return teamsByStatus.size();
        }

        private static String normalize(String status) {
            return status.trim().toLowerCase(Locale.ROOT);
        }
    }
}
