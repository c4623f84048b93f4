package com.team.qametrics.service.dashboard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.qametrics.model.bug.AssigneeBugCount;
import com.team.qametrics.model.bug.BugSummary;
import com.team.qametrics.model.employee.Employee;
import com.team.qametrics.model.employee.EmployeeDirectory;
import com.team.qametrics.model.planning.PeriodComparison;
import com.team.qametrics.model.planning.PlanningTask;
import com.team.qametrics.model.planning.TimesheetEntry;
import com.team.qametrics.model.ticket.TicketTracking;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 將後端 JSON 回應轉成引擎的輸入模型。
 * 空白或 "null" 的回應視為沒有資料；結構錯誤則拋出 MetricsPayloadException。
 * 未知欄位一律忽略（後端回應常帶額外欄位）。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MetricsPayloadReader {

    private final ObjectMapper objectMapper;

    public BugSummary readBugSummary(String json) {
        BugSummary summary = read(json, new TypeReference<BugSummary>() {}, "bug summary");
        return summary != null ? summary : new BugSummary();
    }

    /**
     * @return ticket 追蹤紀錄；回應為空時回傳 null
     */
    public TicketTracking readTicketTracking(String json) {
        return read(json, new TypeReference<TicketTracking>() {}, "ticket tracking");
    }

    public EmployeeDirectory readEmployeeDirectory(String json) {
        List<Employee> employees = read(json, new TypeReference<List<Employee>>() {}, "employees");
        EmployeeDirectory directory = EmployeeDirectory.of(employees);
        log.debug("已載入員工目錄：{} 人", directory.size());
        return directory;
    }

    public List<PlanningTask> readPlanningTasks(String json) {
        List<PlanningTask> tasks = read(json, new TypeReference<List<PlanningTask>>() {}, "planning tasks");
        return tasks != null ? tasks : List.of();
    }

    public List<TimesheetEntry> readTimesheetEntries(String json) {
        List<TimesheetEntry> entries = read(json, new TypeReference<List<TimesheetEntry>>() {}, "timesheet entries");
        return entries != null ? entries : List.of();
    }

    public List<PeriodComparison> readPeriodComparisons(String json) {
        List<PeriodComparison> periods = read(json, new TypeReference<List<PeriodComparison>>() {}, "period comparisons");
        return periods != null ? periods : List.of();
    }

    /**
     * 讀取 assignee breakdown：{姓名: {total, open, closed, ...}}，保留原始順序。
     */
    public Map<String, AssigneeBugCount> readAssigneeBreakdown(String json) {
        Map<String, AssigneeBugCount> counts = read(json,
                new TypeReference<LinkedHashMap<String, AssigneeBugCount>>() {}, "assignee breakdown");
        return counts != null ? counts : Map.of();
    }

    // ========== Private Helpers ==========

    private <T> T read(String json, TypeReference<T> type, String kind) {
        if (json == null || json.isBlank()) {
            log.debug("{} 回應為空，視為沒有資料", kind);
            return null;
        }
        try {
            return objectMapper.readerFor(type)
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(json);
        } catch (JsonProcessingException e) {
            log.warn("解析 {} 回應失敗：{}", kind, e.getOriginalMessage());
            throw new MetricsPayloadException(kind, e);
        }
    }
}
