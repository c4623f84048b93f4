package com.team.qametrics.service.team;

import com.team.qametrics.model.bug.AssigneeBugCount;
import com.team.qametrics.model.bug.TeamBugCounts;
import com.team.qametrics.model.employee.Employee;
import com.team.qametrics.model.employee.EmployeeDirectory;
import com.team.qametrics.model.employee.LeadInfo;
import com.team.qametrics.model.employee.PersonId;
import com.team.qametrics.model.employee.TeamLabels;
import com.team.qametrics.model.employee.TeamLeads;
import com.team.qametrics.model.employee.TeamMembers;
import com.team.qametrics.model.ticket.TicketTracking;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 團隊歸屬判斷。
 *
 * 職責：
 * 1. 依員工目錄判斷某人屬於 DEV、QA 或 BIS Team（不在目錄中 = 客戶端）
 * 2. 從 ticket 的開發與 QA 人員推導出不重複的團隊主管
 * 3. 將參與者與 assignee bug 計數依團隊分組
 */
@Service
@Slf4j
public class TeamClassifier {

    /**
     * 判斷某人的團隊。
     *
     * @param name      姓名（比對時忽略前後空白與大小寫）
     * @param directory 員工目錄
     * @return DEV、QA、目錄中的其他團隊名稱、BIS Team（不在目錄中）或 Unknown（姓名空白或目錄沒有團隊）
     */
    public String classifyPerson(String name, EmployeeDirectory directory) {
        Optional<PersonId> id = PersonId.of(name);
        if (id.isEmpty()) {
            return TeamLabels.UNKNOWN;
        }

        Optional<Employee> employee = orEmpty(directory).find(id.get());
        if (employee.isEmpty()) {
            // 不在員工主檔 = 客戶端人員
            return TeamLabels.BIS_TEAM;
        }

        Employee e = employee.get();
        if (e.isDevelopment()) return TeamLabels.DEV;
        if (e.isQa()) return TeamLabels.QA;
        if (e.getTeam() == null || e.getTeam().isBlank()) return TeamLabels.UNKNOWN;
        return e.getTeam();
    }

    /**
     * 從 ticket 的開發人員與 QA 人員推導團隊主管。
     * 主管以小寫姓名去重，保留第一次出現的順序。
     *
     * @param ticket    ticket 追蹤紀錄
     * @param directory 員工目錄
     * @return DEV 主管與 QA 主管清單
     */
    public TeamLeads deriveLeads(TicketTracking ticket, EmployeeDirectory directory) {
        if (ticket == null) {
            return TeamLeads.none();
        }

        EmployeeDirectory employees = orEmpty(directory);
        List<LeadInfo> devLeads = collectLeads(ticket.getDevelopers(), Employee::isDevelopment, employees);
        List<LeadInfo> qaLeads = collectLeads(ticket.getQcTesters(), Employee::isQa, employees);

        log.debug("Ticket {} 推導出 {} 位 DEV 主管、{} 位 QA 主管",
                ticket.getTicketId(), devLeads.size(), qaLeads.size());

        return new TeamLeads(devLeads, qaLeads);
    }

    /**
     * 將人員依團隊分成 dev / qa / bis 三組，非 DEV、QA 的人員都歸入 bis。
     */
    public TeamMembers segregate(List<String> names, EmployeeDirectory directory) {
        List<String> dev = new ArrayList<>();
        List<String> qa = new ArrayList<>();
        List<String> bis = new ArrayList<>();

        if (names != null) {
            for (String name : names) {
                if (name == null || name.isBlank()) continue;
                String team = classifyPerson(name, directory);
                if (TeamLabels.DEV.equals(team)) {
                    dev.add(name);
                } else if (TeamLabels.QA.equals(team)) {
                    qa.add(name);
                } else {
                    bis.add(name);
                }
            }
        }

        return new TeamMembers(dev, qa, bis);
    }

    /**
     * 將 ticket 的參與者分組：dev 取自開發人員、qa 取自 QA 人員，
     * bis 合併兩邊的客戶端人員並去重。
     */
    public TeamMembers segregateTicketMembers(TicketTracking ticket, EmployeeDirectory directory) {
        if (ticket == null) {
            return new TeamMembers();
        }

        TeamMembers developers = segregate(ticket.getDevelopers(), directory);
        TeamMembers testers = segregate(ticket.getQcTesters(), directory);

        Set<String> bis = new LinkedHashSet<>(developers.getBis());
        bis.addAll(testers.getBis());

        return new TeamMembers(developers.getDev(), testers.getQa(), new ArrayList<>(bis));
    }

    /**
     * Ticket 中不屬於 DEV / QA 的參與者（開發與 QA 名單合併去重）。
     */
    public List<String> externalParticipants(TicketTracking ticket, EmployeeDirectory directory) {
        return segregateTicketMembers(ticket, directory).getBis();
    }

    /**
     * 依團隊彙總每位 assignee 的 bug 計數。
     * DEV、QA、BIS Team 一定出現且排在最前面，其餘團隊依出現順序附加。
     *
     * @param assigneeCounts {assignee 姓名: 計數}
     * @param directory      員工目錄
     * @return {團隊: 彙總計數}
     */
    public Map<String, TeamBugCounts> summarizeByTeam(Map<String, AssigneeBugCount> assigneeCounts,
                                                      EmployeeDirectory directory) {
        Map<String, TeamBugCounts> summary = new LinkedHashMap<>();
        summary.put(TeamLabels.DEV, new TeamBugCounts());
        summary.put(TeamLabels.QA, new TeamBugCounts());
        summary.put(TeamLabels.BIS_TEAM, new TeamBugCounts());

        if (assigneeCounts == null) {
            return summary;
        }

        assigneeCounts.forEach((assignee, count) -> {
            if (count == null) return;
            String team = classifyPerson(assignee, directory);
            summary.computeIfAbsent(team, t -> new TeamBugCounts()).add(count);
        });
        return summary;
    }

    // ========== Private Helpers ==========

    private EmployeeDirectory orEmpty(EmployeeDirectory directory) {
        return directory != null ? directory : EmployeeDirectory.empty();
    }

    private List<LeadInfo> collectLeads(List<String> members, Predicate<Employee> teamFilter,
                                        EmployeeDirectory directory) {
        Map<PersonId, LeadInfo> leads = new LinkedHashMap<>();
        if (members == null) {
            return List.of();
        }

        for (String member : members) {
            Optional<Employee> employee = directory.find(member);
            if (employee.isEmpty() || !teamFilter.test(employee.get()) || !employee.get().hasLead()) {
                continue;
            }

            LeadInfo lead = resolveLead(employee.get().getLead(), directory);
            PersonId.of(lead.getName()).ifPresent(id -> leads.putIfAbsent(id, lead));
        }
        return new ArrayList<>(leads.values());
    }

    /**
     * 主管在目錄中時帶出完整資料，否則只保留姓名。
     */
    private LeadInfo resolveLead(String leadName, EmployeeDirectory directory) {
        return directory.find(leadName)
                .map(LeadInfo::from)
                .orElseGet(() -> LeadInfo.unresolved(leadName));
    }
}
