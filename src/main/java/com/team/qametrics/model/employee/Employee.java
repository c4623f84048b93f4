package com.team.qametrics.model.employee;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 員工主檔（後端 /employees 的一筆）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Employee {

    public static final String TEAM_DEVELOPMENT = "DEVELOPMENT";
    public static final String TEAM_QA = "QA";

    private String employeeId;
    private String name;
    /** DEVELOPMENT、QA 或其他團隊名稱 */
    private String team;
    /** 直屬主管姓名，可能不在員工主檔中 */
    private String lead;
    private String email;
    private String role;

    public boolean isDevelopment() {
        return team != null && TEAM_DEVELOPMENT.equalsIgnoreCase(team.trim());
    }

    public boolean isQa() {
        return team != null && TEAM_QA.equalsIgnoreCase(team.trim());
    }

    public boolean hasLead() {
        return lead != null && !lead.isBlank();
    }
}
