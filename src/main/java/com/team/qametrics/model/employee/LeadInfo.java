package com.team.qametrics.model.employee;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ticket 相關的團隊主管。
 * 主管不在員工主檔時只有 name，其餘欄位為 null。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LeadInfo {

    private String employeeId;
    private String name;
    private String email;
    private String role;

    public static LeadInfo from(Employee employee) {
        return LeadInfo.builder()
                .employeeId(employee.getEmployeeId())
                .name(employee.getName())
                .email(employee.getEmail())
                .role(employee.getRole())
                .build();
    }

    public static LeadInfo unresolved(String name) {
        return LeadInfo.builder().name(name).build();
    }
}
