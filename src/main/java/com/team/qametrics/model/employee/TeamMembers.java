package com.team.qametrics.model.employee;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 依團隊分組後的參與者名單。bis 收納所有非 DEV / QA 的人員。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TeamMembers {

    private List<String> dev = List.of();
    private List<String> qa = List.of();
    private List<String> bis = List.of();
}
