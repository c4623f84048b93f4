package com.team.qametrics.model.planning;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlanComparisonReport {

    /** ALL / DEV / QA */
    private String team;
    private ComparisonSummary summary;
    private List<EmployeeComparison> employees;
}
