package com.team.qametrics.model.employee;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TeamLeads {

    private List<LeadInfo> devLeads = List.of();
    private List<LeadInfo> qaLeads = List.of();

    public static TeamLeads none() {
        return new TeamLeads(List.of(), List.of());
    }
}
