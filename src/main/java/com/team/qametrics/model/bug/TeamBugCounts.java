package com.team.qametrics.model.bug;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.team.qametrics.util.MetricValues;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 依團隊彙總的 bug 計數（DEV / QA / BIS Team 圖表用）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TeamBugCounts {

    private int totalBugs;
    private int open;
    private int closed;

    public void add(AssigneeBugCount count) {
        this.totalBugs += MetricValues.count(count.getTotal());
        this.open += MetricValues.count(count.getOpen());
        this.closed += MetricValues.count(count.getClosed());
    }
}
