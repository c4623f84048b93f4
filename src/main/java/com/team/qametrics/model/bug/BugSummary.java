package com.team.qametrics.model.bug;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 單一 ticket（或整體）的 bug 狀態計數，來自後端 /bugs/summary。
 * 各狀態計數相加不一定等於 totalBugs（狀態分類可能重疊），這裡不做檢查。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BugSummary {

    private Integer totalBugs;
    private Integer openBugs;
    private Integer pendingRetest;
    private Integer closedBugs;
    private Integer deferredBugs;
    private Integer rejectedBugs;
}
