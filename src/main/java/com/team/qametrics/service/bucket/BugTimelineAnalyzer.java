package com.team.qametrics.service.bucket;

import com.team.qametrics.model.bug.AgeAnalysis;
import com.team.qametrics.model.bug.ResolutionTimeAnalysis;
import com.team.qametrics.util.MetricValues;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bug 時間軸分析：未關閉 bug 的存活天數、已關閉 bug 的處理天數、重開比例。
 * 輸入為已算好的天數（整數），沒有日期的 bug 由呼叫端以 null 表示。
 */
@Service
@RequiredArgsConstructor
public class BugTimelineAnalyzer {

    private final BucketClassifier bucketClassifier;

    /**
     * 分析未關閉 bug 的存活天數。
     * 沒有建立日期的 bug 以 null 表示：計入未關閉總數，但不參與平均、最久與分桶。
     *
     * @param ageDays 每個未關閉 bug 的存活天數
     * @return 平均、最久與分桶統計
     */
    public AgeAnalysis analyzeAge(List<Integer> ageDays) {
        List<Integer> ages = sanitize(ageDays);
        int totalOpen = ageDays != null ? ageDays.size() : 0;

        int oldest = ages.stream().mapToInt(Integer::intValue).max().orElse(0);
        double average = ages.stream().mapToInt(Integer::intValue).average().orElse(0.0);

        return AgeAnalysis.builder()
                .averageAgeDays(MetricValues.round1(average))
                .oldestAgeDays(oldest)
                .totalOpenBugs(totalOpen)
                .ageBuckets(bucketClassifier.histogram(ages, BucketScheme.AGE_DAYS))
                .build();
    }

    /**
     * 分析已關閉 bug 的處理天數。
     * 中位數取排序後索引 size / 2 的元素（偶數筆時取較大的中間值）。
     *
     * @param resolutionDays 每個已關閉 bug 從建立到關閉的天數
     * @return 平均、中位數、最快、最慢與分桶統計；沒有資料時全部為 0
     */
    public ResolutionTimeAnalysis analyzeResolution(List<Integer> resolutionDays) {
        List<Integer> days = sanitize(resolutionDays);

        ResolutionTimeAnalysis.ResolutionTimeAnalysisBuilder result = ResolutionTimeAnalysis.builder()
                .totalResolved(days.size())
                .timeBuckets(bucketClassifier.histogram(days, BucketScheme.RESOLUTION_DAYS));

        if (days.isEmpty()) {
            return result.build();
        }

        List<Integer> sorted = new ArrayList<>(days);
        Collections.sort(sorted);
        double average = sorted.stream().mapToInt(Integer::intValue).average().orElse(0.0);

        return result
                .averageDays(MetricValues.round1(average))
                .medianDays(sorted.get(sorted.size() / 2))
                .fastestDays(sorted.get(0))
                .slowestDays(sorted.get(sorted.size() - 1))
                .build();
    }

    /**
     * 重開 bug 佔全部 bug 的百分比，小數一位；totalBugs 為 0 時回傳 0。
     */
    public double reopenedPercentage(int reopenedBugs, int totalBugs) {
        return MetricValues.round1(MetricValues.percentage(
                Math.max(0, reopenedBugs), Math.max(0, totalBugs)));
    }

    // ========== Private Helpers ==========

    /**
     * 略過 null，負值視為 0。
     */
    private List<Integer> sanitize(List<Integer> values) {
        if (values == null) {
            return List.of();
        }
        List<Integer> result = new ArrayList<>(values.size());
        for (Integer value : values) {
            if (value != null) {
                result.add(Math.max(0, value));
            }
        }
        return result;
    }
}
