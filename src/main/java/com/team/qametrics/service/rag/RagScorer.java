package com.team.qametrics.service.rag;

import com.team.qametrics.model.bug.BacklogMetrics;
import com.team.qametrics.model.bug.BugSummary;
import com.team.qametrics.model.bug.CriticalMetric;
import com.team.qametrics.model.score.RagResult;
import com.team.qametrics.model.score.RagStatus;
import com.team.qametrics.service.bucket.BucketClassifier;
import com.team.qametrics.service.bucket.BucketScheme;
import com.team.qametrics.util.MetricValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Backlog 層級的 RAG（紅黃綠）評分。
 *
 * 從 100 分開始，三個因素各自獨立扣分（不互斥）：
 * 1. Critical bug 比例：> 20% 扣 40，> 10% 扣 20
 * 2. 關閉率：< 30% 扣 30，< 60% 扣 15
 * 3. 未關閉比例：> 70% 扣 30，> 40% 扣 15
 *
 * 分數不設下限。>= 70 GREEN，>= 40 AMBER，其餘 RED。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RagScorer {

    static final String NO_ISSUES_LABEL = "No Issues";
    static final String ALL_METRICS_GOOD = "All metrics good";

    private final BucketClassifier bucketClassifier;

    /**
     * 由 bug 計數推導 backlog 比例。totalBugs 為 0 時所有比例為 0。
     */
    public BacklogMetrics deriveMetrics(BugSummary summary, CriticalMetric critical) {
        int total = summary != null ? MetricValues.count(summary.getTotalBugs()) : 0;
        int closed = summary != null ? MetricValues.count(summary.getClosedBugs()) : 0;
        int open = summary != null ? MetricValues.count(summary.getOpenBugs()) : 0;
        int criticalBugs = critical != null ? MetricValues.count(critical.getCriticalBugs()) : 0;

        return BacklogMetrics.builder()
                .totalBugs(total)
                .closurePercentage(MetricValues.percentage(closed, total))
                .criticalPercentage(MetricValues.percentage(criticalBugs, total))
                .openRatio(MetricValues.percentage(open, total))
                .build();
    }

    /**
     * 依 bug 計數評分。
     *
     * @param summary  bug 狀態計數
     * @param critical critical bug 數量
     * @return RAG 評分結果
     */
    public RagResult score(BugSummary summary, CriticalMetric critical) {
        return score(deriveMetrics(summary, critical));
    }

    /**
     * 依已推導的比例評分。
     *
     * @param metrics backlog 比例
     * @return RAG 評分結果
     */
    public RagResult score(BacklogMetrics metrics) {
        if (metrics == null || metrics.getTotalBugs() == 0) {
            return RagResult.builder()
                    .status(RagStatus.GREEN)
                    .label(NO_ISSUES_LABEL)
                    .color(RagStatus.GREEN.getColor())
                    .score(100)
                    .factors(List.of())
                    .metrics(metrics)
                    .build();
        }

        // NaN / Infinity 會讓所有比較都不成立，先轉為 0
        double criticalPercentage = MetricValues.nonNegative(metrics.getCriticalPercentage());
        double closurePercentage = MetricValues.nonNegative(metrics.getClosurePercentage());
        double openRatio = MetricValues.nonNegative(metrics.getOpenRatio());

        int score = 100;
        List<String> factors = new ArrayList<>();

        // 因素 1：Critical bug 比例
        if (criticalPercentage > 20) {
            score -= 40;
            factors.add("High critical bugs");
        } else if (criticalPercentage > 10) {
            score -= 20;
            factors.add("Moderate critical bugs");
        }

        // 因素 2：關閉率
        if (closurePercentage < 30) {
            score -= 30;
            factors.add("Low closure rate");
        } else if (closurePercentage < 60) {
            score -= 15;
            factors.add("Moderate closure rate");
        }

        // 因素 3：未關閉比例
        if (openRatio > 70) {
            score -= 30;
            factors.add("High open bugs");
        } else if (openRatio > 40) {
            score -= 15;
            factors.add("Moderate open bugs");
        }

        RagStatus status = RagStatus.valueOf(bucketClassifier.classify(score, BucketScheme.BACKLOG_RAG));
        if (status == RagStatus.GREEN && factors.isEmpty()) {
            factors.add(ALL_METRICS_GOOD);
        }

        log.debug("Backlog RAG 評分：total={}, critical={}%, closure={}%, open={}% → {} ({})",
                metrics.getTotalBugs(), criticalPercentage, closurePercentage, openRatio, score, status);

        return RagResult.builder()
                .status(status)
                .label(status.getLabel())
                .color(status.getColor())
                .score(score)
                .factors(List.copyOf(factors))
                .metrics(metrics)
                .build();
    }
}
