package com.team.qametrics.service.rag;

import com.team.qametrics.model.bug.BacklogMetrics;
import com.team.qametrics.model.bug.BugSummary;
import com.team.qametrics.model.bug.CriticalMetric;
import com.team.qametrics.model.score.RagResult;
import com.team.qametrics.model.score.RagStatus;
import com.team.qametrics.service.bucket.BucketClassifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class RagScorerTest {

    private final RagScorer scorer = new RagScorer(new BucketClassifier());

    @ParameterizedTest
    @CsvSource({
            "0, 0, 0",
            "50, 0, 0",
            "0, 30, 30"
    })
    void score_noBugsIsAlwaysGreenNoIssues(int critical, int open, int closed) {
        BugSummary summary = BugSummary.builder()
                .totalBugs(0).openBugs(open).closedBugs(closed).build();

        RagResult result = scorer.score(summary, CriticalMetric.of(critical));

        assertThat(result.getStatus()).isEqualTo(RagStatus.GREEN);
        assertThat(result.getLabel()).isEqualTo("No Issues");
        assertThat(result.getScore()).isEqualTo(100);
        assertThat(result.getFactors()).isEmpty();
    }

    @Test
    void score_allAxesBad_isRedAtZero() {
        RagResult result = scorer.score(summary(100, 80, 10), CriticalMetric.of(25));

        assertThat(result.getScore()).isZero();
        assertThat(result.getStatus()).isEqualTo(RagStatus.RED);
        assertThat(result.getLabel()).isEqualTo("Critical");
        assertThat(result.getColor()).isEqualTo("#ef4444");
        assertThat(result.getFactors())
                .containsExactly("High critical bugs", "Low closure rate", "High open bugs");
    }

    @Test
    void score_healthyBacklog_reportsAllMetricsGood() {
        RagResult result = scorer.score(summary(50, 10, 35), CriticalMetric.of(2));

        assertThat(result.getScore()).isEqualTo(100);
        assertThat(result.getStatus()).isEqualTo(RagStatus.GREEN);
        assertThat(result.getLabel()).isEqualTo("Healthy");
        assertThat(result.getFactors()).containsExactly("All metrics good");
        assertThat(result.getMetrics().getCriticalPercentage()).isEqualTo(4.0);
        assertThat(result.getMetrics().getClosurePercentage()).isEqualTo(70.0);
        assertThat(result.getMetrics().getOpenRatio()).isEqualTo(20.0);
    }

    @Test
    void score_greenWithModerateFactorKeepsFactor() {
        RagResult result = scorer.score(summary(100, 20, 70), CriticalMetric.of(15));

        assertThat(result.getScore()).isEqualTo(80);
        assertThat(result.getStatus()).isEqualTo(RagStatus.GREEN);
        assertThat(result.getFactors()).containsExactly("Moderate critical bugs");
    }

    @Test
    void score_deductionsAreIndependent() {
        RagResult result = scorer.score(summary(100, 50, 40), CriticalMetric.of(15));

        assertThat(result.getScore()).isEqualTo(50);
        assertThat(result.getStatus()).isEqualTo(RagStatus.AMBER);
        assertThat(result.getLabel()).isEqualTo("Needs Attention");
        assertThat(result.getFactors())
                .containsExactly("Moderate critical bugs", "Moderate closure rate", "Moderate open bugs");
    }

    @ParameterizedTest
    @CsvSource({
            "0, 20, 0, 70, GREEN",
            "15, 50, 0, 65, AMBER",
            "0, 20, 80, 40, AMBER",
            "25, 20, 0, 30, RED"
    })
    void score_statusBoundaries(double critical, double closure, double open,
                                int expectedScore, RagStatus expectedStatus) {
        RagResult result = scorer.score(metrics(100, critical, closure, open));

        assertThat(result.getScore()).isEqualTo(expectedScore);
        assertThat(result.getStatus()).isEqualTo(expectedStatus);
    }

    @Test
    void score_isMonotonicInCriticalPercentage() {
        int previous = Integer.MAX_VALUE;
        for (int critical = 0; critical <= 100; critical++) {
            int score = scorer.score(summary(100, 30, 70), CriticalMetric.of(critical)).getScore();
            assertThat(score).isLessThanOrEqualTo(previous);
            previous = score;
        }
    }

    @Test
    void score_isMonotonicInOpenRatio() {
        int previous = Integer.MAX_VALUE;
        for (int open = 0; open <= 100; open++) {
            int score = scorer.score(summary(100, open, 70), CriticalMetric.of(0)).getScore();
            assertThat(score).isLessThanOrEqualTo(previous);
            previous = score;
        }
    }

    @Test
    void score_scoreIsNotClampedAfterDeductions() {
        // 三個因素最多扣 100 分，分數直接回報不再截斷
        RagResult result = scorer.score(metrics(10, 100, 0, 100));

        assertThat(result.getScore()).isZero();
        assertThat(result.getFactors()).hasSize(3);
    }

    @ParameterizedTest
    @CsvSource({
            "0, NaN, 0, 70, Low closure rate",
            "0, Infinity, 0, 70, Low closure rate",
            "NaN, 80, 0, 100, All metrics good",
            "-Infinity, 80, Infinity, 100, All metrics good"
    })
    void score_nonFinitePercentagesAreTreatedAsZero(double critical, double closure, double open,
                                                   int expectedScore, String expectedFactor) {
        RagResult result = scorer.score(metrics(10, critical, closure, open));

        assertThat(result.getScore()).isEqualTo(expectedScore);
        assertThat(result.getStatus()).isEqualTo(RagStatus.GREEN);
        assertThat(result.getFactors()).containsExactly(expectedFactor);
    }

    @Test
    void deriveMetrics_toleratesMissingAndNegativeCounts() {
        BugSummary summary = BugSummary.builder().totalBugs(20).openBugs(null).closedBugs(-4).build();

        BacklogMetrics metrics = scorer.deriveMetrics(summary, null);

        assertThat(metrics.getTotalBugs()).isEqualTo(20);
        assertThat(metrics.getOpenRatio()).isZero();
        assertThat(metrics.getClosurePercentage()).isZero();
        assertThat(metrics.getCriticalPercentage()).isZero();
    }

    @Test
    void score_nullSummaryIsNoIssues() {
        assertThat(scorer.score(null, null).getLabel()).isEqualTo("No Issues");
    }

    private static BugSummary summary(int total, int open, int closed) {
        return BugSummary.builder()
                .totalBugs(total)
                .openBugs(open)
                .closedBugs(closed)
                .pendingRetest(0)
                .deferredBugs(0)
                .rejectedBugs(0)
                .build();
    }

    private static BacklogMetrics metrics(int total, double critical, double closure, double open) {
        return BacklogMetrics.builder()
                .totalBugs(total)
                .criticalPercentage(critical)
                .closurePercentage(closure)
                .openRatio(open)
                .build();
    }
}
