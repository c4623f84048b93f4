package com.team.qametrics.service.health;

import com.team.qametrics.config.StatusTeamMappingConfig.StatusTeamMapping;
import com.team.qametrics.config.TicketHealthConfig;
import com.team.qametrics.model.score.HealthFactor;
import com.team.qametrics.model.score.HealthFactor.Kind;
import com.team.qametrics.model.score.HealthResult;
import com.team.qametrics.model.score.HealthStatus;
import com.team.qametrics.model.ticket.TicketStatusCategory;
import com.team.qametrics.model.ticket.TicketTracking;
import com.team.qametrics.service.bucket.BucketClassifier;
import com.team.qametrics.service.bucket.BucketScheme;
import com.team.qametrics.util.MetricValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 單一 ticket 健康度評分（0~100）。
 *
 * 從 100 分開始累加扣分與加分，全部因素算完後才截斷到 [0, 100]：
 * 1. ETA：已結案不扣分；未設定扣 20；逾期每天扣 2（最多 30）；剩 3 天內扣 10
 * 2. Dev 工時差異：超支扣 overrun% * 0.25（最多 25）；低於預算加 5
 * 3. QA 工時差異：規則同 Dev，獨立計算上限
 * 4. QA / Dev 工時比：> 80% 扣 15；< 20% 扣 10；其餘加 5
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TicketHealthScorer {

    private static final double MAX_ETA_PENALTY = 30;
    private static final double MAX_VARIANCE_PENALTY = 25;
    private static final double UNDER_BUDGET_BONUS = 5;

    private final TicketStatusResolver statusResolver;
    private final StatusTeamMapping statusTeamMapping;
    private final TicketHealthConfig config;
    private final BucketClassifier bucketClassifier;
    private final Clock clock;

    /**
     * 以時鐘的今天為基準評分。
     */
    public HealthResult score(TicketTracking ticket) {
        return score(ticket, LocalDate.now(clock));
    }

    /**
     * 以指定日期為基準評分。
     *
     * @param ticket ticket 追蹤紀錄
     * @param today  計算 ETA 天數的基準日
     * @return 健康度評分結果
     */
    public HealthResult score(TicketTracking ticket, LocalDate today) {
        TicketTracking t = ticket != null ? ticket : new TicketTracking();
        TicketStatusCategory category = statusResolver.resolve(t.getStatus());

        ScoreSheet sheet = new ScoreSheet();
        applyEtaFactor(t, category, today != null ? today : LocalDate.now(clock), sheet);
        applyVarianceFactor(Kind.DEV_VARIANCE, "Dev",
                t.getDevEstimateHours(), t.getActualDevHours(), t.getDevDeviation(), sheet);
        applyVarianceFactor(Kind.QA_VARIANCE, "QA",
                t.getQaEstimateHours(), t.getActualQaHours(), t.getQaDeviation(), sheet);
        applyRatioFactor(t, sheet);

        double finalScore = MetricValues.clamp(sheet.score, 0, 100);
        HealthStatus status = HealthStatus.fromLabel(
                bucketClassifier.classify(finalScore, BucketScheme.TICKET_HEALTH));

        log.debug("Ticket {} 健康度：raw={}, final={} ({})，共 {} 個因素",
                t.getTicketId(), sheet.score, finalScore, status, sheet.factors.size());

        return HealthResult.builder()
                .score(finalScore)
                .displayScore(Math.round(finalScore))
                .rawScore(sheet.score)
                .status(status)
                .label(status.getLabel())
                .color(status.getColor())
                .factors(List.copyOf(sheet.factors))
                .statusCategory(category)
                .responsibleTeam(responsibleTeam(t.getStatus()))
                .build();
    }

    /**
     * 目前狀態負責的團隊，對照表中沒有的狀態回傳 Unknown。
     */
    public String responsibleTeam(String status) {
        return statusTeamMapping.teamFor(status);
    }

    // ========== Factors ==========

    private void applyEtaFactor(TicketTracking t, TicketStatusCategory category,
                                LocalDate today, ScoreSheet sheet) {
        if (category == TicketStatusCategory.CLOSED) {
            sheet.apply(Kind.ETA, 0, "Ticket closed");
            return;
        }

        LocalDate eta = t.getEta();
        if (eta == null) {
            sheet.apply(Kind.ETA, -20, "ETA not provided");
            return;
        }

        long daysUntilEta = ChronoUnit.DAYS.between(today, eta);
        if (daysUntilEta < 0) {
            long daysPastEta = -daysUntilEta;
            double penalty = Math.min(daysPastEta * 2, MAX_ETA_PENALTY);
            sheet.apply(Kind.ETA, -penalty, String.format(Locale.ROOT, "%d %s past ETA",
                    daysPastEta, days(daysPastEta)));
        } else if (daysUntilEta == 0) {
            sheet.apply(Kind.ETA, -10, "ETA today");
        } else if (daysUntilEta <= config.getUrgentEtaDays()) {
            sheet.apply(Kind.ETA, -10, String.format(Locale.ROOT, "%d %s to ETA",
                    daysUntilEta, days(daysUntilEta)));
        } else {
            sheet.apply(Kind.ETA, 0, String.format(Locale.ROOT, "%d %s to ETA",
                    daysUntilEta, days(daysUntilEta)));
        }
    }

    /**
     * 預估與實際工時都大於 0 時才計算；deviation 為正扣分，為負加分，為 0 不記錄。
     */
    private void applyVarianceFactor(Kind kind, String team, Double estimateHours, Double actualHours,
                                     Double deviationHours, ScoreSheet sheet) {
        double estimate = MetricValues.nonNegative(estimateHours);
        double actual = MetricValues.nonNegative(actualHours);
        if (estimate <= 0 || actual <= 0) {
            return;
        }

        double deviation = MetricValues.signed(deviationHours);
        if (deviation > 0) {
            double overrunPercent = deviation / estimate * 100;
            double penalty = Math.min(overrunPercent * 0.25, MAX_VARIANCE_PENALTY);
            sheet.apply(kind, -penalty, String.format(Locale.ROOT,
                    "%s %.1fh over budget (%.0f%% overrun)", team, deviation, overrunPercent));
        } else if (deviation < 0) {
            sheet.apply(kind, UNDER_BUDGET_BONUS, String.format(Locale.ROOT,
                    "%s %.1fh under budget", team, Math.abs(deviation)));
        }
    }

    private void applyRatioFactor(TicketTracking t, ScoreSheet sheet) {
        double actualDev = MetricValues.nonNegative(t.getActualDevHours());
        double actualQa = MetricValues.nonNegative(t.getActualQaHours());
        if (actualDev <= 0 || actualQa <= 0) {
            return;
        }

        double qaRatio = actualQa / actualDev * 100;
        if (qaRatio > 80) {
            // QA 相對開發時間過長
            sheet.apply(Kind.QA_DEV_RATIO, -15,
                    String.format(Locale.ROOT, "QA time is %.0f%% of Dev (high)", qaRatio));
        } else if (qaRatio < 20) {
            // QA 可能太趕
            sheet.apply(Kind.QA_DEV_RATIO, -10,
                    String.format(Locale.ROOT, "QA time is %.0f%% of Dev (low)", qaRatio));
        } else {
            sheet.apply(Kind.QA_DEV_RATIO, 5,
                    String.format(Locale.ROOT, "QA time is %.0f%% of Dev (optimal)", qaRatio));
        }
    }

    private static String days(long count) {
        return count == 1 ? "day" : "days";
    }

    /**
     * 累計分數與因素。分數在這裡不做截斷。
     */
    private static final class ScoreSheet {
        private double score = 100;
        private final List<HealthFactor> factors = new ArrayList<>();

        void apply(Kind kind, double impact, String message) {
            score += impact;
            factors.add(new HealthFactor(kind, impact, message));
        }
    }
}
