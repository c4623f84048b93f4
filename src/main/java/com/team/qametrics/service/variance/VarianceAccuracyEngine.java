package com.team.qametrics.service.variance;

import com.team.qametrics.model.employee.Employee;
import com.team.qametrics.model.employee.EmployeeDirectory;
import com.team.qametrics.model.employee.PersonId;
import com.team.qametrics.model.employee.TeamLabels;
import com.team.qametrics.model.planning.AccuracyTrend;
import com.team.qametrics.model.planning.ComparisonRecord;
import com.team.qametrics.model.planning.ComparisonSummary;
import com.team.qametrics.model.planning.EmployeeComparison;
import com.team.qametrics.model.planning.PeriodComparison;
import com.team.qametrics.model.planning.PlanComparisonReport;
import com.team.qametrics.model.planning.PlanningTask;
import com.team.qametrics.model.planning.QaDevComparison;
import com.team.qametrics.model.planning.TicketComparison;
import com.team.qametrics.model.planning.TimesheetEntry;
import com.team.qametrics.service.bucket.BucketClassifier;
import com.team.qametrics.service.bucket.BucketScheme;
import com.team.qametrics.service.team.TeamClassifier;
import com.team.qametrics.util.MetricValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 規劃工時 vs 實際工時比較。
 *
 * 每個比較單位（員工、員工底下的 ticket、全體、單一期間）都套用同一組規則：
 * - variance = actual - planned
 * - variancePercent = variance / planned * 100，planned 為 0 時不計算（Insufficient data）
 * - estimationAccuracy = clamp(100 - |variancePercent|, 0, 100)
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VarianceAccuracyEngine {

    static final String UNASSIGNED_TICKET = "Unassigned";

    private final BucketClassifier bucketClassifier;
    private final TeamClassifier teamClassifier;

    /**
     * 比較單一單位的規劃與實際工時。
     *
     * @param plannedHours 規劃工時（null、負數、非有限值視為 0）
     * @param actualHours  實際工時（同上）
     * @return 比較結果；工時取兩位小數，百分比取一位小數
     */
    public ComparisonRecord compare(Double plannedHours, Double actualHours) {
        double planned = MetricValues.nonNegative(plannedHours);
        double actual = MetricValues.nonNegative(actualHours);
        double variance = actual - planned;

        ComparisonRecord.ComparisonRecordBuilder record = ComparisonRecord.builder()
                .plannedHours(MetricValues.round2(planned))
                .actualHours(MetricValues.round2(actual))
                .variance(MetricValues.round2(variance));

        if (planned <= 0) {
            return record
                    .insufficientData(true)
                    .note(ComparisonRecord.INSUFFICIENT_DATA)
                    .build();
        }

        // 分桶與超支判斷用未四捨五入的值，四捨五入只用於顯示
        double rawPercent = variance / planned * 100;
        double rawAccuracy = MetricValues.clamp(100 - Math.abs(rawPercent), 0, 100);

        return record
                .variancePercent(MetricValues.round1(rawPercent))
                .estimationAccuracy(MetricValues.round1(rawAccuracy))
                .varianceBand(bucketClassifier.classify(rawPercent, BucketScheme.VARIANCE_BAND))
                .accuracyBand(bucketClassifier.classify(rawAccuracy, BucketScheme.ACCURACY_BAND))
                .overrun(actual > planned)
                .build();
    }

    /**
     * 不篩選團隊、不使用員工目錄的比較。
     */
    public PlanComparisonReport compare(List<PlanningTask> plans, List<TimesheetEntry> actuals) {
        return compare(plans, actuals, EmployeeDirectory.empty(), TeamLabels.ALL);
    }

    /**
     * 依員工彙總規劃與實際工時，並展開到 ticket 層級。
     * 員工以 PersonId 比對；只有實際工時而沒有規劃的員工也會列出（Insufficient data）。
     *
     * @param plans      規劃任務
     * @param actuals    工時表紀錄
     * @param directory  員工目錄（判斷團隊與顯示名稱）
     * @param teamFilter ALL、DEV、QA 或其他團隊標籤；null 視為 ALL
     * @return 比較報告
     */
    public PlanComparisonReport compare(List<PlanningTask> plans, List<TimesheetEntry> actuals,
                                        EmployeeDirectory directory, String teamFilter) {
        EmployeeDirectory employees = directory != null ? directory : EmployeeDirectory.empty();
        String team = normalizeTeamFilter(teamFilter);

        Map<PersonId, EmployeeHours> byEmployee = new LinkedHashMap<>();
        int skipped = 0;

        if (plans != null) {
            for (PlanningTask task : plans) {
                Optional<PersonId> id = task != null ? PersonId.of(task.getEmployeeName()) : Optional.empty();
                if (id.isEmpty()) {
                    skipped++;
                    continue;
                }
                byEmployee.computeIfAbsent(id.get(), k -> new EmployeeHours(task.getEmployeeName().trim()))
                        .addPlan(task);
            }
        }

        if (actuals != null) {
            for (TimesheetEntry entry : actuals) {
                Optional<PersonId> id = entry != null ? PersonId.of(entry.getEmployeeName()) : Optional.empty();
                if (id.isEmpty()) {
                    skipped++;
                    continue;
                }
                byEmployee.computeIfAbsent(id.get(), k -> new EmployeeHours(entry.getEmployeeName().trim()))
                        .addActual(entry);
            }
        }

        if (skipped > 0) {
            log.warn("規劃比較略過 {} 筆沒有員工姓名的紀錄", skipped);
        }

        List<EmployeeComparison> results = new ArrayList<>();
        double totalPlanned = 0;
        double totalActual = 0;

        for (Map.Entry<PersonId, EmployeeHours> e : byEmployee.entrySet()) {
            EmployeeHours hours = e.getValue();
            String displayName = employees.find(e.getKey())
                    .map(Employee::getName)
                    .orElse(hours.firstSeenName);
            String employeeTeam = teamClassifier.classifyPerson(displayName, employees);
            if (!matchesTeam(team, employeeTeam)) {
                continue;
            }

            List<TicketComparison> tickets = new ArrayList<>();
            hours.tickets.forEach((ticketId, ticketHours) ->
                    tickets.add(new TicketComparison(ticketId, compare(ticketHours[0], ticketHours[1]))));

            results.add(EmployeeComparison.builder()
                    .employeeName(displayName)
                    .team(employeeTeam)
                    .totals(compare(hours.planned, hours.actual))
                    .tickets(tickets)
                    .plannedTasks(List.copyOf(hours.plannedTasks))
                    .build());

            totalPlanned += hours.planned;
            totalActual += hours.actual;
        }

        ComparisonSummary summary = ComparisonSummary.from(compare(totalPlanned, totalActual), results.size());

        log.info("規劃比較完成：team={}，{} 位員工，規劃 {}h / 實際 {}h",
                team, results.size(), summary.getTotalPlannedHours(), summary.getTotalActualHours());

        return PlanComparisonReport.builder()
                .team(team)
                .summary(summary)
                .employees(results)
                .build();
    }

    /**
     * QA 實際工時與 Dev 實際工時的比較標籤。
     * 兩者都必須大於 0，否則回傳 "Insufficient data"。
     */
    public QaDevComparison compareQaToDev(Double actualQaHours, Double actualDevHours) {
        double qa = MetricValues.nonNegative(actualQaHours);
        double dev = MetricValues.nonNegative(actualDevHours);

        QaDevComparison.QaDevComparisonBuilder result = QaDevComparison.builder()
                .qaHours(MetricValues.round2(qa))
                .devHours(MetricValues.round2(dev));

        if (qa <= 0 || dev <= 0) {
            return result.label(ComparisonRecord.INSUFFICIENT_DATA).build();
        }

        double diffPercent = (qa - dev) / dev * 100;
        result.differencePercent(MetricValues.round1(diffPercent));

        if (diffPercent > 0) {
            return result.direction(QaDevComparison.Direction.HIGHER)
                    .label(String.format(Locale.ROOT, "%.0f%% higher than Dev", Math.abs(diffPercent)))
                    .build();
        } else if (diffPercent < 0) {
            return result.direction(QaDevComparison.Direction.LOWER)
                    .label(String.format(Locale.ROOT, "%.0f%% lower than Dev", Math.abs(diffPercent)))
                    .build();
        }
        return result.direction(QaDevComparison.Direction.EQUAL)
                .label("Equal to Dev time")
                .build();
    }

    /**
     * 多期估算準確度趨勢。平均值只計入 accuracy 有定義的期間。
     *
     * @param periods 依時間排序的期間彙總
     * @return 每期比較結果與平均準確度
     */
    public AccuracyTrend summarizeTrend(List<PeriodComparison> periods) {
        List<AccuracyTrend.TrendPoint> points = new ArrayList<>();
        if (periods != null) {
            for (PeriodComparison period : periods) {
                if (period == null) continue;
                points.add(new AccuracyTrend.TrendPoint(period.getPeriod(),
                        compare(period.getPlannedHours(), period.getActualHours())));
            }
        }

        List<Double> accuracies = points.stream()
                .map(p -> p.getComparison().getEstimationAccuracy())
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        Double average = accuracies.isEmpty()
                ? null
                : MetricValues.round1(accuracies.stream().mapToDouble(Double::doubleValue).average().orElse(0));

        return AccuracyTrend.builder()
                .trends(points)
                .averageAccuracy(average)
                .periodsWithData(accuracies.size())
                .build();
    }

    // ========== Private Helpers ==========

    private String normalizeTeamFilter(String teamFilter) {
        if (teamFilter == null || teamFilter.isBlank()) {
            return TeamLabels.ALL;
        }
        return teamFilter.trim();
    }

    private boolean matchesTeam(String filter, String employeeTeam) {
        return TeamLabels.ALL.equalsIgnoreCase(filter) || filter.equalsIgnoreCase(employeeTeam);
    }

    /**
     * 單一員工的工時累計，ticket 明細依第一次出現的順序保留。
     */
    private static final class EmployeeHours {
        private final String firstSeenName;
        private final Map<String, double[]> tickets = new LinkedHashMap<>();
        private final List<PlanningTask> plannedTasks = new ArrayList<>();
        private double planned;
        private double actual;

        EmployeeHours(String firstSeenName) {
            this.firstSeenName = firstSeenName;
        }

        void addPlan(PlanningTask task) {
            double hours = MetricValues.nonNegative(task.getPlannedHours());
            planned += hours;
            ticketHours(task.getTicketId())[0] += hours;
            plannedTasks.add(task);
        }

        void addActual(TimesheetEntry entry) {
            double hours = MetricValues.nonNegative(entry.getHours());
            actual += hours;
            ticketHours(entry.getTicketId())[1] += hours;
        }

        private double[] ticketHours(String ticketId) {
            String key = ticketId == null || ticketId.isBlank() ? UNASSIGNED_TICKET : ticketId.trim();
            return tickets.computeIfAbsent(key, k -> new double[2]);
        }
    }
}
