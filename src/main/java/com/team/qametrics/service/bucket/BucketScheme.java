package com.team.qametrics.service.bucket;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 由小到大排列的分桶規則，最後一桶沒有上限。
 *
 * 每個上限可為「含」（value <= limit）或「不含」（value < limit），
 * 剛好落在邊界上的值歸入哪一桶由此決定。
 */
@Getter
public final class BucketScheme {

    /** 未關閉 bug 的存活天數 */
    public static final BucketScheme AGE_DAYS = named("age-days")
            .upTo(7, "0-7")
            .upTo(30, "7-30")
            .upTo(60, "30-60")
            .otherwise("60+");

    /** bug 從建立到關閉的天數 */
    public static final BucketScheme RESOLUTION_DAYS = named("resolution-days")
            .below(1, "<1")
            .upTo(3, "1-3")
            .upTo(7, "3-7")
            .upTo(30, "7-30")
            .otherwise("30+");

    /** 工時差異百分比 */
    public static final BucketScheme VARIANCE_BAND = named("variance-band")
            .below(-10, "under_estimate")
            .upTo(10, "on_track")
            .otherwise("over_estimate");

    /** 估算準確度百分比 */
    public static final BucketScheme ACCURACY_BAND = named("accuracy-band")
            .below(50, "poor")
            .below(75, "fair")
            .below(90, "good")
            .otherwise("excellent");

    /** Ticket 健康度分數，標籤對應 HealthStatus */
    public static final BucketScheme TICKET_HEALTH = named("ticket-health")
            .below(40, "Critical")
            .below(55, "Poor")
            .below(70, "Fair")
            .below(85, "Good")
            .otherwise("Excellent");

    /** Backlog RAG 分數，標籤對應 RagStatus */
    public static final BucketScheme BACKLOG_RAG = named("backlog-rag")
            .below(40, "RED")
            .below(70, "AMBER")
            .otherwise("GREEN");

    private final String name;
    private final List<Bound> bounds;
    private final String terminalLabel;

    private BucketScheme(String name, List<Bound> bounds, String terminalLabel) {
        this.name = name;
        this.bounds = Collections.unmodifiableList(bounds);
        this.terminalLabel = terminalLabel;
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    /**
     * 依順序列出所有標籤（含最後一桶）。
     */
    public List<String> labels() {
        List<String> labels = new ArrayList<>(bounds.size() + 1);
        bounds.forEach(b -> labels.add(b.getLabel()));
        labels.add(terminalLabel);
        return labels;
    }

    @Override
    public String toString() {
        return name + labels();
    }

    /**
     * 單一分桶的上限。
     */
    @Getter
    @AllArgsConstructor
    public static final class Bound {
        private final double limit;
        private final boolean inclusive;
        private final String label;

        boolean admits(double value) {
            return inclusive ? value <= limit : value < limit;
        }
    }

    public static final class Builder {

        private final String name;
        private final List<Bound> bounds = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        /** value <= limit 歸入此桶 */
        public Builder upTo(double limit, String label) {
            return add(new Bound(limit, true, label));
        }

        /** value < limit 歸入此桶 */
        public Builder below(double limit, String label) {
            return add(new Bound(limit, false, label));
        }

        /** 最後一桶，收納超過所有上限的值 */
        public BucketScheme otherwise(String label) {
            return new BucketScheme(name, new ArrayList<>(bounds), label);
        }

        private Builder add(Bound bound) {
            if (!Double.isFinite(bound.getLimit())) {
                throw new IllegalArgumentException("Bucket limit must be finite: " + bound.getLabel());
            }
            if (!bounds.isEmpty() && bound.getLimit() < bounds.get(bounds.size() - 1).getLimit()) {
                throw new IllegalArgumentException("Bucket limits must be ascending in scheme " + name);
            }
            bounds.add(bound);
            return this;
        }
    }
}
