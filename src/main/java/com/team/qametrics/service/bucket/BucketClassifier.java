package com.team.qametrics.service.bucket;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 通用的門檻分桶工具：把數值對應到 BucketScheme 中的標籤。
 */
@Component
public class BucketClassifier {

    /**
     * 回傳第一個接納此值的分桶標籤，都不接納則回傳最後一桶。
     * NaN / Infinity 視為 0。
     *
     * @param value  要分類的數值
     * @param scheme 分桶規則
     * @return 分桶標籤
     */
    public String classify(double value, BucketScheme scheme) {
        double safe = Double.isFinite(value) ? value : 0.0;
        for (BucketScheme.Bound bound : scheme.getBounds()) {
            if (bound.admits(safe)) {
                return bound.getLabel();
            }
        }
        return scheme.getTerminalLabel();
    }

    /**
     * 統計每個分桶的數量。所有標籤都會出現（沒有資料為 0），順序與規則一致。
     * null 元素略過。
     *
     * @param values 數值集合
     * @param scheme 分桶規則
     * @return {標籤: 數量}
     */
    public Map<String, Integer> histogram(Collection<? extends Number> values, BucketScheme scheme) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String label : scheme.labels()) {
            counts.put(label, 0);
        }
        if (values == null) {
            return counts;
        }
        for (Number value : values) {
            if (value == null) continue;
            counts.merge(classify(value.doubleValue(), scheme), 1, Integer::sum);
        }
        return counts;
    }
}
