package com.team.qametrics.util;

/**
 * 指標數值的共用工具。
 * 後端回傳的欄位可能缺漏、為負或非有限值，進入任何比例計算前一律先經過這裡。
 */
public final class MetricValues {

    private MetricValues() {
    }

    /**
     * 工時 / 數量類欄位：null、負數、NaN、Infinity 一律視為 0。
     */
    public static double nonNegative(Double value) {
        if (value == null || !Double.isFinite(value) || value < 0) {
            return 0.0;
        }
        return value;
    }

    /**
     * 計數欄位：null 或負數視為 0。
     */
    public static int count(Integer value) {
        if (value == null || value < 0) {
            return 0;
        }
        return value;
    }

    /**
     * 可帶正負號的欄位（如 deviation）：只排除 null 與非有限值。
     */
    public static double signed(Double value) {
        if (value == null || !Double.isFinite(value)) {
            return 0.0;
        }
        return value;
    }

    /**
     * 百分比 = part / total * 100，total 為 0 時回傳 0。
     */
    public static double percentage(double part, double total) {
        if (total <= 0) {
            return 0.0;
        }
        return part / total * 100;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /** 四捨五入到小數一位 */
    public static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }

    /** 四捨五入到小數兩位 */
    public static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
