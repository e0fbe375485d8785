package com.tutor.common.util;

/**
 * 评分数值工具类。所有启发式分数在输出前都经过截断。
 */
public final class ScoreUtils {

    private ScoreUtils() {
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    /**
     * 截断到 [0.0, 1.0]。
     */
    public static double clamp01(double value) {
        return clamp(value, 0.0, 1.0);
    }

    /**
     * 安全除法，分母为 0 时返回 0。
     */
    public static double ratio(double numerator, double denominator) {
        return denominator == 0 ? 0.0 : numerator / denominator;
    }

    /**
     * 四舍五入到指定小数位，仅用于日志与报告展示。
     */
    public static double round(double value, int scale) {
        double factor = Math.pow(10, scale);
        return Math.round(value * factor) / factor;
    }
}
