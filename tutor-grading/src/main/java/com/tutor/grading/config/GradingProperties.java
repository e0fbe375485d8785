package com.tutor.grading.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 评级模块配置项。
 */
@Data
@ConfigurationProperties(prefix = "tutor.grading")
public class GradingProperties {

    /** 等级词表所在的 classpath 目录 */
    private String vocabularyLocation = "vocabulary/";

    /** 改进建议触发阈值 */
    private Recommendation recommendation = new Recommendation();

    /**
     * 各子指标低于阈值时给出对应建议。
     */
    @Data
    public static class Recommendation {
        private double vocabularyThreshold = 0.7;
        private double grammarThreshold = 0.6;
        private double structureThreshold = 0.7;
        private double educationalThreshold = 0.8;
        private double readabilityThreshold = 0.6;
    }
}
