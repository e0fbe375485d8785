package com.tutor.common.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 等级评定结果。
 * <p>
 * {@code levelScores} 只包含内容所属等级体系内的等级，按由易到难排列；
 * {@code levelScores[assignedLevel]} 恒等于最高分，也恒等于 {@code confidenceScore}。
 */
@Value
@Builder
public class LevelGradingResult {

    /** 评定等级 */
    String assignedLevel;

    /** 置信度 (0-1) */
    double confidenceScore;

    /** 各等级匹配分 */
    Map<String, Double> levelScores;

    /** 评定所用的质量指标 */
    QualityMetrics qualityMetrics;

    /** 改进建议（有序） */
    @Singular
    List<String> recommendations;
}
