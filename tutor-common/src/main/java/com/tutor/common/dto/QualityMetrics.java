package com.tutor.common.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 八项质量子指标，取值均在 [0.0, 1.0]。
 */
@Value
@Builder
public class QualityMetrics {

    /** 词汇难度与目标等级的匹配度 */
    double vocabularyAppropriateness;

    /** 语法复杂度 */
    double grammarComplexity;

    /** 内容结构完整度 */
    double contentStructure;

    /** 教育价值 */
    double educationalValue;

    /** 语言地道性（当前为占位常量） */
    double authenticity;

    /** 文化相关性（当前为占位常量） */
    double culturalRelevance;

    /** 可读性 */
    double readability;

    /** 趣味互动性 */
    double engagementFactor;
}
