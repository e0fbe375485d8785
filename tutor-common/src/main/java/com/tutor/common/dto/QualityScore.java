package com.tutor.common.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 内容综合质量分，用于判断内容能否进入学习计划。
 */
@Value
@Builder
public class QualityScore {

    /** 教育价值 */
    double educationalValue;

    /** 与声明等级的难度匹配度 */
    double difficultyMatch;

    /** 来源可信度（由调用方提供） */
    double sourceReliability;

    /** 内容新鲜度（由调用方提供） */
    double contentFreshness;

    /** 加权总分 */
    double overallScore;
}
