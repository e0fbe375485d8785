package com.tutor.grading.lookup;

import lombok.Builder;
import lombok.Value;

/**
 * CET 单个等级的评估标准。
 */
@Value
@Builder
public class CetLevelCriteria {

    /** 等级，如 CET-4 */
    String level;

    /** 词汇量要求 */
    int vocabularyRange;

    /** 词汇适配度：平均词长区间 */
    double minWordLength;
    double maxWordLength;

    /** 等级准确度：平均句长区间（词/句） */
    double minSentenceLength;
    double maxSentenceLength;

    /** 等级评分：目标平均词长 */
    double targetWordLength;

    /** 等级评分：目标平均句长 */
    double targetSentenceLength;

    /** 等级评分：目标语法复杂度 */
    double targetComplexity;
}
