package com.tutor.grading.lookup;

import lombok.Builder;
import lombok.Value;

/**
 * JLPT 单个等级的评估标准。
 */
@Value
@Builder
public class JlptLevelCriteria {

    /** 等级，如 N3 */
    String level;

    /** 汉字量要求 */
    int kanjiCount;

    /** 词汇量要求 */
    int vocabularyRange;

    /** 目标汉字占比 */
    double targetKanjiRatio;

    /** 目标平假名占比 */
    double targetHiraganaRatio;

    /** 词汇适配度：汉字占比区间 */
    double minKanjiRatio;
    double maxKanjiRatio;

    /** 词汇适配度：平假名占比区间 */
    double minHiraganaRatio;
    double maxHiraganaRatio;

    /** 等级评分：目标语法复杂度 */
    double targetComplexity;
}
