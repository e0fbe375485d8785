package com.tutor.vocabulary.strategy;

import java.util.List;

/**
 * 词汇抽取策略。抽取器按优先级依次尝试，第一个产出有效候选的策略胜出。
 */
public interface ExtractionStrategy {

    /** 策略名称，用于日志 */
    String name();

    /**
     * 从文本中抽取有效候选词条，按出现顺序返回；没有匹配时返回空列表。
     */
    List<VocabularyCandidate> tryExtract(String text);
}
