package com.tutor.vocabulary.strategy;

import lombok.Builder;
import lombok.Value;

/**
 * 抽取策略产出的候选词条，尚未打上来源标签。
 */
@Value
@Builder
public class VocabularyCandidate {

    String word;

    /** 读音（日语假名或英语音标） */
    String reading;

    String definition;

    String exampleSentence;
}
