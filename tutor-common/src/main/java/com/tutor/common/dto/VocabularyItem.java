package com.tutor.common.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 从内容中抽取出的词汇条目。
 */
@Value
@Builder
public class VocabularyItem {

    /** 单词 */
    String word;

    /** 读音（日语假名读法，或英语音标），可为空 */
    String reading;

    /** 释义，可为空 */
    String definition;

    /** 例句，可为空 */
    String exampleSentence;

    /** 来源内容声明的等级 */
    String level;

    /** 语言代码 */
    String language;

    /** 来源地址 */
    String sourceUrl;

    /** 音频地址，可为空 */
    String audioUrl;
}
