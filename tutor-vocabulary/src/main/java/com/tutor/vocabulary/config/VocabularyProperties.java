package com.tutor.vocabulary.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 词汇抽取模块配置项。
 */
@Data
@ConfigurationProperties(prefix = "tutor.vocabulary")
public class VocabularyProperties {

    /** 单条内容最多返回的词汇条目数 */
    private int maxItems = 10;

    /** 结构化模式全部落空时，从等级词表兜底匹配的最大词数 */
    private int fallbackMaxWords = 5;

    /** 兜底时在目标词前后截取的上下文字符数（再按句子边界对齐） */
    private int contextWindowChars = 200;

    /** 是否只保留声明等级词表中的词（词表为空时不过滤） */
    private boolean levelFilterEnabled = false;
}
