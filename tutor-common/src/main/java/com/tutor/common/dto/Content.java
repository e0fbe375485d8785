package com.tutor.common.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 待评级的学习内容，由外部抓取模块提供，进入评级引擎后不再修改。
 */
@Value
@Builder(toBuilder = true)
public class Content {

    /** 内容ID */
    String contentId;

    /** 标题 */
    @Builder.Default
    String title = "";

    /** 正文原文 */
    @Builder.Default
    String body = "";

    /** 内容语言 */
    @Builder.Default
    Language language = Language.OTHER;

    /** 声明的难度等级（可能缺失或不准确），如 CET-4、N3 */
    String difficultyLevel;

    /** 内容类型 */
    @Builder.Default
    ContentType contentType = ContentType.ARTICLE;

    /** 来源地址 */
    @Builder.Default
    String sourceUrl = "";

    /** 标签 */
    @Singular
    List<String> tags;

    /** 标题，null 视为空串 */
    public String getTitle() {
        return title == null ? "" : title;
    }

    /** 正文，null 视为空串 */
    public String getBody() {
        return body == null ? "" : body;
    }

    /** 语言，null 视为 {@link Language#OTHER} */
    public Language getLanguage() {
        return language == null ? Language.OTHER : language;
    }

    /**
     * 参与分析的完整文本：标题 + 空格 + 正文。
     */
    public String fullText() {
        return getTitle() + " " + getBody();
    }
}
