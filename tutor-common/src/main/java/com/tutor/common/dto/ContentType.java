package com.tutor.common.dto;

/**
 * 学习内容类型。
 */
public enum ContentType {
    ARTICLE,
    NEWS,
    DIALOGUE,
    EXERCISE,
    CULTURAL,
    AUDIO,
    VIDEO
}
