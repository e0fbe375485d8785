package com.tutor.common.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * 内容语言。未识别的语言代码统一归入 {@link #OTHER}。
 */
public enum Language {

    ENGLISH("english", LevelFamily.CET),
    JAPANESE("japanese", LevelFamily.JLPT),
    OTHER("other", null);

    private final String code;
    private final LevelFamily family;

    Language(String code, LevelFamily family) {
        this.code = code;
        this.family = family;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /** 该语言对应的等级体系，OTHER 没有体系 */
    public Optional<LevelFamily> getFamily() {
        return Optional.ofNullable(family);
    }

    @JsonCreator
    public static Language fromCode(String code) {
        if (code == null) {
            return OTHER;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.code.equals(normalized)) {
                return language;
            }
        }
        return OTHER;
    }
}
