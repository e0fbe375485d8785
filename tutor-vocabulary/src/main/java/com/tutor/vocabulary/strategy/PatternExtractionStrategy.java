package com.tutor.vocabulary.strategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于单个正则的抽取策略。捕获组编号为 0 表示该字段不由本模式提供。
 */
public class PatternExtractionStrategy implements ExtractionStrategy {

    private final String name;
    private final Pattern pattern;
    private final int wordGroup;
    private final int readingGroup;
    private final int definitionGroup;
    private final int exampleGroup;
    private final boolean lowercaseWord;
    private final Predicate<VocabularyCandidate> validator;

    PatternExtractionStrategy(String name, Pattern pattern,
                              int wordGroup, int readingGroup, int definitionGroup, int exampleGroup,
                              boolean lowercaseWord, Predicate<VocabularyCandidate> validator) {
        this.name = name;
        this.pattern = pattern;
        this.wordGroup = wordGroup;
        this.readingGroup = readingGroup;
        this.definitionGroup = definitionGroup;
        this.exampleGroup = exampleGroup;
        this.lowercaseWord = lowercaseWord;
        this.validator = validator;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<VocabularyCandidate> tryExtract(String text) {
        List<VocabularyCandidate> candidates = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return candidates;
        }
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            String word = group(m, wordGroup);
            if (word != null && lowercaseWord) {
                word = word.toLowerCase(Locale.ROOT);
            }
            VocabularyCandidate candidate = VocabularyCandidate.builder()
                    .word(word)
                    .reading(group(m, readingGroup))
                    .definition(group(m, definitionGroup))
                    .exampleSentence(group(m, exampleGroup))
                    .build();
            if (validator.test(candidate)) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    /** 取捕获组并去除首尾空白，缺失或为空时返回 null */
    private static String group(Matcher m, int index) {
        if (index <= 0) {
            return null;
        }
        String value = m.group(index);
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public String toString() {
        return name;
    }
}
