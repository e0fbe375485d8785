package com.tutor.vocabulary.strategy;

import com.tutor.common.util.TextStats;

import java.util.Set;

/**
 * 候选词条有效性校验：排除片段、元词（means、example 等）和过短的释义。
 */
public final class CandidateValidator {

    static final Set<String> ENGLISH_META_WORDS =
            Set.of("means", "example", "pronunciation", "definition", "sentence");

    public static final Set<String> JAPANESE_META_WORDS =
            Set.of("という意味です", "という言葉", "という意味", "です", "ます");

    private static final int ENGLISH_MIN_DEFINITION = 5;
    private static final int JAPANESE_MIN_DEFINITION = 2;

    private CandidateValidator() {
    }

    /**
     * 英文：纯字母、不短于 minWordLength、非元词，且释义至少 5 个字符。
     */
    public static boolean isValidEnglish(VocabularyCandidate candidate, int minWordLength) {
        String word = candidate.getWord();
        String definition = candidate.getDefinition();
        return word != null
                && word.length() >= minWordLength
                && word.chars().allMatch(c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'))
                && !ENGLISH_META_WORDS.contains(word)
                && definition != null
                && definition.length() >= ENGLISH_MIN_DEFINITION;
    }

    /**
     * 日文：含假名或汉字、非元词，且释义至少 2 个字符。
     */
    public static boolean isValidJapanese(VocabularyCandidate candidate) {
        String word = candidate.getWord();
        String definition = candidate.getDefinition();
        return word != null
                && !word.isEmpty()
                && TextStats.JAPANESE_CHAR.matcher(word).find()
                && !JAPANESE_META_WORDS.contains(word)
                && definition != null
                && definition.length() >= JAPANESE_MIN_DEFINITION;
    }
}
