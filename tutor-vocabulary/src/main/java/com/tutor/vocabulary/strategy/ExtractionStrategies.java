package com.tutor.vocabulary.strategy;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 各语言的抽取策略链，按结构化程度由严到宽排列。
 */
public final class ExtractionStrategies {

    /**
     * The word 'sophisticated' means extremely complex. For example: She used sophisticated methods.
     * Pronunciation: /səˈfɪstɪkeɪtɪd/
     */
    private static final Pattern ENGLISH_DEFINITION_SENTENCE = Pattern.compile(
            "(?:The word|Another word)\\s*['\"]([a-zA-Z]{3,})['\"]"
                    + "(?:\\s*(?:means|which means|is defined as|refers to)\\s*([^.!?]+)[.!?])?"
                    + "\\s*(?:(?:For example|Example|e\\.g\\.)[:\\s]*([^.!?]+)[.!?])?"
                    + "\\s*(?:Pronunciation[:\\s]*(/[^/\\n]+/|\\[[^\\]\\n]+\\]))?",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    /** 'sophisticated' - extremely complex and refined (She used sophisticated methods) */
    private static final Pattern ENGLISH_QUOTED_DASH = Pattern.compile(
            "['\"]([a-zA-Z]{3,})['\"](?:\\s*[-–—]\\s*([^(.!?]+))?\\s*\\(([^)]+)\\)?",
            Pattern.CASE_INSENSITIVE);

    /** sophisticated: extremely complex and refined. Example: She used sophisticated methods */
    private static final Pattern ENGLISH_COLON_GLOSS = Pattern.compile(
            "\\b([a-zA-Z]{4,})\\s*:\\s*([^.!?]+)[.!?]?\\s*(?:Example[:\\s]*([^.!?]+))?",
            Pattern.CASE_INSENSITIVE);

    /** 「努力」（どりょく）という言葉は「目標に向かって頑張ること」という意味です。例文：彼は努力しました。 */
    private static final Pattern JAPANESE_QUOTED_MEANING = Pattern.compile(
            "「([^」]+)」(?:（([^）]+)）)?(?:という言葉)?は「([^」]+)」という意味です。?(?:例文?[：:]([^。]+)。?)?",
            Pattern.MULTILINE);

    /** 努力（どりょく）は「目標に向かって頑張ること」という意味です。例：彼は努力しました。 */
    private static final Pattern JAPANESE_BARE_MEANING = Pattern.compile(
            "([^\\s（。！？、]+)(?:（([^）]+)）)?は「([^」]+)」という意味です。?(?:例[：:]([^。]+)。?)?",
            Pattern.MULTILINE);

    /** 努力 - 目標に向かって頑張ること (彼は努力しました) */
    private static final Pattern JAPANESE_DASH_GLOSS = Pattern.compile(
            "([^\\s\\-]+)\\s*[-–—]\\s*([^(]+)\\s*\\(([^)]+)\\)",
            Pattern.MULTILINE);

    private static final List<ExtractionStrategy> ENGLISH = List.of(
            new PatternExtractionStrategy("english-definition-sentence", ENGLISH_DEFINITION_SENTENCE,
                    1, 4, 2, 3, true, c -> CandidateValidator.isValidEnglish(c, 3)),
            new PatternExtractionStrategy("english-quoted-dash", ENGLISH_QUOTED_DASH,
                    1, 0, 2, 3, true, c -> CandidateValidator.isValidEnglish(c, 3)),
            new PatternExtractionStrategy("english-colon-gloss", ENGLISH_COLON_GLOSS,
                    1, 0, 2, 3, true, c -> CandidateValidator.isValidEnglish(c, 4)));

    private static final List<ExtractionStrategy> JAPANESE = List.of(
            new PatternExtractionStrategy("japanese-quoted-meaning", JAPANESE_QUOTED_MEANING,
                    1, 2, 3, 4, false, CandidateValidator::isValidJapanese),
            new PatternExtractionStrategy("japanese-bare-meaning", JAPANESE_BARE_MEANING,
                    1, 2, 3, 4, false, CandidateValidator::isValidJapanese),
            new PatternExtractionStrategy("japanese-dash-gloss", JAPANESE_DASH_GLOSS,
                    1, 0, 2, 3, false, CandidateValidator::isValidJapanese));

    private ExtractionStrategies() {
    }

    public static List<ExtractionStrategy> english() {
        return ENGLISH;
    }

    public static List<ExtractionStrategy> japanese() {
        return JAPANESE;
    }
}
