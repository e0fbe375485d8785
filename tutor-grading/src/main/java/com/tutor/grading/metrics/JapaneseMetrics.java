package com.tutor.grading.metrics;

import com.tutor.common.util.ScoreUtils;
import com.tutor.common.util.ScriptProfile;
import com.tutor.common.util.TextStats;
import com.tutor.grading.lookup.GrammarPattern;
import com.tutor.grading.lookup.JlptLevelCriteria;
import com.tutor.grading.lookup.LookupTables;

import java.util.List;

/**
 * 日文子指标：词汇适配度、语法复杂度、可读性。
 * <p>
 * 复杂度以汉字占比和平假名占比为主要信号。
 */
class JapaneseMetrics {

    /** 未声明等级时按 N3 评估 */
    private static final String DEFAULT_LEVEL = "N3";

    /** 可读性最佳汉字占比 */
    private static final double OPTIMAL_KANJI_RATIO = 0.3;

    private static final double NORMALIZATION = 0.4;

    private final LookupTables tables;

    JapaneseMetrics(LookupTables tables) {
        this.tables = tables;
    }

    double vocabularyAppropriateness(String text, String claimedLevel) {
        ScriptProfile profile = TextStats.scriptProfile(text);
        if (profile.isEmpty()) {
            return 0.0;
        }

        JlptLevelCriteria criteria = tables.jlptCriteriaFor(claimedLevel)
                .orElseGet(() -> tables.getJlptCriteria().get(DEFAULT_LEVEL));

        double kanjiDistance = outsideDistance(profile.kanjiRatio(),
                criteria.getMinKanjiRatio(), criteria.getMaxKanjiRatio());
        double hiraganaDistance = outsideDistance(profile.hiraganaRatio(),
                criteria.getMinHiraganaRatio(), criteria.getMaxHiraganaRatio());

        double kanjiScore = Math.max(0.3, 1.0 - kanjiDistance * 3.0);
        double hiraganaScore = Math.max(0.3, 1.0 - hiraganaDistance * 2.0);

        int educational = TextStats.countPresent(text, tables.getJapaneseEducationalTerms());
        double educationalBonus = Math.min(0.2, educational / 10.0);

        return ScoreUtils.clamp01(kanjiScore * 0.6 + hiraganaScore * 0.4 + educationalBonus);
    }

    double grammarComplexity(String text) {
        int matchedPatterns = 0;
        double total = 0.0;
        for (GrammarPattern pattern : tables.getJapaneseGrammarPatterns()) {
            int occurrences = TextStats.countMatches(pattern.getPattern(), text);
            if (occurrences > 0) {
                matchedPatterns++;
                total += pattern.getWeight() * Math.min(occurrences, 3);
            }
        }
        if (matchedPatterns == 0) {
            return 0.1;
        }

        List<String> sentences = TextStats.japaneseSentences(text);
        ScriptProfile profile = TextStats.scriptProfile(text);
        if (!sentences.isEmpty() && !profile.isEmpty()) {
            int chars = 0;
            for (String sentence : sentences) {
                chars += sentence.length();
            }
            double avgSentenceChars = (double) chars / sentences.size();
            total += profile.kanjiRatio() * 0.3;
            total += Math.min(0.2, Math.max(0.0, avgSentenceChars - 25) / 100.0);
        }

        return ScoreUtils.clamp01(total / Math.max(1.0, matchedPatterns * NORMALIZATION));
    }

    double readability(String text) {
        ScriptProfile profile = TextStats.scriptProfile(text);
        if (profile.isEmpty()) {
            return 0.0;
        }
        double kanjiScore = 1.0 - Math.abs(profile.kanjiRatio() - OPTIMAL_KANJI_RATIO);
        return ScoreUtils.clamp01(profile.hiraganaRatio() * 0.6 + kanjiScore * 0.4);
    }

    /** 值落在区间外的距离，区间内为 0 */
    private static double outsideDistance(double value, double min, double max) {
        if (value < min) {
            return min - value;
        }
        if (value > max) {
            return value - max;
        }
        return 0.0;
    }
}
