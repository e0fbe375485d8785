package com.tutor.grading.metrics;

import com.tutor.common.util.ScoreUtils;
import com.tutor.common.util.TextStats;
import com.tutor.grading.lookup.CetLevelCriteria;
import com.tutor.grading.lookup.GrammarPattern;
import com.tutor.grading.lookup.LookupTables;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 英文子指标：词汇适配度、语法复杂度、可读性。
 */
class EnglishMetrics {

    /** 未声明等级时的平均词长区间 */
    private static final double DEFAULT_MIN_WORD_LENGTH = 4.0;
    private static final double DEFAULT_MAX_WORD_LENGTH = 6.0;

    /** 语法复杂度归一化系数 */
    private static final double NORMALIZATION = 0.5;

    private final LookupTables tables;

    EnglishMetrics(LookupTables tables) {
        this.tables = tables;
    }

    double vocabularyAppropriateness(String text, String claimedLevel) {
        List<String> words = TextStats.englishWords(text.toLowerCase(Locale.ROOT));
        if (words.isEmpty()) {
            return 0.0;
        }

        double avgWordLength = TextStats.averageWordLength(words);
        double min = tables.cetCriteriaFor(claimedLevel)
                .map(CetLevelCriteria::getMinWordLength).orElse(DEFAULT_MIN_WORD_LENGTH);
        double max = tables.cetCriteriaFor(claimedLevel)
                .map(CetLevelCriteria::getMaxWordLength).orElse(DEFAULT_MAX_WORD_LENGTH);

        double score;
        if (avgWordLength < min) {
            score = Math.max(0.3, 1.0 - (min - avgWordLength) / 2.0);
        } else if (avgWordLength > max) {
            score = Math.max(0.3, 1.0 - (avgWordLength - max) / 3.0);
        } else {
            score = 1.0;
        }

        if ("CET-6".equals(claimedLevel) && containsAny(words, tables.getAdvancedEnglishWords())) {
            score = Math.min(1.0, score + 0.3);
        } else if ("CET-4".equals(claimedLevel) && containsAny(words, tables.getSimpleEnglishWords())) {
            score = Math.min(1.0, score + 0.2);
        }

        long educational = words.stream().filter(tables.getEducationalEnglishWords()::contains).count();
        double educationalBonus = Math.min(0.2, (double) educational / words.size() * 2.0);

        return ScoreUtils.clamp01(score + educationalBonus);
    }

    double grammarComplexity(String text) {
        int matchedPatterns = 0;
        double total = 0.0;
        for (GrammarPattern pattern : tables.getEnglishGrammarPatterns()) {
            int occurrences = TextStats.countMatches(pattern.getPattern(), text);
            if (occurrences > 0) {
                matchedPatterns++;
                total += pattern.getWeight() * Math.min(occurrences, 3);
            }
        }
        if (matchedPatterns == 0) {
            return 0.1;
        }

        List<String> sentences = TextStats.englishSentences(text);
        if (!sentences.isEmpty()) {
            double avgSentenceLength = (double) TextStats.englishWords(text).size() / sentences.size();
            total += Math.min(0.3, Math.max(0.0, avgSentenceLength - 6) / 30.0);
        }

        return ScoreUtils.clamp01(total / Math.max(1.0, matchedPatterns * NORMALIZATION));
    }

    double readability(String text) {
        List<String> sentences = TextStats.englishSentences(text);
        List<String> words = TextStats.englishWords(text);
        if (sentences.isEmpty() || words.isEmpty()) {
            return 0.0;
        }
        double avgSentenceLength = (double) words.size() / sentences.size();
        double avgWordLength = TextStats.averageWordLength(words);

        double sentenceScore = ScoreUtils.clamp01(1.0 - (avgSentenceLength - 10) / 20.0);
        double wordScore = ScoreUtils.clamp01(1.0 - (avgWordLength - 4) / 6.0);
        return (sentenceScore + wordScore) / 2;
    }

    private static boolean containsAny(List<String> words, Set<String> candidates) {
        for (String word : words) {
            if (candidates.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
