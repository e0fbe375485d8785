package com.tutor.grading.quality;

import com.tutor.common.dto.Content;
import com.tutor.common.util.ScoreUtils;
import com.tutor.common.util.ScriptProfile;
import com.tutor.common.util.TextStats;
import com.tutor.grading.lookup.CetLevelCriteria;
import com.tutor.grading.lookup.JlptLevelCriteria;
import com.tutor.grading.lookup.LookupTables;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 声明等级准确度：内容实际难度与其声明等级的吻合程度。
 */
@Component
@RequiredArgsConstructor
public class LevelAccuracyAssessor {

    private static final String DEFAULT_CET_LEVEL = "CET-5";
    private static final String DEFAULT_JLPT_LEVEL = "N3";

    /** 词表规模不足时的词汇匹配默认分 */
    private static final double DEFAULT_VOCABULARY_MATCH = 0.7;
    private static final int MIN_VOCABULARY_SIZE = 10;

    private final LookupTables tables;

    public double assess(Content content) {
        return switch (content.getLanguage()) {
            case ENGLISH -> assessCet(content);
            case JAPANESE -> assessJlpt(content);
            case OTHER -> 0.5;
        };
    }

    private double assessCet(Content content) {
        String text = content.fullText();
        List<String> words = TextStats.englishWords(text.toLowerCase(Locale.ROOT));
        if (words.isEmpty()) {
            return 0.5;
        }

        String level = content.getDifficultyLevel();
        CetLevelCriteria criteria = tables.cetCriteriaFor(level)
                .orElseGet(() -> tables.getCetCriteria().get(DEFAULT_CET_LEVEL));

        double avgWordLength = TextStats.averageWordLength(words);
        List<String> sentences = TextStats.englishSentences(text);
        double avgSentenceLength = sentences.isEmpty() ? 0.0 : (double) words.size() / sentences.size();

        double wordMatch = rangeMatch(avgWordLength,
                criteria.getMinWordLength(), criteria.getMaxWordLength(), 2.0, 3.0);
        double sentenceMatch = rangeMatch(avgSentenceLength,
                criteria.getMinSentenceLength(), criteria.getMaxSentenceLength(), 5.0, 8.0);

        double vocabularyMatch = DEFAULT_VOCABULARY_MATCH;
        Set<String> vocabulary = tables.vocabularyFor(level);
        if (vocabulary.size() > MIN_VOCABULARY_SIZE) {
            long matching = words.stream().filter(vocabulary::contains).count();
            vocabularyMatch = Math.min(1.0, (double) matching / words.size() + 0.3);
        }

        return ScoreUtils.clamp(wordMatch * 0.4 + sentenceMatch * 0.3 + vocabularyMatch * 0.3, 0.1, 1.0);
    }

    private double assessJlpt(Content content) {
        ScriptProfile profile = TextStats.scriptProfile(content.getBody());
        if (profile.isEmpty()) {
            return 0.0;
        }
        double target = tables.jlptCriteriaFor(content.getDifficultyLevel())
                .orElseGet(() -> tables.getJlptCriteria().get(DEFAULT_JLPT_LEVEL))
                .getTargetKanjiRatio();
        return Math.max(0.0, 1.0 - Math.abs(profile.kanjiRatio() - target) * 2);
    }

    /**
     * 区间内为 1.0，区间外按距离线性衰减（低于/高于区间各自的斜率分母），最低 0.3。
     */
    private static double rangeMatch(double value, double min, double max, double belowSpan, double aboveSpan) {
        if (value < min) {
            return Math.max(0.3, 1.0 - (min - value) / belowSpan);
        }
        if (value > max) {
            return Math.max(0.3, 1.0 - (value - max) / aboveSpan);
        }
        return 1.0;
    }
}
