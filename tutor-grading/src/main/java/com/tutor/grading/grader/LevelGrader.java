package com.tutor.grading.grader;

import com.tutor.common.dto.Content;
import com.tutor.common.dto.Language;
import com.tutor.common.dto.LevelFamily;
import com.tutor.common.dto.LevelGradingResult;
import com.tutor.common.dto.QualityMetrics;
import com.tutor.common.util.ScoreUtils;
import com.tutor.common.util.ScriptProfile;
import com.tutor.common.util.TextStats;
import com.tutor.grading.lookup.CetLevelCriteria;
import com.tutor.grading.lookup.JlptLevelCriteria;
import com.tutor.grading.lookup.LookupTables;
import com.tutor.grading.metrics.QualityMetricsCalculator;
import com.tutor.grading.recommend.RecommendationGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 等级评定器：为内容所属体系内的每个等级打分，选出最匹配的等级并校准置信度。
 * <p>
 * 单个等级的分数 = 0.4 × 基础质量分 + 0.6 × 等级匹配分 + 等级加成，截断到 [0.3, 1.0]。
 * 跨体系的等级既不计算也不出现在结果中。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LevelGrader {

    /** 未知语言的统一等级 */
    public static final String GENERIC_LEVEL = "intermediate";

    /** 任一等级的最低分 */
    static final double SCORE_FLOOR = 0.3;

    private static final double GENERIC_CONFIDENCE = 0.5;

    private final LookupTables tables;
    private final QualityMetricsCalculator metricsCalculator;
    private final RecommendationGenerator recommendationGenerator;

    public LevelGradingResult grade(Content content) {
        Language language = content.getLanguage();
        return switch (language) {
            case ENGLISH -> {
                QualityMetrics metrics = metricsCalculator.computeMetrics(content);
                yield select(content, metrics, scoreCetLevels(content, metrics));
            }
            case JAPANESE -> {
                QualityMetrics metrics = metricsCalculator.computeMetrics(content);
                yield select(content, metrics, scoreJlptLevels(content, metrics));
            }
            case OTHER -> genericResult(content);
        };
    }

    // ======================== CET ========================

    Map<String, Double> scoreCetLevels(Content content, QualityMetrics metrics) {
        String text = content.fullText();
        List<String> words = TextStats.englishWords(text.toLowerCase(Locale.ROOT));
        Map<String, Double> scores = new LinkedHashMap<>();

        if (words.isEmpty()) {
            LevelFamily.CET.getLevels().forEach(level -> scores.put(level, SCORE_FLOOR));
            return scores;
        }

        double avgWordLength = TextStats.averageWordLength(words);
        List<String> sentences = TextStats.englishSentences(text);
        double avgSentenceLength = sentences.isEmpty() ? 0.0 : (double) words.size() / sentences.size();

        for (CetLevelCriteria criteria : tables.getCetCriteria().values()) {
            scores.put(criteria.getLevel(), cetLevelScore(criteria, avgWordLength, avgSentenceLength, metrics));
        }
        return scores;
    }

    private double cetLevelScore(CetLevelCriteria criteria, double avgWordLength, double avgSentenceLength,
                                 QualityMetrics metrics) {
        double complexity = metrics.getGrammarComplexity();

        double wordLengthMatch = ScoreUtils.clamp01(
                1.0 - Math.abs(avgWordLength - criteria.getTargetWordLength()) / 3.0);
        double sentenceLengthMatch = ScoreUtils.clamp01(
                1.0 - Math.abs(avgSentenceLength - criteria.getTargetSentenceLength()) / 10.0);
        double complexityMatch = ScoreUtils.clamp01(1.0 - Math.abs(complexity - criteria.getTargetComplexity()));

        double levelMatch = wordLengthMatch * 0.3 + sentenceLengthMatch * 0.3 + complexityMatch * 0.4;
        double base = metrics.getVocabularyAppropriateness() * 0.4
                + metrics.getReadability() * 0.3
                + metrics.getEducationalValue() * 0.3;

        double boost = cetLevelBoost(criteria.getLevel(), complexity) + vocabularyBoost(metrics);
        return ScoreUtils.clamp(base * 0.4 + levelMatch * 0.6 + boost, SCORE_FLOOR, 1.0);
    }

    /**
     * 复杂度明显偏低时加成 CET-4，明显偏高时加成 CET-6，中等时加成 CET-5。
     */
    static double cetLevelBoost(String level, double grammarComplexity) {
        return switch (level) {
            case "CET-4" -> grammarComplexity < 0.4 ? 0.15 : 0.0;
            case "CET-5" -> grammarComplexity >= 0.3 && grammarComplexity <= 0.7 ? 0.1 : 0.0;
            case "CET-6" -> grammarComplexity > 0.6 ? 0.15 : 0.0;
            default -> 0.0;
        };
    }

    // ======================== JLPT ========================

    Map<String, Double> scoreJlptLevels(Content content, QualityMetrics metrics) {
        ScriptProfile profile = TextStats.scriptProfile(content.fullText());
        Map<String, Double> scores = new LinkedHashMap<>();

        if (profile.isEmpty()) {
            LevelFamily.JLPT.getLevels().forEach(level -> scores.put(level, SCORE_FLOOR));
            return scores;
        }

        for (JlptLevelCriteria criteria : tables.getJlptCriteria().values()) {
            scores.put(criteria.getLevel(), jlptLevelScore(criteria, profile, metrics));
        }
        return scores;
    }

    private double jlptLevelScore(JlptLevelCriteria criteria, ScriptProfile profile, QualityMetrics metrics) {
        double kanjiRatio = profile.kanjiRatio();
        double complexity = metrics.getGrammarComplexity();

        double kanjiMatch = ScoreUtils.clamp01(1.0 - Math.abs(kanjiRatio - criteria.getTargetKanjiRatio()) * 2.0);
        double complexityMatch = ScoreUtils.clamp01(1.0 - Math.abs(complexity - criteria.getTargetComplexity()));

        double levelMatch = kanjiMatch * 0.4 + complexityMatch * 0.4 + metrics.getVocabularyAppropriateness() * 0.2;
        double base = metrics.getAuthenticity() * 0.4
                + metrics.getReadability() * 0.3
                + metrics.getEducationalValue() * 0.3;

        double boost = jlptLevelBoost(criteria.getLevel(), kanjiRatio, profile.hiraganaRatio())
                + vocabularyBoost(metrics);
        return ScoreUtils.clamp(base * 0.4 + levelMatch * 0.6 + boost, SCORE_FLOOR, 1.0);
    }

    /**
     * 汉字少且平假名多时加成 N5，汉字密集时加成 N1，中等汉字占比时加成 N2/N3。
     */
    static double jlptLevelBoost(String level, double kanjiRatio, double hiraganaRatio) {
        return switch (level) {
            case "N5" -> kanjiRatio < 0.15 && hiraganaRatio > 0.6 ? 0.15 : 0.0;
            case "N3", "N2" -> kanjiRatio >= 0.2 && kanjiRatio <= 0.4 ? 0.1 : 0.0;
            case "N1" -> kanjiRatio > 0.4 ? 0.15 : 0.0;
            default -> 0.0;
        };
    }

    // ======================== 选择与校准 ========================

    private static double vocabularyBoost(QualityMetrics metrics) {
        return metrics.getVocabularyAppropriateness() > 0.7 ? 0.1 : 0.0;
    }

    /**
     * 按等级顺序取最高分（并列时取较易的等级），置信度低于下限时提升并回写。
     */
    private LevelGradingResult select(Content content, QualityMetrics metrics, Map<String, Double> scores) {
        String assignedLevel = null;
        double confidence = -1.0;
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            if (entry.getValue() > confidence) {
                assignedLevel = entry.getKey();
                confidence = entry.getValue();
            }
        }

        if (confidence < SCORE_FLOOR) {
            confidence = Math.max(SCORE_FLOOR, confidence + 0.1);
            scores.put(assignedLevel, confidence);
        }

        log.debug("内容 {} 评定为 {} (置信度 {}), 各等级得分: {}",
                content.getContentId(), assignedLevel, ScoreUtils.round(confidence, 3), scores);

        return LevelGradingResult.builder()
                .assignedLevel(assignedLevel)
                .confidenceScore(confidence)
                .levelScores(Collections.unmodifiableMap(scores))
                .qualityMetrics(metrics)
                .recommendations(recommendationGenerator.generate(metrics, content.getLanguage(), assignedLevel))
                .build();
    }

    private LevelGradingResult genericResult(Content content) {
        log.warn("内容 {} 语言未知，按通用等级 {} 处理", content.getContentId(), GENERIC_LEVEL);
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put(GENERIC_LEVEL, GENERIC_CONFIDENCE);
        return LevelGradingResult.builder()
                .assignedLevel(GENERIC_LEVEL)
                .confidenceScore(GENERIC_CONFIDENCE)
                .levelScores(Collections.unmodifiableMap(scores))
                .qualityMetrics(QualityMetricsCalculator.GENERIC_METRICS)
                .recommendation(RecommendationGenerator.UNKNOWN_LANGUAGE)
                .build();
    }
}
