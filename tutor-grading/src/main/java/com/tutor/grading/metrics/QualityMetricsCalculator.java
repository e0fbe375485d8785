package com.tutor.grading.metrics;

import com.tutor.common.dto.Content;
import com.tutor.common.dto.QualityMetrics;
import com.tutor.grading.lookup.LookupTables;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 质量指标计算器：从内容原文推导八项子指标。
 * <p>
 * 按语言分派；未知语言不做任何计算，直接返回 {@link #GENERIC_METRICS}。
 */
@Slf4j
@Component
public class QualityMetricsCalculator {

    /** 未知语言的通用指标 */
    public static final QualityMetrics GENERIC_METRICS = QualityMetrics.builder()
            .vocabularyAppropriateness(0.5)
            .grammarComplexity(0.5)
            .contentStructure(0.6)
            .educationalValue(0.6)
            .authenticity(0.5)
            .culturalRelevance(0.5)
            .readability(0.6)
            .engagementFactor(0.5)
            .build();

    private final GeneralMetrics general;
    private final EnglishMetrics english;
    private final JapaneseMetrics japanese;

    public QualityMetricsCalculator(LookupTables tables) {
        this.general = new GeneralMetrics(tables);
        this.english = new EnglishMetrics(tables);
        this.japanese = new JapaneseMetrics(tables);
    }

    public QualityMetrics computeMetrics(Content content) {
        QualityMetrics metrics = switch (content.getLanguage()) {
            case ENGLISH -> englishMetrics(content);
            case JAPANESE -> japaneseMetrics(content);
            case OTHER -> GENERIC_METRICS;
        };
        log.debug("内容 {} 质量指标: {}", content.getContentId(), metrics);
        return metrics;
    }

    private QualityMetrics englishMetrics(Content content) {
        String text = content.fullText();
        return QualityMetrics.builder()
                .vocabularyAppropriateness(english.vocabularyAppropriateness(text, content.getDifficultyLevel()))
                .grammarComplexity(english.grammarComplexity(text))
                .contentStructure(general.contentStructure(content))
                .educationalValue(general.educationalValue(content))
                .authenticity(GeneralMetrics.AUTHENTICITY)
                .culturalRelevance(GeneralMetrics.CULTURAL_RELEVANCE)
                .readability(english.readability(text))
                .engagementFactor(general.engagementFactor(content))
                .build();
    }

    private QualityMetrics japaneseMetrics(Content content) {
        String text = content.fullText();
        return QualityMetrics.builder()
                .vocabularyAppropriateness(japanese.vocabularyAppropriateness(text, content.getDifficultyLevel()))
                .grammarComplexity(japanese.grammarComplexity(text))
                .contentStructure(general.contentStructure(content))
                .educationalValue(general.educationalValue(content))
                .authenticity(GeneralMetrics.AUTHENTICITY)
                .culturalRelevance(GeneralMetrics.CULTURAL_RELEVANCE)
                .readability(japanese.readability(text))
                .engagementFactor(general.engagementFactor(content))
                .build();
    }
}
