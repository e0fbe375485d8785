package com.tutor.grading.metrics;

import com.tutor.common.dto.Content;
import com.tutor.common.dto.ContentType;
import com.tutor.common.dto.QualityMetrics;
import com.tutor.grading.GradingFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QualityMetricsCalculatorTest {

    private final QualityMetricsCalculator calculator = GradingFixtures.metricsCalculator();

    @Test
    void should_ScoreSimpleEnglishAsLowComplexity() {
        QualityMetrics metrics = calculator.computeMetrics(
                GradingFixtures.english("", GradingFixtures.SIMPLE_ENGLISH, "CET-4"));

        assertThat(metrics.getGrammarComplexity()).isLessThan(0.3);
        assertThat(metrics.getVocabularyAppropriateness()).isEqualTo(1.0);
        assertThat(metrics.getReadability()).isEqualTo(1.0);
        assertThat(metrics.getContentStructure()).isCloseTo(0.4, within(1e-9));
        assertThat(metrics.getEducationalValue()).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void should_ScoreAcademicEnglishAsHighComplexity() {
        QualityMetrics metrics = calculator.computeMetrics(
                GradingFixtures.english("", GradingFixtures.ACADEMIC_ENGLISH, "CET-6"));

        assertThat(metrics.getGrammarComplexity()).isEqualTo(1.0);
    }

    @Test
    void should_ReturnFloorValues_When_ContentEmpty() {
        QualityMetrics metrics = calculator.computeMetrics(GradingFixtures.english("", "", "CET-4"));

        assertThat(metrics.getVocabularyAppropriateness()).isZero();
        assertThat(metrics.getGrammarComplexity()).isEqualTo(0.1);
        assertThat(metrics.getContentStructure()).isZero();
        assertThat(metrics.getReadability()).isZero();
    }

    @Test
    void should_UseFixedPlaceholders_When_AuthenticityAndCulture() {
        QualityMetrics metrics = calculator.computeMetrics(
                GradingFixtures.japanese(GradingFixtures.HIRAGANA_JAPANESE, "N5"));

        assertThat(metrics.getAuthenticity()).isEqualTo(0.8);
        assertThat(metrics.getCulturalRelevance()).isEqualTo(0.7);
    }

    @Test
    void should_ReturnGenericMetrics_When_LanguageUnknown() {
        QualityMetrics metrics = calculator.computeMetrics(GradingFixtures.other("Bonjour tout le monde."));

        assertThat(metrics).isEqualTo(QualityMetricsCalculator.GENERIC_METRICS);
    }

    @Test
    void should_RewardExercisesAndInteraction_When_ContentIsEngaging() {
        Content exercise = GradingFixtures.english("Grammar practice for learners",
                        "Let us study grammar and vocabulary with an example. For example, practice this exercise "
                                + "because learning takes time. What do you think? Try this quiz! "
                                + "Can you answer the question?", "CET-4")
                .toBuilder()
                .contentType(ContentType.EXERCISE)
                .build();

        QualityMetrics metrics = calculator.computeMetrics(exercise);

        assertThat(metrics.getEducationalValue()).isEqualTo(1.0);
        assertThat(metrics.getEngagementFactor()).isEqualTo(1.0);
        assertThat(metrics.getContentStructure()).isBetween(0.0, 1.0);
    }
}
