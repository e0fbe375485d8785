package com.tutor.grading.service;

import com.tutor.common.dto.Content;
import com.tutor.grading.GradingFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContentGradingServiceTest {

    private final ContentGradingService service = GradingFixtures.gradingService();

    @Test
    void should_RecommendForTargetLevel_When_TargetDiffersFromClaimed() {
        Content content = GradingFixtures.english("", GradingFixtures.SIMPLE_ENGLISH, "CET-4");

        List<String> recommendations = service.generateImprovementRecommendations(content, "CET-6");

        assertThat(recommendations).endsWith("使用更多高级词汇和复杂语法结构", "增加抽象概念和深度分析");
    }

    @Test
    void should_UseDefaultSignals_When_NoneGiven() {
        Content content = GradingFixtures.japanese(GradingFixtures.KANJI_JAPANESE, "N1");

        assertThat(service.assessContentQuality(content))
                .isEqualTo(service.assessContentQuality(content, null));
    }

    @Test
    void should_AgreeWithGrader_When_ValidatingAssignedLevel() {
        Content content = GradingFixtures.japanese(GradingFixtures.HIRAGANA_JAPANESE, "N5");

        double score = service.validateLevelAppropriateness(content, "N5");

        assertThat(score).isEqualTo(service.gradeContentLevel(content).getConfidenceScore());
        assertThat(service.assessLevelAccuracy(content)).isBetween(0.0, 1.0);
    }
}
