package com.tutor.grading.service;

import com.tutor.common.dto.Content;
import com.tutor.common.dto.LevelGradingResult;
import com.tutor.common.dto.QualityMetrics;
import com.tutor.common.dto.QualityScore;
import com.tutor.common.dto.SourceSignals;
import com.tutor.grading.grader.LevelGrader;
import com.tutor.grading.metrics.QualityMetricsCalculator;
import com.tutor.grading.quality.ContentQualityAssessor;
import com.tutor.grading.quality.LevelAccuracyAssessor;
import com.tutor.grading.recommend.RecommendationGenerator;
import com.tutor.grading.validator.LevelAppropriatenessValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 内容评级服务：评级引擎对外的统一入口。
 * <p>
 * 所有操作都是内容与查找表的纯函数，可并发调用。
 */
@Service
@RequiredArgsConstructor
public class ContentGradingService {

    private final QualityMetricsCalculator metricsCalculator;
    private final LevelGrader levelGrader;
    private final LevelAppropriatenessValidator appropriatenessValidator;
    private final RecommendationGenerator recommendationGenerator;
    private final ContentQualityAssessor qualityAssessor;
    private final LevelAccuracyAssessor levelAccuracyAssessor;

    public QualityMetrics computeMetrics(Content content) {
        return metricsCalculator.computeMetrics(content);
    }

    /**
     * 评定内容等级。
     */
    public LevelGradingResult gradeContentLevel(Content content) {
        return levelGrader.grade(content);
    }

    /**
     * 内容对目标等级的适配度 (0-1)，跨体系时恒为 0。
     */
    public double validateLevelAppropriateness(Content content, String targetLevel) {
        return appropriatenessValidator.validate(content, targetLevel);
    }

    /**
     * 针对目标等级的改进建议：先通用短板，后等级专项。
     */
    public List<String> generateImprovementRecommendations(Content content, String targetLevel) {
        QualityMetrics metrics = metricsCalculator.computeMetrics(content);
        return recommendationGenerator.generate(metrics, content.getLanguage(), targetLevel);
    }

    public QualityScore assessContentQuality(Content content, SourceSignals signals) {
        return qualityAssessor.assess(content, signals);
    }

    /**
     * 使用默认来源信号评估质量。
     */
    public QualityScore assessContentQuality(Content content) {
        return qualityAssessor.assess(content, SourceSignals.DEFAULT);
    }

    /**
     * 声明等级与实际难度的吻合度。
     */
    public double assessLevelAccuracy(Content content) {
        return levelAccuracyAssessor.assess(content);
    }
}
