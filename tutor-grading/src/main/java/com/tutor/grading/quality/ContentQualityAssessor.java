package com.tutor.grading.quality;

import com.tutor.common.dto.Content;
import com.tutor.common.dto.QualityMetrics;
import com.tutor.common.dto.QualityScore;
import com.tutor.common.dto.SourceSignals;
import com.tutor.common.util.ScoreUtils;
import com.tutor.grading.metrics.QualityMetricsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 综合质量评估：教育价值、难度匹配、来源可信度、新鲜度加权汇总。
 * <p>
 * 来源可信度与新鲜度由调用方根据域名白名单和发布时间算好后传入。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentQualityAssessor {

    private static final double GENERIC_EDUCATIONAL_VALUE = 0.6;
    private static final double GENERIC_DIFFICULTY_MATCH = 0.5;

    private final QualityMetricsCalculator metricsCalculator;
    private final LevelAccuracyAssessor levelAccuracyAssessor;

    public QualityScore assess(Content content, SourceSignals signals) {
        SourceSignals source = signals == null ? SourceSignals.DEFAULT : signals;
        double reliability = ScoreUtils.clamp01(source.getSourceReliability());
        double freshness = ScoreUtils.clamp01(source.getContentFreshness());

        QualityScore score = switch (content.getLanguage()) {
            case ENGLISH -> {
                QualityMetrics metrics = metricsCalculator.computeMetrics(content);
                yield weighted(content, metrics, reliability, freshness, metrics.getReadability());
            }
            case JAPANESE -> {
                QualityMetrics metrics = metricsCalculator.computeMetrics(content);
                yield weighted(content, metrics, reliability, freshness, metrics.getAuthenticity());
            }
            case OTHER -> QualityScore.builder()
                    .educationalValue(GENERIC_EDUCATIONAL_VALUE)
                    .difficultyMatch(GENERIC_DIFFICULTY_MATCH)
                    .sourceReliability(reliability)
                    .contentFreshness(freshness)
                    .overallScore(ScoreUtils.clamp01(GENERIC_EDUCATIONAL_VALUE * 0.4
                            + reliability * 0.3
                            + freshness * 0.2
                            + GENERIC_DIFFICULTY_MATCH * 0.1))
                    .build();
        };
        log.debug("内容 {} 质量总分: {}", content.getContentId(), ScoreUtils.round(score.getOverallScore(), 3));
        return score;
    }

    /**
     * @param languageSignal 英文取可读性，日文取地道性
     */
    private QualityScore weighted(Content content, QualityMetrics metrics,
                                  double reliability, double freshness, double languageSignal) {
        double educational = metrics.getEducationalValue();
        double difficultyMatch = levelAccuracyAssessor.assess(content);
        double overall = educational * 0.35
                + difficultyMatch * 0.25
                + reliability * 0.20
                + freshness * 0.10
                + languageSignal * 0.10;
        return QualityScore.builder()
                .educationalValue(educational)
                .difficultyMatch(difficultyMatch)
                .sourceReliability(reliability)
                .contentFreshness(freshness)
                .overallScore(ScoreUtils.clamp01(overall))
                .build();
    }
}
