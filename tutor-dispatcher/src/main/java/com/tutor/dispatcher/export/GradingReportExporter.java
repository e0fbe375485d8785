package com.tutor.dispatcher.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tutor.common.dto.LevelGradingResult;
import com.tutor.common.dto.QualityMetrics;
import com.tutor.common.exception.BatchGradingException;
import com.tutor.common.exception.UnsupportedExportFormatException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 评级报告导出，支持 json 与 csv 两种格式（大小写不敏感）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GradingReportExporter {

    static final String CSV_HEADER = String.join(",",
            "content_id", "assigned_level", "confidence_score",
            "vocabulary_appropriateness", "grammar_complexity", "content_structure",
            "educational_value", "readability", "engagement_factor",
            "level_scores", "recommendations");

    private final ObjectMapper objectMapper;

    /**
     * @param results 内容 ID 到评级结果的映射，导出顺序跟随映射的迭代顺序
     * @param format  json 或 csv
     * @throws UnsupportedExportFormatException 格式不受支持
     */
    public String export(Map<String, LevelGradingResult> results, String format) {
        String normalized = format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
        String report = switch (normalized) {
            case "json" -> toJson(results);
            case "csv" -> toCsv(results);
            default -> throw new UnsupportedExportFormatException(format);
        };
        log.info("导出评级报告: {} 条, 格式: {}", results.size(), normalized);
        return report;
    }

    private String toJson(Map<String, LevelGradingResult> results) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(results);
        } catch (JsonProcessingException e) {
            throw new BatchGradingException("评级报告序列化失败", e);
        }
    }

    private String toCsv(Map<String, LevelGradingResult> results) {
        StringBuilder sb = new StringBuilder(CSV_HEADER).append('\n');
        results.forEach((contentId, result) -> {
            if (result == null) {
                return;
            }
            QualityMetrics m = result.getQualityMetrics();
            List<String> cells = List.of(
                    escape(contentId),
                    escape(result.getAssignedLevel()),
                    number(result.getConfidenceScore()),
                    number(m.getVocabularyAppropriateness()),
                    number(m.getGrammarComplexity()),
                    number(m.getContentStructure()),
                    number(m.getEducationalValue()),
                    number(m.getReadability()),
                    number(m.getEngagementFactor()),
                    escape(levelScores(result.getLevelScores())),
                    escape(String.join("; ", result.getRecommendations())));
            sb.append(String.join(",", cells)).append('\n');
        });
        return sb.toString();
    }

    private static String levelScores(Map<String, Double> scores) {
        return scores.entrySet().stream()
                .map(e -> e.getKey() + "=" + number(e.getValue()))
                .collect(Collectors.joining(";"));
    }

    private static String number(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
