package com.tutor.grading.recommend;

import com.tutor.common.dto.Language;
import com.tutor.common.dto.QualityMetrics;
import com.tutor.grading.config.GradingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 改进建议生成器。
 * <p>
 * 纯阈值驱动：先按子指标短板给出通用建议，再追加目标等级的专项建议，顺序固定。
 */
@Component
@RequiredArgsConstructor
public class RecommendationGenerator {

    /** 未知语言的唯一建议 */
    public static final String UNKNOWN_LANGUAGE = "内容语言未知，无法提供具体建议";

    static final String VOCABULARY = "调整词汇难度以更好地匹配目标级别";
    static final String GRAMMAR = "增加语法结构的复杂性和多样性";
    static final String STRUCTURE = "改善内容结构和组织方式";
    static final String EDUCATIONAL = "增强教育价值，添加更多学习要点";
    static final String READABILITY = "提高可读性，简化复杂句式";

    private final GradingProperties properties;

    public List<String> generate(QualityMetrics metrics, Language language, String targetLevel) {
        GradingProperties.Recommendation thresholds = properties.getRecommendation();
        List<String> recommendations = new ArrayList<>();

        if (metrics.getVocabularyAppropriateness() < thresholds.getVocabularyThreshold()) {
            recommendations.add(VOCABULARY);
        }
        if (metrics.getGrammarComplexity() < thresholds.getGrammarThreshold()) {
            recommendations.add(GRAMMAR);
        }
        if (metrics.getContentStructure() < thresholds.getStructureThreshold()) {
            recommendations.add(STRUCTURE);
        }
        if (metrics.getEducationalValue() < thresholds.getEducationalThreshold()) {
            recommendations.add(EDUCATIONAL);
        }
        if (metrics.getReadability() < thresholds.getReadabilityThreshold()) {
            recommendations.add(READABILITY);
        }

        recommendations.addAll(switch (language) {
            case ENGLISH -> cetRecommendations(targetLevel);
            case JAPANESE -> jlptRecommendations(targetLevel);
            case OTHER -> List.of();
        });
        return recommendations;
    }

    private static List<String> cetRecommendations(String level) {
        if (level == null) {
            return List.of();
        }
        return switch (level) {
            case "CET-4" -> List.of("使用更多基础词汇和简单句式", "增加日常生活相关的内容");
            case "CET-5" -> List.of("平衡基础和中级词汇的使用", "添加更多学术和职场相关内容");
            case "CET-6" -> List.of("使用更多高级词汇和复杂语法结构", "增加抽象概念和深度分析");
            default -> List.of();
        };
    }

    private static List<String> jlptRecommendations(String level) {
        if (level == null) {
            return List.of();
        }
        return switch (level) {
            case "N5", "N4" -> List.of("减少汉字使用，增加平假名比例", "使用更多日常会话表达");
            case "N3" -> List.of("平衡汉字和假名的使用", "添加更多中级语法表达");
            case "N2", "N1" -> List.of("增加汉字和复杂语法的使用", "添加更多正式和书面语表达");
            default -> List.of();
        };
    }
}
