package com.tutor.grading.lookup;

import com.tutor.common.dto.Language;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 评级所需的全部静态参考数据。
 * <p>
 * 构造后不可变，由 {@link LookupTablesFactory} 一次性生成并注入各组件，可在线程间共享。
 */
@Value
@Builder
public class LookupTables {

    /** CET 等级标准，按 CET-4 → CET-6 排列 */
    Map<String, CetLevelCriteria> cetCriteria;

    /** JLPT 等级标准，按 N5 → N1 排列 */
    Map<String, JlptLevelCriteria> jlptCriteria;

    List<GrammarPattern> englishGrammarPatterns;
    List<GrammarPattern> japaneseGrammarPatterns;

    /** 高频功能词 */
    Map<String, Double> englishWordFrequencies;
    Map<String, Double> japaneseWordFrequencies;

    /** 各等级词表 */
    Map<String, Set<String>> levelVocabulary;

    // ===== 诊断词表 =====

    Set<String> advancedEnglishWords;
    Set<String> simpleEnglishWords;
    Set<String> educationalEnglishWords;
    List<String> japaneseEducationalTerms;
    List<String> educationalKeywords;
    List<String> explanatoryConnectives;
    List<String> engagementWords;
    List<String> interactivePhrases;
    List<String> explanatoryMarkers;

    public Optional<CetLevelCriteria> cetCriteriaFor(String level) {
        return level == null ? Optional.empty() : Optional.ofNullable(cetCriteria.get(level));
    }

    public Optional<JlptLevelCriteria> jlptCriteriaFor(String level) {
        return level == null ? Optional.empty() : Optional.ofNullable(jlptCriteria.get(level));
    }

    /**
     * 等级词表，未知等级返回空集合。
     */
    public Set<String> vocabularyFor(String level) {
        if (level == null) {
            return Collections.emptySet();
        }
        return levelVocabulary.getOrDefault(level, Collections.emptySet());
    }

    /**
     * 是否为高频功能词（the、of、の、に 等），这类词不作为学习词汇。
     */
    public boolean isHighFrequencyWord(Language language, String word) {
        return switch (language) {
            case ENGLISH -> englishWordFrequencies.containsKey(word.toLowerCase(Locale.ROOT));
            case JAPANESE -> japaneseWordFrequencies.containsKey(word);
            case OTHER -> false;
        };
    }
}
