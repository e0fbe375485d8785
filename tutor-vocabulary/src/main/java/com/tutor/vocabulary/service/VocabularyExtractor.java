package com.tutor.vocabulary.service;

import com.tutor.common.dto.Content;
import com.tutor.common.dto.Language;
import com.tutor.common.dto.VocabularyItem;
import com.tutor.grading.lookup.LookupTables;
import com.tutor.vocabulary.config.VocabularyProperties;
import com.tutor.vocabulary.context.ContextGlossExtractor;
import com.tutor.vocabulary.context.ContextWindow;
import com.tutor.vocabulary.context.EnglishContextGlossExtractor;
import com.tutor.vocabulary.context.JapaneseContextGlossExtractor;
import com.tutor.vocabulary.fallback.LevelVocabularyMatcher;
import com.tutor.vocabulary.strategy.ExtractionStrategies;
import com.tutor.vocabulary.strategy.ExtractionStrategy;
import com.tutor.vocabulary.strategy.VocabularyCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 词汇抽取服务：从学习内容中抽取带释义、例句、读音的词汇条目。
 * <p>
 * 流程：
 * - 按语言依次尝试结构化抽取策略，第一个产出有效候选的策略胜出，后续策略不再执行
 * - 全部落空时，用声明等级的词表与原文求交集，再从上下文恢复释义/例句/读音
 * - 每个条目打上内容的等级、语言和来源标签，最多返回 maxItems 个（不超过 10）
 */
@Slf4j
@Service
public class VocabularyExtractor {

    /** 单条内容返回条目数的硬上限，配置值超过时按此截断 */
    static final int MAX_ITEMS_PER_CONTENT = 10;

    private final LookupTables tables;
    private final VocabularyProperties properties;
    private final LevelVocabularyMatcher vocabularyMatcher;
    private final ContextGlossExtractor englishGloss = new EnglishContextGlossExtractor();
    private final ContextGlossExtractor japaneseGloss = new JapaneseContextGlossExtractor();

    public VocabularyExtractor(LookupTables tables, VocabularyProperties properties) {
        this.tables = tables;
        this.properties = properties;
        this.vocabularyMatcher = new LevelVocabularyMatcher(tables);
    }

    public List<VocabularyItem> extractLevelVocabulary(Content content) {
        Language language = content.getLanguage();
        if (language == Language.OTHER) {
            log.debug("内容 {} 语言未知，跳过词汇抽取", content.getContentId());
            return List.of();
        }

        String text = content.fullText();
        List<VocabularyCandidate> candidates = runCascade(content, strategiesFor(language), text);
        if (candidates.isEmpty()) {
            candidates = fallback(content, language, text);
        }

        Set<String> levelVocabulary = tables.vocabularyFor(content.getDifficultyLevel());
        boolean filterByLevel = properties.isLevelFilterEnabled() && !levelVocabulary.isEmpty();

        int maxItems = Math.min(MAX_ITEMS_PER_CONTENT, properties.getMaxItems());
        List<VocabularyItem> items = new ArrayList<>();
        for (VocabularyCandidate candidate : candidates) {
            if (items.size() >= maxItems) {
                break;
            }
            if (filterByLevel && !levelVocabulary.contains(candidate.getWord())) {
                continue;
            }
            items.add(toItem(candidate, content));
        }

        log.debug("内容 {} 抽取词汇 {} 个", content.getContentId(), items.size());
        return items;
    }

    private List<VocabularyCandidate> runCascade(Content content, List<ExtractionStrategy> strategies, String text) {
        for (ExtractionStrategy strategy : strategies) {
            List<VocabularyCandidate> candidates = strategy.tryExtract(text);
            if (!candidates.isEmpty()) {
                log.debug("内容 {} 由策略 {} 抽取到 {} 个候选", content.getContentId(), strategy.name(),
                        candidates.size());
                return candidates;
            }
        }
        return List.of();
    }

    /**
     * 结构化模式全部落空：等级词表求交集，再从句子对齐的上下文窗口恢复词条信息。
     */
    private List<VocabularyCandidate> fallback(Content content, Language language, String text) {
        Set<String> vocabulary = tables.vocabularyFor(content.getDifficultyLevel());
        List<String> words = vocabularyMatcher.match(language, text, vocabulary, properties.getFallbackMaxWords());
        if (words.isEmpty()) {
            return List.of();
        }

        ContextGlossExtractor gloss = glossFor(language);
        List<VocabularyCandidate> candidates = new ArrayList<>();
        for (String word : words) {
            Pattern occurrence = language == Language.ENGLISH
                    ? ContextWindow.englishOccurrence(word)
                    : ContextWindow.japaneseOccurrence(word);
            String context = ContextWindow.around(text, occurrence, properties.getContextWindowChars());
            candidates.add(VocabularyCandidate.builder()
                    .word(word)
                    .reading(gloss.reading(word, context).orElse(null))
                    .definition(gloss.definition(word, context).orElse(null))
                    .exampleSentence(gloss.example(word, context).orElse(null))
                    .build());
        }
        log.debug("内容 {} 未匹配结构化词条，从 {} 词表兜底得到 {} 个词",
                content.getContentId(), content.getDifficultyLevel(), candidates.size());
        return candidates;
    }

    private static List<ExtractionStrategy> strategiesFor(Language language) {
        return switch (language) {
            case ENGLISH -> ExtractionStrategies.english();
            case JAPANESE -> ExtractionStrategies.japanese();
            case OTHER -> List.of();
        };
    }

    private ContextGlossExtractor glossFor(Language language) {
        return switch (language) {
            case ENGLISH, OTHER -> englishGloss;
            case JAPANESE -> japaneseGloss;
        };
    }

    private static VocabularyItem toItem(VocabularyCandidate candidate, Content content) {
        return VocabularyItem.builder()
                .word(candidate.getWord())
                .reading(candidate.getReading())
                .definition(candidate.getDefinition())
                .exampleSentence(candidate.getExampleSentence())
                .level(content.getDifficultyLevel())
                .language(content.getLanguage().getCode())
                .sourceUrl(content.getSourceUrl())
                .build();
    }
}
