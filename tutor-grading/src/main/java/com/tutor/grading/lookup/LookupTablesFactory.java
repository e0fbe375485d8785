package com.tutor.grading.lookup;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 查找表工厂。等级标准、语法权重与诊断词表内置于代码，等级词表从 classpath 加载。
 */
@Slf4j
public final class LookupTablesFactory {

    public static final String DEFAULT_VOCABULARY_LOCATION = "vocabulary/";

    private LookupTablesFactory() {
    }

    public static LookupTables createDefault() {
        return create(DEFAULT_VOCABULARY_LOCATION);
    }

    /**
     * @param vocabularyLocation 等级词表所在的 classpath 目录
     */
    public static LookupTables create(String vocabularyLocation) {
        Map<String, Set<String>> vocabulary = new LevelVocabularyLoader(vocabularyLocation).loadAll();

        LookupTables tables = LookupTables.builder()
                .cetCriteria(cetCriteria())
                .jlptCriteria(jlptCriteria())
                .englishGrammarPatterns(englishGrammarPatterns())
                .japaneseGrammarPatterns(japaneseGrammarPatterns())
                .englishWordFrequencies(englishWordFrequencies())
                .japaneseWordFrequencies(japaneseWordFrequencies())
                .levelVocabulary(vocabulary)
                .advancedEnglishWords(Set.of(
                        "sophisticated", "epistemological", "phenomenological", "analytical",
                        "comprehensive", "theoretical", "paradigms", "interpretations",
                        "considerations", "necessitate", "nuanced", "perspectives"))
                .simpleEnglishWords(Set.of(
                        "student", "school", "teacher", "friends", "nice", "many", "go", "am"))
                .educationalEnglishWords(Set.of(
                        "learn", "study", "education", "knowledge", "skill", "develop", "improve"))
                .japaneseEducationalTerms(List.of("学習", "勉強", "教育", "練習", "研究"))
                .educationalKeywords(List.of(
                        "learn", "study", "practice", "example", "exercise", "grammar", "vocabulary",
                        "学習", "勉強", "練習", "例", "文法", "語彙", "学习", "练习", "语法", "词汇"))
                .explanatoryConnectives(List.of(
                        "because", "therefore", "however", "for example", "such as",
                        "なぜなら", "だから", "しかし", "例えば", "因为", "所以", "但是", "例如"))
                .engagementWords(List.of(
                        "question", "quiz", "challenge", "game", "story", "dialogue",
                        "質問", "クイズ", "挑戦", "ゲーム", "物語", "会話",
                        "问题", "测验", "挑战", "游戏", "故事", "对话"))
                .interactivePhrases(List.of(
                        "what do you think", "try this", "can you", "let's",
                        "どう思いますか", "やってみて", "できますか", "一緒に",
                        "你觉得", "试试", "你能", "我们一起"))
                .explanatoryMarkers(List.of("example", "for instance", "such as", "例えば", "例如"))
                .build();

        log.info("查找表构建完成: CET {} 级, JLPT {} 级, 英语语法特征 {} 个, 日语语法特征 {} 个",
                tables.getCetCriteria().size(), tables.getJlptCriteria().size(),
                tables.getEnglishGrammarPatterns().size(), tables.getJapaneseGrammarPatterns().size());
        return tables;
    }

    // ======================== 等级标准 ========================

    private static Map<String, CetLevelCriteria> cetCriteria() {
        Map<String, CetLevelCriteria> criteria = new LinkedHashMap<>();
        criteria.put("CET-4", cet("CET-4", 4000, 3.5, 5.5, 5, 12, 4.5, 8, 0.3));
        criteria.put("CET-5", cet("CET-5", 5500, 4.5, 6.5, 8, 16, 5.5, 12, 0.5));
        criteria.put("CET-6", cet("CET-6", 6500, 5.5, 8.0, 12, 20, 6.5, 16, 0.8));
        return Collections.unmodifiableMap(criteria);
    }

    private static CetLevelCriteria cet(String level, int vocabularyRange,
                                        double minWord, double maxWord,
                                        double minSentence, double maxSentence,
                                        double targetWord, double targetSentence, double targetComplexity) {
        return CetLevelCriteria.builder()
                .level(level)
                .vocabularyRange(vocabularyRange)
                .minWordLength(minWord)
                .maxWordLength(maxWord)
                .minSentenceLength(minSentence)
                .maxSentenceLength(maxSentence)
                .targetWordLength(targetWord)
                .targetSentenceLength(targetSentence)
                .targetComplexity(targetComplexity)
                .build();
    }

    private static Map<String, JlptLevelCriteria> jlptCriteria() {
        Map<String, JlptLevelCriteria> criteria = new LinkedHashMap<>();
        criteria.put("N5", jlpt("N5", 100, 800, 0.1, 0.7, 0.2));
        criteria.put("N4", jlpt("N4", 300, 1500, 0.2, 0.6, 0.3));
        criteria.put("N3", jlpt("N3", 650, 3000, 0.3, 0.5, 0.5));
        criteria.put("N2", jlpt("N2", 1000, 6000, 0.4, 0.4, 0.7));
        criteria.put("N1", jlpt("N1", 2000, 10000, 0.5, 0.3, 0.9));
        return Collections.unmodifiableMap(criteria);
    }

    /**
     * 汉字占比区间取目标 ±0.05，平假名占比区间取目标 ±0.1。
     */
    private static JlptLevelCriteria jlpt(String level, int kanjiCount, int vocabularyRange,
                                          double kanjiRatio, double hiraganaRatio, double targetComplexity) {
        return JlptLevelCriteria.builder()
                .level(level)
                .kanjiCount(kanjiCount)
                .vocabularyRange(vocabularyRange)
                .targetKanjiRatio(kanjiRatio)
                .targetHiraganaRatio(hiraganaRatio)
                .minKanjiRatio(kanjiRatio - 0.05)
                .maxKanjiRatio(kanjiRatio + 0.05)
                .minHiraganaRatio(hiraganaRatio - 0.1)
                .maxHiraganaRatio(hiraganaRatio + 0.1)
                .targetComplexity(targetComplexity)
                .build();
    }

    // ======================== 语法特征 ========================

    private static List<GrammarPattern> englishGrammarPatterns() {
        return List.of(
                // 基础
                GrammarPattern.english("simple_present", "\\b(am|is|are|do|does)\\b", 0.1),
                GrammarPattern.english("simple_past", "\\b\\w+ed\\b|\\bwas\\b|\\bwere\\b", 0.15),
                // 中级
                GrammarPattern.english("present_continuous", "\\b(am|is|are)\\s+\\w+ing\\b", 0.2),
                GrammarPattern.english("present_perfect", "\\bhave\\s+\\w+ed\\b|\\bhas\\s+\\w+ed\\b", 0.3),
                GrammarPattern.english("modal_verbs", "\\b(would|could|might|should|must)\\b", 0.25),
                // 高级
                GrammarPattern.english("passive_voice", "\\b(is|are|was|were)\\s+\\w+ed\\b", 0.4),
                GrammarPattern.english("conditional", "\\bif\\s+\\w+.*would\\b", 0.5),
                GrammarPattern.english("complex_sentences",
                        "\\b(although|however|therefore|nevertheless|furthermore)\\b", 0.4),
                GrammarPattern.english("relative_clauses", "\\b(which|that|who|whom|whose)\\b", 0.35),
                GrammarPattern.english("subjunctive", "\\bif\\s+\\w+\\s+were\\b", 0.6));
    }

    private static List<GrammarPattern> japaneseGrammarPatterns() {
        return List.of(
                // 基础
                GrammarPattern.japanese("masu_form", "ます|ました", 0.1),
                GrammarPattern.japanese("desu_form", "です|でした", 0.1),
                GrammarPattern.japanese("basic_particles", "は|が|を|に|で|と", 0.05),
                // 中级
                GrammarPattern.japanese("te_form", "て|で", 0.2),
                GrammarPattern.japanese("potential", "できる|られる", 0.3),
                GrammarPattern.japanese("conditional", "ば|たら|なら", 0.25),
                // 高级
                GrammarPattern.japanese("passive", "れる|られる", 0.4),
                GrammarPattern.japanese("causative", "せる|させる", 0.5),
                GrammarPattern.japanese("keigo", "いらっしゃる|おっしゃる|なさる|いたします", 0.6),
                GrammarPattern.japanese("complex_grammar", "について|に関して|によって|において", 0.4),
                GrammarPattern.japanese("formal_expressions", "であります|でございます|いたします", 0.5));
    }

    // ======================== 词频 ========================

    private static Map<String, Double> englishWordFrequencies() {
        Map<String, Double> frequencies = new LinkedHashMap<>();
        String[] words = {"the", "be", "to", "of", "and", "a", "in", "that", "have", "i",
                "it", "for", "not", "on", "with", "he", "as", "you", "do", "at"};
        for (int i = 0; i < words.length; i++) {
            frequencies.put(words[i], 1.0 - i * 0.05);
        }
        return Collections.unmodifiableMap(frequencies);
    }

    private static Map<String, Double> japaneseWordFrequencies() {
        Map<String, Double> frequencies = new LinkedHashMap<>();
        String[] words = {"の", "に", "は", "を", "が", "で", "と", "た", "し", "て",
                "だ", "か", "な", "も", "から"};
        for (int i = 0; i < words.length; i++) {
            frequencies.put(words[i], 1.0 - i * 0.05);
        }
        return Collections.unmodifiableMap(frequencies);
    }
}
