package com.tutor.vocabulary.service;

import com.tutor.common.dto.Content;
import com.tutor.common.dto.Language;
import com.tutor.common.dto.VocabularyItem;
import com.tutor.grading.lookup.LookupTables;
import com.tutor.grading.lookup.LookupTablesFactory;
import com.tutor.vocabulary.config.VocabularyProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VocabularyExtractorTest {

    private static final LookupTables TABLES = LookupTablesFactory.createDefault();

    private final VocabularyExtractor extractor = new VocabularyExtractor(TABLES, new VocabularyProperties());

    @Test
    void should_StopAtFirstProductiveStrategy_When_SeveralWouldMatch() {
        Content content = english("The word 'sophisticated' means extremely complex. "
                + "For example: She used sophisticated methods. diligent: showing steady effort.", "CET-6");

        List<VocabularyItem> items = extractor.extractLevelVocabulary(content);

        assertThat(items).extracting(VocabularyItem::getWord).containsExactly("sophisticated");
        assertThat(items.get(0).getDefinition()).isEqualTo("extremely complex");
        assertThat(items.get(0).getExampleSentence()).isEqualTo("She used sophisticated methods");
    }

    @Test
    void should_FallThroughToColonGloss_When_NoQuotedWords() {
        Content content = english("Vocabulary notes. diligent: showing steady care and effort.", "CET-5");

        List<VocabularyItem> items = extractor.extractLevelVocabulary(content);

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.getWord()).isEqualTo("diligent");
            assertThat(item.getDefinition()).isEqualTo("showing steady care and effort");
        });
    }

    @Test
    void should_TagItemsWithContentLevelLanguageAndSource() {
        Content content = english("The word 'sophisticated' means extremely complex.", "CET-6");

        VocabularyItem item = extractor.extractLevelVocabulary(content).get(0);

        assertThat(item.getLevel()).isEqualTo("CET-6");
        assertThat(item.getLanguage()).isEqualTo("english");
        assertThat(item.getSourceUrl()).isEqualTo("https://example.org/lesson");
        assertThat(item.getAudioUrl()).isNull();
    }

    @Test
    void should_FallBackToLevelVocabulary_When_NoStructuredEntries() {
        Content content = english("Researchers speculate that the stable sphere is spectacular. "
                + "The sphere means a round solid figure.", "CET-6");

        List<VocabularyItem> items = extractor.extractLevelVocabulary(content);

        assertThat(items).extracting(VocabularyItem::getWord)
                .containsExactly("speculate", "stable", "sphere", "spectacular");
        VocabularyItem sphere = items.get(2);
        assertThat(sphere.getDefinition()).isEqualTo("a round solid figure");
        assertThat(sphere.getExampleSentence()).isEqualTo("Researchers speculate that the stable sphere is spectacular");
        assertThat(items.get(0).getDefinition()).isNull();
    }

    @Test
    void should_FallBackWithReading_When_JapaneseHasNoStructuredEntries() {
        Content content = Content.builder()
                .contentId("ja-1")
                .body("日本の経済（けいざい）と政治について学びます。")
                .language(Language.JAPANESE)
                .difficultyLevel("N3")
                .build();

        List<VocabularyItem> items = extractor.extractLevelVocabulary(content);

        assertThat(items).extracting(VocabularyItem::getWord).containsExactly("経済", "政治");
        assertThat(items.get(0).getReading()).isEqualTo("けいざい");
        assertThat(items.get(0).getLanguage()).isEqualTo("japanese");
    }

    @Test
    void should_CapAtMaxItems() {
        VocabularyProperties properties = new VocabularyProperties();
        properties.setMaxItems(2);
        VocabularyExtractor capped = new VocabularyExtractor(TABLES, properties);
        Content content = english("The word 'sophisticated' means extremely complex. "
                + "The word 'spectacular' means very impressive to see. "
                + "The word 'spontaneous' means happening without planning.", "CET-6");

        assertThat(capped.extractLevelVocabulary(content))
                .extracting(VocabularyItem::getWord)
                .containsExactly("sophisticated", "spectacular");
    }

    @Test
    void should_CapAtTenItems_When_MaxItemsConfiguredHigher() {
        VocabularyProperties properties = new VocabularyProperties();
        properties.setMaxItems(50);
        VocabularyExtractor generous = new VocabularyExtractor(TABLES, properties);
        List<String> words = List.of("alpha", "bravo", "charlie", "delta", "echo", "foxtrot", "golf", "hotel",
                "india", "juliet", "kilo", "lima", "mike", "november", "oscar");
        StringBuilder body = new StringBuilder();
        for (String word : words) {
            body.append("The word '").append(word).append("' means a radio call sign. ");
        }

        List<VocabularyItem> items = generous.extractLevelVocabulary(english(body.toString(), "CET-6"));

        assertThat(items).extracting(VocabularyItem::getWord).containsExactlyElementsOf(words.subList(0, 10));
    }

    @Test
    void should_UseBareMeaning_When_JapaneseWordNotQuoted() {
        Content content = japanese("努力（どりょく）は「目標に向かって頑張ること」という意味です。例：彼は努力しました。");

        List<VocabularyItem> items = extractor.extractLevelVocabulary(content);

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.getWord()).isEqualTo("努力");
            assertThat(item.getReading()).isEqualTo("どりょく");
            assertThat(item.getDefinition()).isEqualTo("目標に向かって頑張ること");
            assertThat(item.getExampleSentence()).isEqualTo("彼は努力しました");
        });
    }

    @Test
    void should_UseDashGloss_When_NoJapaneseMeaningSentence() {
        Content content = japanese("努力 - 目標に向かって頑張ること (彼は努力しました)");

        List<VocabularyItem> items = extractor.extractLevelVocabulary(content);

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.getWord()).isEqualTo("努力");
            assertThat(item.getDefinition()).isEqualTo("目標に向かって頑張ること");
            assertThat(item.getExampleSentence()).isEqualTo("彼は努力しました");
        });
    }

    @Test
    void should_KeepOnlyLevelWords_When_LevelFilterEnabled() {
        VocabularyProperties properties = new VocabularyProperties();
        properties.setLevelFilterEnabled(true);
        VocabularyExtractor filtered = new VocabularyExtractor(TABLES, properties);
        Content content = english("The word 'sophisticated' means extremely complex. "
                + "Another word 'happy' means feeling good inside.", "CET-6");

        assertThat(extractor.extractLevelVocabulary(content)).hasSize(2);
        assertThat(filtered.extractLevelVocabulary(content))
                .extracting(VocabularyItem::getWord)
                .containsExactly("sophisticated");
    }

    @Test
    void should_ReturnEmpty_When_LanguageUnknown() {
        Content content = Content.builder()
                .contentId("x")
                .body("The word 'bonjour' means hello in French.")
                .language(Language.OTHER)
                .build();

        assertThat(extractor.extractLevelVocabulary(content)).isEmpty();
    }

    @Test
    void should_ReturnEmpty_When_NothingMatches() {
        assertThat(extractor.extractLevelVocabulary(english("Hello there.", "CET-4"))).isEmpty();
        assertThat(extractor.extractLevelVocabulary(english("Hello there.", null))).isEmpty();
    }

    private static Content japanese(String body) {
        return Content.builder()
                .contentId("ja-2")
                .body(body)
                .language(Language.JAPANESE)
                .difficultyLevel("N2")
                .build();
    }

    private static Content english(String body, String level) {
        return Content.builder()
                .contentId("en-1")
                .body(body)
                .language(Language.ENGLISH)
                .difficultyLevel(level)
                .sourceUrl("https://example.org/lesson")
                .build();
    }
}
