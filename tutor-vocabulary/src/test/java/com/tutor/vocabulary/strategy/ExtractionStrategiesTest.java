package com.tutor.vocabulary.strategy;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionStrategiesTest {

    @Test
    void should_CaptureDefinitionExampleAndPronunciation_When_DefinitionSentence() {
        ExtractionStrategy strategy = ExtractionStrategies.english().get(0);

        List<VocabularyCandidate> candidates = strategy.tryExtract(
                "The word 'Sophisticated' means extremely complex. For example: She used sophisticated methods. "
                        + "Pronunciation: /səˈfɪstɪkeɪtɪd/");

        assertThat(candidates).hasSize(1);
        VocabularyCandidate candidate = candidates.get(0);
        assertThat(candidate.getWord()).isEqualTo("sophisticated");
        assertThat(candidate.getDefinition()).isEqualTo("extremely complex");
        assertThat(candidate.getExampleSentence()).isEqualTo("She used sophisticated methods");
        assertThat(candidate.getReading()).isEqualTo("/səˈfɪstɪkeɪtɪd/");
    }

    @Test
    void should_ParseQuotedDash_When_ExampleInParentheses() {
        ExtractionStrategy strategy = ExtractionStrategies.english().get(1);

        List<VocabularyCandidate> candidates =
                strategy.tryExtract("'diligent' - showing steady careful effort (She is a diligent student)");

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.getWord()).isEqualTo("diligent");
            assertThat(c.getDefinition()).isEqualTo("showing steady careful effort");
            assertThat(c.getExampleSentence()).isEqualTo("She is a diligent student");
        });
    }

    @Test
    void should_ParseJapaneseQuotedMeaning_When_ReadingAndExamplePresent() {
        ExtractionStrategy strategy = ExtractionStrategies.japanese().get(0);

        List<VocabularyCandidate> candidates = strategy.tryExtract(
                "「努力」（どりょく）という言葉は「目標に向かって頑張ること」という意味です。例文：彼は毎日努力しました。");

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.getWord()).isEqualTo("努力");
            assertThat(c.getReading()).isEqualTo("どりょく");
            assertThat(c.getDefinition()).isEqualTo("目標に向かって頑張ること");
            assertThat(c.getExampleSentence()).isEqualTo("彼は毎日努力しました");
        });
    }

    @Test
    void should_StopBareWordAtSentenceEnd_When_PrecededBySentence() {
        ExtractionStrategy strategy = ExtractionStrategies.japanese().get(1);

        List<VocabularyCandidate> candidates =
                strategy.tryExtract("今日は勉強します。努力（どりょく）は「頑張ること」という意味です。");

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.getWord()).isEqualTo("努力");
            assertThat(c.getReading()).isEqualTo("どりょく");
            assertThat(c.getDefinition()).isEqualTo("頑張ること");
        });
    }

    @Test
    void should_ParseJapaneseDashGloss_When_ExampleInParentheses() {
        ExtractionStrategy strategy = ExtractionStrategies.japanese().get(2);

        List<VocabularyCandidate> candidates = strategy.tryExtract("努力 - 目標に向かって頑張ること (彼は努力しました)");

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.getWord()).isEqualTo("努力");
            assertThat(c.getReading()).isNull();
            assertThat(c.getDefinition()).isEqualTo("目標に向かって頑張ること");
            assertThat(c.getExampleSentence()).isEqualTo("彼は努力しました");
        });
    }

    @Test
    void should_RejectJapaneseDashGloss_When_MetaWordOrShortDefinition() {
        ExtractionStrategy strategy = ExtractionStrategies.japanese().get(2);

        assertThat(strategy.tryExtract("です - 丁寧な言い方 (これはペンです)")).isEmpty();
        assertThat(strategy.tryExtract("努力 - 頑 (彼は努力しました)")).isEmpty();
    }

    @Test
    void should_RejectJapaneseMetaWordsAndShortDefinitions() {
        VocabularyCandidate meta = VocabularyCandidate.builder().word("という意味").definition("説明の言葉").build();
        VocabularyCandidate shortDefinition = VocabularyCandidate.builder().word("努力").definition("頑").build();
        VocabularyCandidate valid = VocabularyCandidate.builder().word("努力").definition("頑張ること").build();

        assertThat(CandidateValidator.isValidJapanese(meta)).isFalse();
        assertThat(CandidateValidator.isValidJapanese(shortDefinition)).isFalse();
        assertThat(CandidateValidator.isValidJapanese(valid)).isTrue();
    }

    @Test
    void should_RejectMetaWordsAndShortDefinitions() {
        VocabularyCandidate meta = VocabularyCandidate.builder().word("example").definition("a sample thing").build();
        VocabularyCandidate shortDefinition = VocabularyCandidate.builder().word("apple").definition("red").build();
        VocabularyCandidate latinInJapanese = VocabularyCandidate.builder().word("abc").definition("意味です").build();

        assertThat(CandidateValidator.isValidEnglish(meta, 3)).isFalse();
        assertThat(CandidateValidator.isValidEnglish(shortDefinition, 3)).isFalse();
        assertThat(CandidateValidator.isValidJapanese(latinInJapanese)).isFalse();
    }
}
