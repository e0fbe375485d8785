package com.tutor.common.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextStatsTest {

    @Test
    void should_SplitEnglishSentencesAndDropBlanks_When_TextHasTrailingPunctuation() {
        List<String> sentences = TextStats.englishSentences("I am a student. I go to school!! Really? ");

        assertThat(sentences).containsExactly("I am a student", "I go to school", "Really");
    }

    @Test
    void should_ExtractAlphabeticWordsOnly() {
        List<String> words = TextStats.englishWords("It's 2024, and CET-6 is hard.");

        assertThat(words).containsExactly("It", "s", "and", "CET", "is", "hard");
        assertThat(TextStats.averageWordLength(List.of("ab", "abcd"))).isEqualTo(3.0);
    }

    @Test
    void should_ReturnEmptyResults_When_TextIsNull() {
        assertThat(TextStats.englishWords(null)).isEmpty();
        assertThat(TextStats.japaneseSentences(null)).isEmpty();
        assertThat(TextStats.scriptProfile(null).isEmpty()).isTrue();
        assertThat(TextStats.countPresent(null, List.of("a"))).isZero();
    }

    @Test
    void should_CountScripts_When_TextIsJapanese() {
        ScriptProfile profile = TextStats.scriptProfile("私はカメラを買います。");

        assertThat(profile.getKanji()).isEqualTo(2);
        assertThat(profile.getKatakana()).isEqualTo(3);
        assertThat(profile.getHiragana()).isEqualTo(5);
        assertThat(profile.kanjiRatio()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void should_CountEachTermAtMostOnce_When_TermsRepeat() {
        int present = TextStats.countPresent("study and study again, for example", List.of("study", "example", "quiz"));

        assertThat(present).isEqualTo(2);
    }
}
