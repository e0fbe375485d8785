package com.tutor.vocabulary.fallback;

import com.tutor.common.dto.Language;
import com.tutor.grading.lookup.LookupTables;
import com.tutor.grading.lookup.LookupTablesFactory;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class LevelVocabularyMatcherTest {

    private static final LookupTables TABLES = LookupTablesFactory.createDefault();

    private final LevelVocabularyMatcher matcher = new LevelVocabularyMatcher(TABLES);

    @Test
    void should_ReturnWordsInTextOrderWithoutDuplicates_When_English() {
        String text = "Researchers speculate that the stable sphere is spectacular. The sphere is stable.";

        assertThat(matcher.match(Language.ENGLISH, text, TABLES.vocabularyFor("CET-6"), 5))
                .containsExactly("speculate", "stable", "sphere", "spectacular");
    }

    @Test
    void should_ExcludeHighFrequencyWords() {
        assertThat(matcher.match(Language.ENGLISH, "You have that thing.", Set.of("have", "that", "thing"), 5))
                .containsExactly("thing");
    }

    @Test
    void should_OrderByFirstOccurrence_When_Japanese() {
        String text = "日本の経済と政治について学びます。";

        assertThat(matcher.match(Language.JAPANESE, text, TABLES.vocabularyFor("N3"), 5))
                .containsExactly("経済", "政治");
    }

    @Test
    void should_HonorLimitAndEmptyVocabulary() {
        String text = "Researchers speculate that the stable sphere is spectacular.";

        assertThat(matcher.match(Language.ENGLISH, text, TABLES.vocabularyFor("CET-6"), 2))
                .containsExactly("speculate", "stable");
        assertThat(matcher.match(Language.ENGLISH, text, Set.of(), 5)).isEmpty();
    }
}
