package com.tutor.vocabulary.context;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContextWindowTest {

    private static final String TEXT = "First sentence here. The sphere is round. Last one follows now.";

    @Test
    void should_AlignToSentenceBoundaries_When_WindowCutsMidSentence() {
        String context = ContextWindow.around(TEXT, ContextWindow.englishOccurrence("sphere"), 12);

        assertThat(context).isEqualTo("The sphere is round.");
    }

    @Test
    void should_ReturnWordOnly_When_WindowNegative() {
        assertThat(ContextWindow.around(TEXT, ContextWindow.englishOccurrence("sphere"), -1)).isEqualTo("sphere");
        assertThat(ContextWindow.around(TEXT, ContextWindow.englishOccurrence("sphere"), 0)).isEqualTo("sphere");
    }

    @Test
    void should_ReturnEmpty_When_WordAbsent() {
        assertThat(ContextWindow.around(TEXT, ContextWindow.englishOccurrence("cube"), 50)).isEmpty();
    }

    @Test
    void should_RecoverEnglishDefinitionAndExample() {
        EnglishContextGlossExtractor gloss = new EnglishContextGlossExtractor();
        String context = "Scientists observed a sphere of gas. A sphere means a perfectly round solid.";

        assertThat(gloss.definition("sphere", context)).contains("a perfectly round solid");
        assertThat(gloss.example("sphere", context)).contains("Scientists observed a sphere of gas");
        assertThat(gloss.reading("sphere", context)).isEmpty();
    }

    @Test
    void should_RecoverJapaneseReadingAndDefinition() {
        JapaneseContextGlossExtractor gloss = new JapaneseContextGlossExtractor();
        String context = "日本の経済は大きいです。経済（けいざい）は「お金や物の流れ」という意味です。";

        assertThat(gloss.reading("経済", context)).contains("けいざい");
        assertThat(gloss.definition("経済", context)).contains("お金や物の流れ");
        assertThat(gloss.example("経済", context)).contains("日本の経済は大きいです");
    }
}
