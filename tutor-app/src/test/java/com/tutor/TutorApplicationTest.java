package com.tutor;

import com.tutor.common.dto.Content;
import com.tutor.common.dto.Language;
import com.tutor.common.dto.LevelGradingResult;
import com.tutor.dispatcher.config.DispatcherProperties;
import com.tutor.dispatcher.export.GradingReportExporter;
import com.tutor.dispatcher.service.BatchGradingService;
import com.tutor.grading.service.ContentGradingService;
import com.tutor.vocabulary.service.VocabularyExtractor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class TutorApplicationTest {

    @Autowired
    private ContentGradingService gradingService;

    @Autowired
    private VocabularyExtractor vocabularyExtractor;

    @Autowired
    private BatchGradingService batchGradingService;

    @Autowired
    private GradingReportExporter reportExporter;

    @Autowired
    private DispatcherProperties dispatcherProperties;

    @Test
    void should_WireAllModules_When_ContextStarts() {
        Content content = Content.builder()
                .contentId("smoke")
                .body("The word 'sophisticated' means extremely complex. For example: She used sophisticated methods.")
                .language(Language.ENGLISH)
                .difficultyLevel("CET-6")
                .build();

        LevelGradingResult result = gradingService.gradeContentLevel(content);
        List<LevelGradingResult> batch = batchGradingService.gradeAll(List.of(content));

        assertThat(result.getLevelScores()).containsOnlyKeys("CET-4", "CET-5", "CET-6");
        assertThat(batch).containsExactly(result);
        assertThat(vocabularyExtractor.extractLevelVocabulary(content))
                .extracting(item -> item.getWord())
                .containsExactly("sophisticated");
        assertThat(reportExporter.export(Map.of("smoke", result), "json")).contains("\"smoke\"");
        assertThat(dispatcherProperties.getMaxConcurrent()).isEqualTo(8);
    }
}
