package com.tutor.config;

import com.tutor.common.dto.LevelFamily;
import com.tutor.grading.config.GradingProperties;
import com.tutor.grading.lookup.LookupTables;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * 应用启动时检查等级词表的加载情况。
 * <p>
 * 词表为空不会阻止启动，但词汇匹配度与兜底抽取会退化，需要在日志里醒目提示。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LookupTablesInitializer implements CommandLineRunner {

    private final LookupTables lookupTables;
    private final GradingProperties properties;

    @Override
    public void run(String... args) {
        int emptyLevels = 0;
        for (LevelFamily family : LevelFamily.values()) {
            for (String level : family.getLevels()) {
                int size = lookupTables.vocabularyFor(level).size();
                if (size == 0) {
                    emptyLevels++;
                } else {
                    log.info("等级词表 {}: {} 个词", level, size);
                }
            }
        }

        if (emptyLevels > 0) {
            log.warn("==============================================");
            log.warn("  有 {} 个等级词表为空！", emptyLevels);
            log.warn("  请检查 classpath 目录: {}", properties.getVocabularyLocation());
            log.warn("  或在 application.yml 中设置:");
            log.warn("  tutor.grading.vocabulary-location: vocabulary/");
            log.warn("==============================================");
        }
    }
}
