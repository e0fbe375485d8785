package com.tutor.grading.lookup;

import com.tutor.common.dto.LevelFamily;
import com.tutor.common.exception.LookupTableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 等级词表加载器。
 * <p>
 * 词表从 classpath 下按等级命名的文本文件加载，每行一个词，{@code #} 开头为注释：
 *
 * <pre>
 * resources/vocabulary/
 * ├── cet-4.txt … cet-6.txt
 * └── n5.txt … n1.txt
 * </pre>
 */
@Slf4j
public class LevelVocabularyLoader {

    private final String location;

    public LevelVocabularyLoader(String location) {
        this.location = location.endsWith("/") ? location : location + "/";
    }

    /**
     * 加载全部 CET 与 JLPT 等级词表，按体系内由易到难排列。
     *
     * @throws LookupTableException 任一词表缺失或无法读取
     */
    public Map<String, Set<String>> loadAll() {
        Map<String, Set<String>> vocabulary = new LinkedHashMap<>();
        for (LevelFamily family : LevelFamily.values()) {
            for (String level : family.getLevels()) {
                vocabulary.put(level, load(level));
            }
        }
        return Collections.unmodifiableMap(vocabulary);
    }

    Set<String> load(String level) {
        String path = location + level.toLowerCase(Locale.ROOT) + ".txt";
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw new LookupTableException("缺少等级词表: classpath:" + path);
        }
        try {
            String content = resource.getContentAsString(StandardCharsets.UTF_8);
            Set<String> words = new LinkedHashSet<>();
            for (String line : content.split("\\R")) {
                String word = line.strip();
                if (!word.isEmpty() && !word.startsWith("#")) {
                    words.add(word);
                }
            }
            log.debug("加载词表: {} ({} 个词)", path, words.size());
            return Collections.unmodifiableSet(words);
        } catch (IOException e) {
            log.error("加载词表失败: {}", path, e);
            throw new LookupTableException("无法读取等级词表: classpath:" + path, e);
        }
    }
}
