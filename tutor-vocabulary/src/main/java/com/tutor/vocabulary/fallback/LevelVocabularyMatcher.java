package com.tutor.vocabulary.fallback;

import com.tutor.common.dto.Language;
import com.tutor.grading.lookup.LookupTables;
import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 兜底匹配：找出文本中出现的等级词表词汇，按文中出现顺序返回。
 * <p>
 * 高频功能词和日语助词类片段不作为学习词汇。
 */
public class LevelVocabularyMatcher {

    static final Set<String> JAPANESE_STOP_WORDS =
            Set.of("という", "です", "ます", "した", "して", "から", "まで", "について", "として");

    private static final Pattern ENGLISH_TOKEN = Pattern.compile("\\b([a-zA-Z]{3,})\\b");

    private final LookupTables tables;

    public LevelVocabularyMatcher(LookupTables tables) {
        this.tables = tables;
    }

    public List<String> match(Language language, String text, Set<String> vocabulary, int limit) {
        if (vocabulary.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<String> found = switch (language) {
            case ENGLISH -> matchEnglish(text, vocabulary);
            case JAPANESE -> matchJapanese(text, vocabulary);
            case OTHER -> List.of();
        };
        return found.size() > limit ? List.copyOf(found.subList(0, limit)) : found;
    }

    private List<String> matchEnglish(String text, Set<String> vocabulary) {
        Set<String> found = new LinkedHashSet<>();
        Matcher m = ENGLISH_TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String token = m.group(1);
            if (vocabulary.contains(token) && !tables.isHighFrequencyWord(Language.ENGLISH, token)) {
                found.add(token);
            }
        }
        return new ArrayList<>(found);
    }

    /**
     * 日文没有空格分词，直接按词表逐词查找首次出现位置；同一位置优先较长的词。
     */
    private List<String> matchJapanese(String text, Set<String> vocabulary) {
        List<Occurrence> occurrences = new ArrayList<>();
        for (String word : vocabulary) {
            if (word.length() < 2
                    || JAPANESE_STOP_WORDS.contains(word)
                    || tables.isHighFrequencyWord(Language.JAPANESE, word)) {
                continue;
            }
            int index = text.indexOf(word);
            if (index >= 0) {
                occurrences.add(new Occurrence(word, index));
            }
        }
        occurrences.sort(Comparator.comparingInt(Occurrence::getIndex)
                .thenComparingInt(o -> -o.getWord().length()));

        List<String> found = new ArrayList<>();
        for (Occurrence occurrence : occurrences) {
            found.add(occurrence.getWord());
        }
        return found;
    }

    @Value
    private static class Occurrence {
        String word;
        int index;
    }
}
