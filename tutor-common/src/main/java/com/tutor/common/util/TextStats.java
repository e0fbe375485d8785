package com.tutor.common.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 表层文本统计：分词、分句、字符类别计数。
 * <p>
 * 所有方法对 null 输入返回空结果，无状态，线程安全。
 */
public final class TextStats {

    /** 英文单词：纯字母串 */
    public static final Pattern ENGLISH_WORD = Pattern.compile("\\b[a-zA-Z]+\\b");

    /** 英文句末标点 */
    public static final Pattern ENGLISH_SENTENCE_END = Pattern.compile("[.!?]+");

    /** 中英日句末标点 */
    public static final Pattern ANY_SENTENCE_END = Pattern.compile("[.!?。！？]");

    /** 日文句末标点 */
    public static final Pattern JAPANESE_SENTENCE_END = Pattern.compile("[。！？]");

    /** 任意日文字符（假名或汉字） */
    public static final Pattern JAPANESE_CHAR = Pattern.compile("[\\u3040-\\u309F\\u30A0-\\u30FF\\u4E00-\\u9FAF]");

    private TextStats() {
    }

    /**
     * 提取英文单词（保留原大小写）。
     */
    public static List<String> englishWords(String text) {
        List<String> words = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return words;
        }
        Matcher m = ENGLISH_WORD.matcher(text);
        while (m.find()) {
            words.add(m.group());
        }
        return words;
    }

    public static double averageWordLength(List<String> words) {
        if (words.isEmpty()) {
            return 0.0;
        }
        int totalLength = 0;
        for (String word : words) {
            totalLength += word.length();
        }
        return (double) totalLength / words.size();
    }

    /**
     * 按给定句末标点切分，去除首尾空白并丢弃空句。
     */
    public static List<String> sentences(String text, Pattern delimiter) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return sentences;
        }
        for (String part : delimiter.split(text)) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                sentences.add(trimmed);
            }
        }
        return sentences;
    }

    public static List<String> englishSentences(String text) {
        return sentences(text, ENGLISH_SENTENCE_END);
    }

    public static List<String> japaneseSentences(String text) {
        return sentences(text, JAPANESE_SENTENCE_END);
    }

    /**
     * 正则在文本中的不重叠匹配次数。
     */
    public static int countMatches(Pattern pattern, String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        Matcher m = pattern.matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }

    /**
     * 统计文本中的假名与汉字构成。
     */
    public static ScriptProfile scriptProfile(String text) {
        if (text == null || text.isEmpty()) {
            return new ScriptProfile(0, 0, 0);
        }
        int hiragana = 0;
        int katakana = 0;
        int kanji = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '\u3040' && c <= '\u309F') {
                hiragana++;
            } else if (c >= '\u30A0' && c <= '\u30FF') {
                katakana++;
            } else if (c >= '\u4E00' && c <= '\u9FAF') {
                kanji++;
            }
        }
        return new ScriptProfile(hiragana, katakana, kanji);
    }

    /**
     * 文本中出现了多少个给定词条（每个词条至多计一次，子串匹配）。
     */
    public static int countPresent(String text, Iterable<String> terms) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (String term : terms) {
            if (text.contains(term)) {
                count++;
            }
        }
        return count;
    }
}
