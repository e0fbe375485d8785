package com.tutor.vocabulary.context;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 截取目标词首次出现处前后的上下文，并对齐到完整句子。
 */
public final class ContextWindow {

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?。！？]");

    private ContextWindow() {
    }

    /**
     * @param occurrence  目标词在文本中的位置（英文按词边界、忽略大小写查找）
     * @param windowChars 目标词前后各保留的最大字符数，负数按 0 处理
     * @return 对齐后的上下文；找不到目标词时返回空串
     */
    public static String around(String text, Pattern occurrence, int windowChars) {
        Matcher m = occurrence.matcher(text);
        if (!m.find()) {
            return "";
        }
        int window = Math.max(0, windowChars);
        int start = Math.max(0, m.start() - window);
        int end = Math.min(text.length(), m.end() + window);

        // 起点后移到上一句结束之后
        Matcher before = SENTENCE_END.matcher(text).region(start, m.start());
        int lastBreak = -1;
        while (before.find()) {
            lastBreak = before.end();
        }
        if (lastBreak >= 0) {
            start = lastBreak;
        } else if (start > 0) {
            start = skipPartialWord(text, start);
        }

        // 终点收缩到最后一个完整句子
        Matcher after = SENTENCE_END.matcher(text).region(m.end(), end);
        int lastEnd = -1;
        while (after.find()) {
            lastEnd = after.end();
        }
        if (lastEnd >= 0) {
            end = lastEnd;
        }
        return text.substring(start, end).strip();
    }

    public static Pattern englishOccurrence(String word) {
        return Pattern.compile("\\b" + Pattern.quote(word) + "\\b", Pattern.CASE_INSENSITIVE);
    }

    public static Pattern japaneseOccurrence(String word) {
        return Pattern.compile(Pattern.quote(word));
    }

    private static int skipPartialWord(String text, int index) {
        int i = index;
        while (i < text.length() && Character.isLetter(text.charAt(i)) && Character.isLetter(text.charAt(i - 1))) {
            i++;
        }
        return i;
    }
}
