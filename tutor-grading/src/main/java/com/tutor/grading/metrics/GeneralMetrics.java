package com.tutor.grading.metrics;

import com.tutor.common.dto.Content;
import com.tutor.common.dto.ContentType;
import com.tutor.common.util.TextStats;
import com.tutor.grading.lookup.LookupTables;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 与语言无关的子指标：内容结构、教育价值、趣味互动性，以及两个占位指标。
 */
class GeneralMetrics {

    /** 地道性：尚无真实的语言学分析，固定值占位 */
    static final double AUTHENTICITY = 0.8;

    /** 文化相关性：同上，固定值占位 */
    static final double CULTURAL_RELEVANCE = 0.7;

    private static final Pattern LIST_MARKER = Pattern.compile("[1-9]\\.|•|\\*|-");
    private static final Pattern QUESTION_MARK = Pattern.compile("[?？]");
    private static final Pattern EXCLAMATION_MARK = Pattern.compile("[!！]");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\n\n");

    private final LookupTables tables;

    GeneralMetrics(LookupTables tables) {
        this.tables = tables;
    }

    double contentStructure(Content content) {
        String title = content.getTitle();
        String body = content.getBody();
        double score = 0.0;

        if (title.strip().length() > 5) {
            score += 0.2;
        }

        int bodyLength = body.length();
        if (bodyLength >= 100 && bodyLength <= 2000) {
            score += 0.3;
        } else if (bodyLength > 50) {
            score += 0.2;
        }

        if (TextStats.sentences(body, TextStats.ANY_SENTENCE_END).size() >= 3) {
            score += 0.2;
        }

        if (nonBlankParagraphs(body) > 1) {
            score += 0.1;
        }

        if (LIST_MARKER.matcher(body).find()) {
            score += 0.1;
        }

        String lowerBody = body.toLowerCase(Locale.ROOT);
        if (TextStats.countPresent(lowerBody, tables.getExplanatoryMarkers()) > 0) {
            score += 0.1;
        }

        return Math.min(1.0, score);
    }

    double educationalValue(Content content) {
        String text = content.fullText().toLowerCase(Locale.ROOT);

        int keywords = TextStats.countPresent(text, tables.getEducationalKeywords());
        int connectives = TextStats.countPresent(text, tables.getExplanatoryConnectives());

        double score = Math.min(0.4, keywords / 10.0)
                + Math.min(0.3, connectives / 5.0)
                + contentTypeBonus(content.getContentType());
        return Math.min(1.0, score);
    }

    double engagementFactor(Content content) {
        String text = content.fullText().toLowerCase(Locale.ROOT);
        String body = content.getBody();

        double score = Math.min(0.4, TextStats.countPresent(text, tables.getEngagementWords()) / 5.0)
                + Math.min(0.3, TextStats.countPresent(text, tables.getInteractivePhrases()) / 3.0);
        if (QUESTION_MARK.matcher(body).find()) {
            score += 0.15;
        }
        if (EXCLAMATION_MARK.matcher(body).find()) {
            score += 0.15;
        }
        return Math.min(1.0, score);
    }

    private static double contentTypeBonus(ContentType type) {
        if (type == null) {
            return 0.0;
        }
        return switch (type) {
            case EXERCISE -> 0.3;
            case ARTICLE, DIALOGUE -> 0.2;
            case NEWS, CULTURAL -> 0.1;
            case AUDIO, VIDEO -> 0.0;
        };
    }

    private static int nonBlankParagraphs(String body) {
        int count = 0;
        for (String paragraph : PARAGRAPH_BREAK.split(body)) {
            if (!paragraph.isBlank()) {
                count++;
            }
        }
        return count;
    }
}
