package com.tutor.grading.lookup;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * 语法表层特征及其复杂度权重。
 */
@Value
public class GrammarPattern {

    String name;
    Pattern pattern;
    double weight;

    public static GrammarPattern english(String name, String regex, double weight) {
        return new GrammarPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), weight);
    }

    public static GrammarPattern japanese(String name, String regex, double weight) {
        return new GrammarPattern(name, Pattern.compile(regex), weight);
    }
}
