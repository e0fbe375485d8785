package com.tutor.vocabulary.context;

import com.tutor.vocabulary.strategy.CandidateValidator;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 日文上下文读音、释义与例句恢复。
 */
public class JapaneseContextGlossExtractor implements ContextGlossExtractor {

    @Override
    public Optional<String> reading(String word, String context) {
        Pattern pattern = Pattern.compile(Pattern.quote(word) + "(?:（([^）]+)）|\\(([^)]+)\\))");
        Matcher m = pattern.matcher(context);
        if (m.find()) {
            String reading = m.group(1) != null ? m.group(1) : m.group(2);
            if (reading != null && !reading.isBlank()) {
                return Optional.of(reading.strip());
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> definition(String word, String context) {
        String w = Pattern.quote(word);
        List<Pattern> patterns = List.of(
                Pattern.compile(w + "(?:（[^）]*）)?(?:という言葉)?は「([^」]+)」という意味"),
                Pattern.compile(w + "(?:（[^）]*）)?は「([^」]+)」"),
                Pattern.compile(w + "\\s*[-–—]\\s*([^(]+)"));

        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(context);
            if (m.find()) {
                String definition = m.group(1).strip();
                if (definition.length() >= 2 && !CandidateValidator.JAPANESE_META_WORDS.contains(definition)) {
                    return Optional.of(definition);
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> example(String word, String context) {
        String w = Pattern.quote(word);
        List<Pattern> patterns = List.of(
                Pattern.compile("例文?[：:]([^。]*" + w + "[^。]*)。?"),
                Pattern.compile("([^。]*" + w + "[^。]*)。"));

        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(context);
            while (m.find()) {
                String example = m.group(1).strip();
                if (example.length() >= 5
                        && example.contains(word)
                        && !example.startsWith("という意味")
                        && !example.startsWith("は「")
                        && !example.startsWith("「")
                        && !example.equals(word)) {
                    return Optional.of(example);
                }
            }
        }
        return Optional.empty();
    }
}
