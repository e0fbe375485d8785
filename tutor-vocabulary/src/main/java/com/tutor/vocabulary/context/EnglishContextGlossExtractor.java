package com.tutor.vocabulary.context;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 英文上下文释义与例句恢复。英文不提供读音。
 */
public class EnglishContextGlossExtractor implements ContextGlossExtractor {

    private static final Set<String> CONNECTIVES = Set.of("means", "is defined as", "refers to");

    @Override
    public Optional<String> definition(String word, String context) {
        String w = Pattern.quote(word);
        List<Pattern> patterns = List.of(
                Pattern.compile("\\b" + w + "\\b\\s*(?:means|is defined as|refers to)\\s*([^.!?]+)",
                        Pattern.CASE_INSENSITIVE),
                Pattern.compile("(?:The word|word)\\s*['\"]?" + w + "['\"]?\\s*(?:means|is defined as)\\s*([^.!?]+)",
                        Pattern.CASE_INSENSITIVE),
                Pattern.compile(w + "\\s*[-–—]\\s*([^.!?]+)", Pattern.CASE_INSENSITIVE));

        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(context);
            if (m.find()) {
                String definition = m.group(1).strip();
                String lower = definition.toLowerCase(Locale.ROOT);
                if (definition.length() >= 5
                        && !lower.startsWith("for example")
                        && !lower.startsWith("example")
                        && !lower.startsWith("pronunciation")
                        && !CONNECTIVES.contains(lower)) {
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
                Pattern.compile("(?:For example|Example|e\\.g\\.)[:\\s]*([^.!?]*\\b" + w + "\\b[^.!?]*)[.!?]",
                        Pattern.CASE_INSENSITIVE),
                Pattern.compile("([^.!?]*\\b" + w + "\\b[^.!?]*)[.!?]", Pattern.CASE_INSENSITIVE));

        String lowerWord = word.toLowerCase(Locale.ROOT);
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(context);
            while (m.find()) {
                String example = m.group(1).strip();
                String lower = example.toLowerCase(Locale.ROOT);
                if (example.length() >= 10
                        && lower.contains(lowerWord)
                        && !lower.startsWith("means")
                        && !lower.startsWith("is defined as")
                        && !lower.startsWith("refers to")
                        && !lower.startsWith("pronunciation")
                        && !lower.equals(lowerWord)) {
                    return Optional.of(example);
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> reading(String word, String context) {
        return Optional.empty();
    }
}
