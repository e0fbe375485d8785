package com.tutor.vocabulary.context;

import java.util.Optional;

/**
 * 从目标词的上下文中恢复释义、例句和读音。结果可能缺失。
 */
public interface ContextGlossExtractor {

    Optional<String> definition(String word, String context);

    Optional<String> example(String word, String context);

    Optional<String> reading(String word, String context);
}
