package com.tutor.common.util;

import java.util.UUID;

/**
 * ID 生成器工具类。
 */
public final class IdGenerator {

    private IdGenerator() {
    }

    /**
     * 生成带前缀的 ID，如 "batch-xxxx"，后缀为 12 位去掉连字符的 UUID。
     */
    public static String withPrefix(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
