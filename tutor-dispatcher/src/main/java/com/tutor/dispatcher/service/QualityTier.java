package com.tutor.dispatcher.service;

/**
 * 内容质量分档。
 */
public enum QualityTier {
    EXCELLENT,
    GOOD,
    ACCEPTABLE,
    NEEDS_IMPROVEMENT
}
