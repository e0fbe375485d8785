package com.tutor.common.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 调用方根据域名白名单、发布时间等计算出的来源信号。
 */
@Value
@Builder
public class SourceSignals {

    /** 未知来源的默认信号 */
    public static final SourceSignals DEFAULT = SourceSignals.builder().build();

    @Builder.Default
    double sourceReliability = 0.6;

    @Builder.Default
    double contentFreshness = 0.8;
}
