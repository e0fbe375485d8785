package com.tutor.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 批量调度配置项。
 */
@Data
@ConfigurationProperties(prefix = "tutor.dispatcher")
public class DispatcherProperties {

    /** 最大并发数 */
    private int maxConcurrent = 8;

    /** 质量分档阈值 */
    private Tiers tiers = new Tiers();

    @Data
    public static class Tiers {
        private double excellent = 0.9;
        private double good = 0.8;
        private double acceptable = 0.7;
    }
}
