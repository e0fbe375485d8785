package com.tutor.vocabulary.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 词汇抽取模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.tutor.vocabulary")
@EnableConfigurationProperties(VocabularyProperties.class)
public class VocabularyModuleConfig {
}
