package com.tutor.grading.config;

import com.tutor.grading.lookup.LookupTables;
import com.tutor.grading.lookup.LookupTablesFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 评级模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.tutor.grading")
@EnableConfigurationProperties(GradingProperties.class)
public class GradingModuleConfig {

    @Bean
    public LookupTables lookupTables(GradingProperties properties) {
        return LookupTablesFactory.create(properties.getVocabularyLocation());
    }
}
