package com.tutor.dispatcher.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 调度模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.tutor.dispatcher")
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherModuleConfig {
}
