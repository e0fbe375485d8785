package com.tutor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 语言学习内容评级系统 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.tutor")
public class TutorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TutorApplication.class, args);
    }
}
